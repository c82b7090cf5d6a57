package com.ledgerlens.backend.services.ledger;

import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.ledgerlens.backend.dto.LedgerTransactionDTO;
import com.ledgerlens.backend.entities.Category;
import com.ledgerlens.backend.entities.LedgerTransaction;
import com.ledgerlens.backend.repositories.LedgerTransactionRepository;
import com.ledgerlens.backend.services.statements.categorization.CategoryHierarchyProvider;

import lombok.RequiredArgsConstructor;

@Service
@RequiredArgsConstructor
public class LedgerQueryService {

    private final LedgerTransactionRepository transactionRepository;
    private final CategoryHierarchyProvider hierarchyProvider;

    /** Stored transactions with the category split back into category and sub-category. */
    @Transactional(readOnly = true)
    public List<LedgerTransactionDTO> listTransactions() {
        return transactionRepository.findAllWithCategories().stream()
                .map(LedgerQueryService::toDto)
                .toList();
    }

    public Map<String, List<String>> categoryTree() {
        return hierarchyProvider.current().asMap();
    }

    static LedgerTransactionDTO toDto(LedgerTransaction tx) {
        Category leaf = tx.getCategory();
        Category parent = leaf.getParent();
        String category = parent != null ? parent.getName() : leaf.getName();
        String subCategory = parent != null ? leaf.getName() : "";
        return new LedgerTransactionDTO(tx.getId(), tx.getDescription(), tx.getTransactionDate(), tx.getAmount(),
                category, subCategory);
    }
}
