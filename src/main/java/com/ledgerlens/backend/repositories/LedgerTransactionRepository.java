package com.ledgerlens.backend.repositories;

import java.util.List;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import com.ledgerlens.backend.entities.LedgerTransaction;

public interface LedgerTransactionRepository extends JpaRepository<LedgerTransaction, UUID> {

    @Query("select t from LedgerTransaction t "
            + "join fetch t.category c "
            + "left join fetch c.parent "
            + "order by t.transactionDate asc, t.createdAt asc")
    List<LedgerTransaction> findAllWithCategories();
}
