package com.ledgerlens.backend.services.statements.categorization;

import java.util.List;

import com.ledgerlens.backend.services.statements.model.NormalizedTransaction;
import com.ledgerlens.backend.services.statements.model.ProgressListener;

public interface TransactionCategorizer {

    /**
     * Assigns a category and sub-category to every row. Output order and length match the
     * input; rows that cannot be categorized get "Uncategorized" and an empty sub-category.
     */
    CategorizationResult categorize(List<NormalizedTransaction> rows, CategoryHierarchy hierarchy,
                                    ProgressListener progress);
}
