package com.ledgerlens.backend.services.statements.categorization;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.ledgerlens.backend.services.statements.model.CategorizedTransaction;
import com.ledgerlens.backend.services.statements.model.NormalizedTransaction;
import com.ledgerlens.backend.services.statements.model.ProgressListener;

import lombok.extern.slf4j.Slf4j;

/**
 * Offline categorization. A sub-category name from the hierarchy found in the description
 * wins; otherwise the first matching keyword rule; otherwise "Uncategorized". Names and
 * keywords must start at a word boundary ("ola" matches "OLA CABS", not "COCA COLA").
 */
@Slf4j
@Component
public class KeywordCategorizer implements TransactionCategorizer {

    private static final int MIN_NAME_MATCH_LENGTH = 4;

    private record KeywordRule(String category, String subCategory, List<String> keywords) {
    }

    private static final List<KeywordRule> RULES = List.of(
            new KeywordRule("Food & Dining", "", List.of("restaurant", "food", "cafe", "dining", "swiggy", "zomato", "uber eats")),
            new KeywordRule("Transportation", "", List.of("uber", "ola", "metro", "bus", "taxi", "fuel", "petrol", "diesel")),
            new KeywordRule("Shopping", "", List.of("amazon", "flipkart", "mall", "store", "shopping", "purchase")),
            new KeywordRule("Bills & Utilities", "", List.of("electricity", "water", "gas", "internet", "mobile", "phone")),
            new KeywordRule("Healthcare", "", List.of("hospital", "clinic", "pharmacy", "medical", "doctor")),
            new KeywordRule("Entertainment", "", List.of("movie", "cinema", "netflix", "spotify", "game")),
            new KeywordRule("Transfer", "", List.of("transfer", "neft", "rtgs", "imps", "upi")),
            new KeywordRule("ATM", "", List.of("atm", "cash withdrawal")),
            new KeywordRule("Income", "Salary", List.of("salary", "wages", "payroll"))
    );

    @Override
    public CategorizationResult categorize(List<NormalizedTransaction> rows, CategoryHierarchy hierarchy,
                                           ProgressListener progress) {
        List<CategorizedTransaction> out = new ArrayList<>(rows.size());
        int defaulted = 0;
        for (NormalizedTransaction tx : rows) {
            CategorizedTransaction categorized = categorizeOne(tx, hierarchy);
            if (CategorizedTransaction.UNCATEGORIZED.equals(categorized.category())) {
                defaulted++;
            }
            out.add(categorized);
        }
        ProgressListener.orNoop(progress).onProgress(1.0, "keyword rules applied");
        log.info("[Categorization] keyword rules: {} rows, {} uncategorized", rows.size(), defaulted);
        return new CategorizationResult(out, defaulted, List.of());
    }

    CategorizedTransaction categorizeOne(NormalizedTransaction tx, CategoryHierarchy hierarchy) {
        String text = tx.description().toLowerCase(Locale.ROOT);

        for (Map.Entry<String, List<String>> e : hierarchy.asMap().entrySet()) {
            for (String sub : e.getValue()) {
                if (sub.length() >= MIN_NAME_MATCH_LENGTH && wholeWord(text, sub.toLowerCase(Locale.ROOT))) {
                    return CategorizedTransaction.of(tx, e.getKey(), sub);
                }
            }
        }

        for (KeywordRule rule : RULES) {
            if (rule.keywords().stream().anyMatch(k -> startsWord(text, k))) {
                String category = hierarchy.canonicalCategory(rule.category()).orElse(rule.category());
                String sub = hierarchy.canonicalSubCategory(category, rule.subCategory()).orElse(rule.subCategory());
                return CategorizedTransaction.of(tx, category, sub);
            }
        }
        return CategorizedTransaction.uncategorized(tx);
    }

    private static boolean wholeWord(String text, String phrase) {
        return Pattern.compile("\\b" + Pattern.quote(phrase) + "\\b").matcher(text).find();
    }

    private static boolean startsWord(String text, String keyword) {
        return Pattern.compile("\\b" + Pattern.quote(keyword)).matcher(text).find();
    }
}
