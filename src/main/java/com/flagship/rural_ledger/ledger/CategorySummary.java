package com.flagship.rural_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Credit and debit totals of one category in one month.
 * Entries without a category are reported under an empty string.
 */
@Value
public class CategorySummary {
    String category;
    int year;
    int month;
    BigDecimal totalCredit;
    BigDecimal totalDebit;
}
