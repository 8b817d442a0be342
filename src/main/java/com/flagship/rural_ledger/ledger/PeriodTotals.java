package com.flagship.rural_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Credit and debit sums over a period. {@code period} is {@code yyyyMM} for
 * monthly rows and empty for a whole range.
 */
@Value
public class PeriodTotals {
    String period;
    BigDecimal totalCredit;
    BigDecimal totalDebit;

    public BigDecimal getNet() {
        return totalCredit.subtract(totalDebit);
    }
}
