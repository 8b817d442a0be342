package com.flagship.rural_ledger.ledger;

import java.math.BigDecimal;

/**
 * Sign flag stored next to a closing balance magnitude.
 */
public enum BalanceSign {
    POSITIVE("P"),
    NEGATIVE("N");

    private final String code;

    BalanceSign(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public BigDecimal apply(BigDecimal magnitude) {
        BigDecimal value = magnitude != null ? magnitude : BigDecimal.ZERO;
        return this == POSITIVE ? value : value.negate();
    }

    /**
     * Null or blank codes default to positive; any other code than "P" is negative.
     */
    public static BalanceSign fromCode(String code) {
        if (code == null || code.isBlank()) {
            return POSITIVE;
        }
        return "P".equalsIgnoreCase(code.trim()) ? POSITIVE : NEGATIVE;
    }
}
