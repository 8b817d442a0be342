package com.flagship.rural_ledger.ledger;

/**
 * Kind of a ledger entry.
 * The remote backend stores the kind as an integer code.
 */
public enum EntryKind {
    REVENUE(1, "Revenue"),
    EXPENSE(2, "Expense"),
    ADVANCE(3, "Advance");

    private final int code;
    private final String label;

    EntryKind(int code, String label) {
        this.code = code;
        this.label = label;
    }

    public int getCode() {
        return code;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Resolves a remote code. Anything that is not 1 or 2 is an advance.
     */
    public static EntryKind fromCode(int code) {
        return switch (code) {
            case 1 -> REVENUE;
            case 2 -> EXPENSE;
            default -> ADVANCE;
        };
    }
}
