package com.flagship.rural_ledger.ledger;

import lombok.Value;

import java.time.LocalDate;

/**
 * Inclusive range of ordinal date keys.
 */
@Value
public class OrdinalRange {
    int from;
    int to;

    public static OrdinalRange of(int from, int to) {
        if (from > to) {
            throw new ValidationException("Range start " + from + " is after range end " + to);
        }
        return new OrdinalRange(from, to);
    }

    public static OrdinalRange between(LocalDate from, LocalDate to) {
        return of(OrdinalDate.of(from), OrdinalDate.of(to));
    }

    public static OrdinalRange all() {
        return new OrdinalRange(0, 99991231);
    }
}
