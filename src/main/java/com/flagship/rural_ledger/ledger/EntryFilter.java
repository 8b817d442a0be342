package com.flagship.rural_ledger.ledger;

import lombok.Builder;
import lombok.Value;

/**
 * Optional narrowing of an entry listing. Null fields do not filter.
 */
@Value
@Builder
public class EntryFilter {
    Long propertyId;
    Long accountId;
    Long counterpartyId;
    EntryKind kind;
    String category;
    String descriptionContains;

    public static EntryFilter none() {
        return EntryFilter.builder().build();
    }
}
