package com.flagship.rural_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * A rural property that ledger entries are booked against.
 */
@Value
@Builder(toBuilder = true)
public class Property {
    Long id;
    String code;
    String name;
    String country;
    String currency;
    String landRegistry;
    String stateRegistration;
    String address;
    String city;
    String state;
    String zipCode;
    Integer explorationType;
    BigDecimal share;
    BigDecimal totalArea;
    BigDecimal usedArea;
}
