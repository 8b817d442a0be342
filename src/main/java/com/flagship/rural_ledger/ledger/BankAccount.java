package com.flagship.rural_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Bank account whose running balance the ledger tracks.
 */
@Value
@Builder(toBuilder = true)
public class BankAccount {
    Long id;
    String code;
    String country;
    String bankCode;
    String bankName;
    String agency;
    String accountNumber;
    BigDecimal openingBalance;
    LocalDate openedOn;
}
