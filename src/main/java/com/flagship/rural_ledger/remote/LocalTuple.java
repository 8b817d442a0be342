package com.flagship.rural_ledger.remote;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Flat row consumed by the ledger table view and reports: display names
 * resolved, date in {@code dd/MM/yyyy}, balance already signed.
 */
@Value
public class LocalTuple {
    long id;
    String date;
    String propertyName;
    String documentNumber;
    String counterpartyName;
    String description;
    String kindLabel;
    BigDecimal credit;
    BigDecimal debit;
    BigDecimal signedBalance;
    String author;
}
