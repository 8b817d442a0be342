package com.flagship.rural_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Domain model for a ledger entry: one bookkeeping transaction of a rural producer.
 *
 * The ordinal date key is always derived from {@link #date}, never set on its own.
 * {@code id} is null until the store assigns one.
 */
@Value
@Builder(toBuilder = true)
public class LedgerEntry {
    Long id;
    LocalDate date;
    Long propertyId;
    Long accountId;
    String documentNumber;
    String documentType;
    String description;
    Long counterpartyId;
    EntryKind kind;
    BigDecimal credit;
    BigDecimal debit;
    BigDecimal closingBalance;
    BalanceSign balanceSign;
    String author;
    String category;
    String affectedArea;
    BigDecimal quantity;
    String unit;

    public Integer getOrdinalDate() {
        return date != null ? OrdinalDate.of(date) : null;
    }

    /**
     * Closing balance with the sign convention applied.
     */
    public BigDecimal getSignedBalance() {
        BalanceSign sign = balanceSign != null ? balanceSign : BalanceSign.POSITIVE;
        return sign.apply(closingBalance);
    }
}
