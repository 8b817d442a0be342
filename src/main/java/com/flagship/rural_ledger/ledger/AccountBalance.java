package com.flagship.rural_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Signed balance of the most recent (highest id) entry of an account.
 */
@Value
public class AccountBalance {
    long accountId;
    long entryId;
    BigDecimal signedBalance;
}
