package com.flagship.rural_ledger.ledger;

import lombok.Value;

/**
 * Other party of a ledger entry, identified by its tax id (CPF or CNPJ digits).
 */
@Value
public class Counterparty {
    Long id;
    String taxId;
    String name;
    int kind;
}
