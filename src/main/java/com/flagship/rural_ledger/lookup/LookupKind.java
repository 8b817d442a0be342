package com.flagship.rural_ledger.lookup;

/**
 * Kind of tax id looked up: company (CNPJ, 14 digits) or person (CPF, 11 digits).
 */
public enum LookupKind {
    CNPJ,
    CPF;

    public String cacheKey(String taxId) {
        return name().toLowerCase() + ":" + taxId;
    }
}
