package com.flagship.rural_ledger.auth;

import lombok.Value;

@Value
public class AppUser {
    long id;
    String username;
}
