package com.flagship.rural_ledger.sync;

import lombok.ToString;
import lombok.Value;

/**
 * Result of a password sign-in against the remote auth endpoint.
 */
@Value
public class AuthSession {
    String userId;
    String email;
    @ToString.Exclude
    String accessToken;
}
