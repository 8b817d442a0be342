package com.flagship.rural_ledger.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.rural_ledger.ledger.ValidationException;
import com.flagship.rural_ledger.sync.AuthSession;
import com.flagship.rural_ledger.sync.SyncBridge;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;

/**
 * Application users kept in the remote backend, reached through its stored
 * procedures and password auth. Every call runs on the {@link SyncBridge}.
 */
@RequiredArgsConstructor
@Slf4j
public class AppUserService {

    private final SyncBridge bridge;

    /**
     * @return the user when the credentials match, empty otherwise
     */
    public Optional<AppUser> login(String username, String password) {
        requireCredentials(username, password);
        JsonNode result = bridge.submit("auth.login", session ->
            session.rpc("login_user", Map.of("p_username", username.trim(), "p_password", password)));
        JsonNode row = result != null && result.isArray() ? result.path(0) : result;
        if (row == null || row.isMissingNode() || row.isNull() || !row.hasNonNull("id")) {
            log.info("Login rejected for {}", username);
            return Optional.empty();
        }
        log.info("User {} logged in", username);
        return Optional.of(new AppUser(row.get("id").asLong(), row.path("username").asText(username)));
    }

    /**
     * @return the id of the new user
     * @throws com.flagship.rural_ledger.sync.RemoteOperationException if the username is taken
     */
    public long createUser(String username, String password) {
        requireCredentials(username, password);
        JsonNode id = bridge.submit("auth.createUser", session ->
            session.rpc("create_app_user", Map.of("p_username", username.trim(), "p_password", password)));
        if (id == null || !id.canConvertToLong()) {
            throw new ValidationException("create_app_user returned no id for " + username);
        }
        log.info("Created user {} with id {}", username, id.asLong());
        return id.asLong();
    }

    public boolean verify(String username, String password) {
        requireCredentials(username, password);
        JsonNode result = bridge.submit("auth.verify", session ->
            session.rpc("verify_app_user", Map.of("p_username", username.trim(), "p_password", password)));
        return result != null && result.asBoolean(false);
    }

    public AuthSession adminSignIn(String email, String password) {
        requireCredentials(email, password);
        return bridge.submit("auth.signIn", session -> session.signIn(email, password));
    }

    public void adminSignOut() {
        bridge.submit("auth.signOut", session -> {
            session.signOut();
            return null;
        });
    }

    private static void requireCredentials(String username, String password) {
        if (username == null || username.isBlank()) {
            throw new ValidationException("Username is required");
        }
        if (password == null || password.isEmpty()) {
            throw new ValidationException("Password is required");
        }
    }
}
