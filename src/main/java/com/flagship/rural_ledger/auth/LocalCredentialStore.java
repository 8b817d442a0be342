package com.flagship.rural_ledger.auth;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.rural_ledger.ledger.ValidationException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Offline credentials in two JSON files: {@code admin.json} holding the
 * administrator password and {@code users.json} mapping username to
 * password. The admin file is created with the default password on first use.
 */
@Slf4j
public class LocalCredentialStore {

    public static final String ADMIN_FILE = "admin.json";
    public static final String USERS_FILE = "users.json";

    private static final TypeReference<LinkedHashMap<String, String>> STRING_MAP = new TypeReference<>() {
    };

    private final Path directory;
    private final ObjectMapper objectMapper;
    private final String defaultAdminPassword;

    public LocalCredentialStore(Path directory, ObjectMapper objectMapper, String defaultAdminPassword) {
        this.directory = directory;
        this.objectMapper = objectMapper;
        this.defaultAdminPassword = defaultAdminPassword;
    }

    public synchronized boolean isAdminPassword(String password) {
        return password != null && password.equals(adminFile().get("password"));
    }

    public synchronized boolean validate(String username, String password) {
        if (username == null || password == null) {
            return false;
        }
        return password.equals(read(USERS_FILE).get(username.trim()));
    }

    /**
     * Registers a user. Only allowed with the administrator password.
     *
     * @throws ValidationException if the admin password is wrong, an input is blank or the user exists
     */
    public synchronized void register(String adminPassword, String username, String password) {
        if (!isAdminPassword(adminPassword)) {
            throw new ValidationException("Administrator password is incorrect");
        }
        if (username == null || username.isBlank() || password == null || password.isEmpty()) {
            throw new ValidationException("Username and password are required");
        }
        Map<String, String> users = read(USERS_FILE);
        String name = username.trim();
        if (users.containsKey(name)) {
            throw new ValidationException("User already exists: " + name);
        }
        users.put(name, password);
        write(USERS_FILE, users);
        log.info("Registered local user {}", name);
    }

    private Map<String, String> adminFile() {
        Map<String, String> admin = read(ADMIN_FILE);
        if (!admin.containsKey("password")) {
            admin.put("password", defaultAdminPassword);
            write(ADMIN_FILE, admin);
            log.info("Created {} with the default administrator password", directory.resolve(ADMIN_FILE));
        }
        return admin;
    }

    private Map<String, String> read(String name) {
        Path file = directory.resolve(name);
        if (!Files.exists(file)) {
            return new LinkedHashMap<>();
        }
        try {
            return objectMapper.readValue(file.toFile(), STRING_MAP);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read credentials file " + file, e);
        }
    }

    private void write(String name, Map<String, String> content) {
        try {
            Files.createDirectories(directory);
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(directory.resolve(name).toFile(), content);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write credentials file " + directory.resolve(name), e);
        }
    }
}
