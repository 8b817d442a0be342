package com.flagship.rural_ledger.lookup;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * JSON file mapping {@code "<kind>:<id>"} to the last successful lookup
 * response. Loaded on first use and rewritten on every put.
 */
@Slf4j
public class LookupCache {

    private static final TypeReference<LinkedHashMap<String, JsonNode>> ENTRIES = new TypeReference<>() {
    };

    private final Path file;
    private final ObjectMapper objectMapper;
    private Map<String, JsonNode> entries;

    public LookupCache(Path file, ObjectMapper objectMapper) {
        this.file = file;
        this.objectMapper = objectMapper;
    }

    public synchronized Optional<JsonNode> get(String key) {
        return Optional.ofNullable(entries().get(key));
    }

    public synchronized void put(String key, JsonNode value) {
        entries().put(key, value);
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), entries);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write lookup cache " + file, e);
        }
    }

    public synchronized int size() {
        return entries().size();
    }

    private Map<String, JsonNode> entries() {
        if (entries == null) {
            entries = load();
        }
        return entries;
    }

    private Map<String, JsonNode> load() {
        if (!Files.exists(file)) {
            return new LinkedHashMap<>();
        }
        try {
            Map<String, JsonNode> loaded = objectMapper.readValue(file.toFile(), ENTRIES);
            log.debug("Loaded {} cached lookups from {}", loaded.size(), file);
            return loaded;
        } catch (IOException e) {
            log.warn("Lookup cache {} is unreadable, starting empty: {}", file, e.getMessage());
            return new LinkedHashMap<>();
        }
    }
}
