package com.flagship.rural_ledger.lookup;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class LookupCacheTest {

    @TempDir
    Path dir;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    @DisplayName("Entries survive a new cache instance on the same file")
    void testPersistence() throws Exception {
        Path file = dir.resolve("profile").resolve("lookup_cache.json");
        new LookupCache(file, objectMapper).put("cnpj:11222333000181", objectMapper.readTree("{\"nome\":\"X\"}"));

        LookupCache reloaded = new LookupCache(file, objectMapper);

        assertEquals(1, reloaded.size());
        assertEquals("X", reloaded.get("cnpj:11222333000181").orElseThrow().path("nome").asText());
        assertFalse(Files.exists(file.resolveSibling("lookup_cache.json.tmp")));
    }

    @Test
    @DisplayName("An unreadable file starts an empty cache")
    void testCorruptFile() throws Exception {
        Path file = dir.resolve("lookup_cache.json");
        Files.writeString(file, "{not json");

        LookupCache cache = new LookupCache(file, objectMapper);

        assertEquals(0, cache.size());
        assertTrue(cache.get("cpf:1").isEmpty());
    }

    @Test
    @DisplayName("The display name comes from the first non-blank name field")
    void testDisplayName() throws Exception {
        LookupResult result = new LookupResult(objectMapper.readTree(
            "{\"nome\":\"  \",\"razao_social\":null,\"fantasia\":\" Agro Sul \"}"));

        assertEquals("Agro Sul", result.displayName());
        assertFalse(result.isError());
        assertEquals("", LookupResult.error().displayName());
        assertTrue(LookupResult.error().isError());
    }
}
