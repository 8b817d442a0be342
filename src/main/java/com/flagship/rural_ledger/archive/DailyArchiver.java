package com.flagship.rural_ledger.archive;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flagship.rural_ledger.config.StoreProperties;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Optional;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Copies the store file of a profile into a timestamped zip, at most once
 * per calendar day.
 *
 * The last archive date is kept in {@code <base>/archive_state.json}; the
 * artifact goes to {@code <base>/<profile>/backups/backup_yyyyMMdd-HHmmss.zip}.
 */
@Slf4j
public class DailyArchiver {

    public static final String STATE_FILE = "archive_state.json";
    static final String LAST_ARCHIVE_DATE = "last_archive_date";
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private final Path baseDir;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public DailyArchiver(Path baseDir, ObjectMapper objectMapper, Clock clock) {
        this.baseDir = baseDir;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Archives the store of {@code profile} unless that was already done today.
     *
     * @return the artifact written, or empty when skipped
     * @throws IOException if the artifact or the state file cannot be written
     */
    public Optional<Path> runDailyArchive(String profile) throws IOException {
        LocalDate today = LocalDate.now(clock);
        ObjectNode state = readState();
        if (today.toString().equals(state.path(LAST_ARCHIVE_DATE).asText(null))) {
            log.debug("Store already archived today ({})", today);
            return Optional.empty();
        }

        Path store = baseDir.resolve(profile).resolve("data").resolve(StoreProperties.STORE_FILE);
        if (!Files.exists(store)) {
            log.debug("No store file to archive at {}", store);
            return Optional.empty();
        }

        Path backups = Files.createDirectories(baseDir.resolve(profile).resolve("backups"));
        Path artifact = backups.resolve("backup_" + LocalDateTime.now(clock).format(TIMESTAMP) + ".zip");
        try (OutputStream out = Files.newOutputStream(artifact);
             ZipOutputStream zip = new ZipOutputStream(out)) {
            zip.putNextEntry(new ZipEntry(StoreProperties.STORE_FILE));
            Files.copy(store, zip);
            zip.closeEntry();
        }

        state.put(LAST_ARCHIVE_DATE, today.toString());
        Files.createDirectories(baseDir);
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(stateFile().toFile(), state);
        log.info("Archived store of profile {} to {}", profile, artifact);
        return Optional.of(artifact);
    }

    private ObjectNode readState() {
        Path file = stateFile();
        if (Files.exists(file)) {
            try {
                if (objectMapper.readTree(file.toFile()) instanceof ObjectNode node) {
                    return node;
                }
            } catch (IOException e) {
                log.warn("Archive state {} is unreadable, treating as empty: {}", file, e.getMessage());
            }
        }
        return objectMapper.createObjectNode();
    }

    private Path stateFile() {
        return baseDir.resolve(STATE_FILE);
    }
}
