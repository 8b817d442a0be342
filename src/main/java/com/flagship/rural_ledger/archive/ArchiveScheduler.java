package com.flagship.rural_ledger.archive;

import com.flagship.rural_ledger.config.ArchiveProperties;
import com.flagship.rural_ledger.config.StoreProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Triggers the daily archive once at startup and then on the configured cron.
 */
@Component
@ConditionalOnProperty(name = "ledger.archive.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class ArchiveScheduler {

    private final DailyArchiver archiver;
    private final StoreProperties storeProperties;
    private final ArchiveProperties archiveProperties;

    @EventListener(ApplicationReadyEvent.class)
    public void archiveOnStartup() {
        if (archiveProperties.isOnStartup()) {
            archive();
        }
    }

    @Scheduled(cron = "${ledger.archive.cron:0 0 12 * * *}")
    public void archive() {
        try {
            archiver.runDailyArchive(storeProperties.getProfile());
        } catch (Exception e) {
            log.error("Daily archive of profile {} failed", storeProperties.getProfile(), e);
        }
    }
}
