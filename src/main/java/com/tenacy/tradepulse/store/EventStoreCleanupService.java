package com.tenacy.tradepulse.store;

import com.tenacy.tradepulse.config.MonitorProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;

@Service
@RequiredArgsConstructor
@Slf4j
public class EventStoreCleanupService {

    private final EventStore eventStore;
    private final MonitorProperties properties;

    @Scheduled(cron = "${tradepulse.store.purge-cron:0 0 2 * * ?}") // 매일 새벽 2시에 실행
    public void cleanupOldRecords() {
        int retentionDays = properties.getStore().getRetentionDays();

        int deletedCount = eventStore.purge(Duration.ofDays(retentionDays));

        log.info("Cleaned up {} monitoring records older than {} days", deletedCount, retentionDays);
    }
}
