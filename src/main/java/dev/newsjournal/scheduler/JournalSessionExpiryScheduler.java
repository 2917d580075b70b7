package dev.newsjournal.scheduler;

import dev.newsjournal.service.JournalSessionRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Discards journal sessions that have been idle longer than {@code journal.session-idle-timeout-minutes}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JournalSessionExpiryScheduler {

    private final JournalSessionRegistry sessionRegistry;

    @Scheduled(fixedRateString = "${journal.session-sweep-interval-ms:60000}",
               initialDelayString = "${scheduling.initial-delay-ms:30000}")
    public void evictIdleSessions() {
        log.debug("Checking for idle journal sessions...");
        int evicted = sessionRegistry.evictIdle();
        log.debug("Idle session sweep completed: {} evicted, {} active", evicted, sessionRegistry.activeSessions());
    }
}
