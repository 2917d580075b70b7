package dev.newsjournal.config;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Journal and session settings from the {@code journal.*} properties.
 */
@Component
@Getter
@Slf4j
public class JournalProperties {

    private final boolean allowDuplicates;
    private final int wordsPerMinute;
    private final int maxSessions;
    private final Duration sessionIdleTimeout;

    public JournalProperties(
            @Value("${journal.allow-duplicates:false}") boolean allowDuplicates,
            @Value("${journal.words-per-minute:200}") int wordsPerMinute,
            @Value("${journal.max-sessions:10000}") int maxSessions,
            @Value("${journal.session-idle-timeout-minutes:30}") int sessionIdleTimeoutMinutes
    ) {
        if (wordsPerMinute <= 0) {
            throw new IllegalArgumentException("journal.words-per-minute must be positive");
        }
        if (maxSessions <= 0) {
            throw new IllegalArgumentException("journal.max-sessions must be positive");
        }
        this.allowDuplicates = allowDuplicates;
        this.wordsPerMinute = wordsPerMinute;
        this.maxSessions = maxSessions;
        this.sessionIdleTimeout = Duration.ofMinutes(sessionIdleTimeoutMinutes);
        log.info("Journal configuration initialized: allowDuplicates={}, wordsPerMinute={}, maxSessions={}, idleTimeout={}",
                allowDuplicates, wordsPerMinute, maxSessions, sessionIdleTimeout);
    }
}
