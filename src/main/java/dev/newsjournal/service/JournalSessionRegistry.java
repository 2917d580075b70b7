package dev.newsjournal.service;

import dev.newsjournal.config.JournalProperties;
import dev.newsjournal.exception.ResourceNotFoundException;
import dev.newsjournal.journal.Journal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns every open journal, keyed by session id. Sessions are created by {@link #open()},
 * removed by {@link #close(String)} or, once idle too long, by {@link #evictIdle()}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JournalSessionRegistry {

    private final JournalProperties properties;
    private final Clock clock;

    private final Map<String, JournalSession> sessions = new ConcurrentHashMap<>();

    /**
     * The limit check and the insert run under the registry monitor, so concurrent opens never
     * exceed {@code journal.max-sessions}.
     *
     * @throws ResponseStatusException 503 once the limit is reached
     */
    public synchronized JournalSession open() {
        if (sessions.size() >= properties.getMaxSessions()) {
            log.warn("Refusing to open journal session: {} sessions already open", sessions.size());
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "error.session_limit_reached");
        }
        String id = UUID.randomUUID().toString();
        JournalSession session = new JournalSession(id, new Journal(properties.isAllowDuplicates()), clock.instant());
        sessions.put(id, session);
        log.info("Opened journal session {} ({} active)", id, sessions.size());
        return session;
    }

    public Optional<JournalSession> find(String sessionId) {
        return Optional.ofNullable(sessionId).map(sessions::get);
    }

    /**
     * @throws ResourceNotFoundException if no session has this id
     */
    public JournalSession require(String sessionId) {
        return find(sessionId).orElseThrow(() -> {
            log.warn("Journal session not found: {}", sessionId);
            return new ResourceNotFoundException("error.session_not_found");
        });
    }

    public boolean close(String sessionId) {
        JournalSession removed = sessionId == null ? null : sessions.remove(sessionId);
        if (removed == null) {
            log.debug("Close requested for unknown journal session {}", sessionId);
            return false;
        }
        log.info("Closed journal session {} ({} active)", sessionId, sessions.size());
        return true;
    }

    /**
     * Removes sessions not used within the configured idle timeout.
     *
     * @return the number of sessions removed
     */
    public int evictIdle() {
        Instant cutoff = clock.instant().minus(properties.getSessionIdleTimeout());
        int before = sessions.size();
        sessions.values().removeIf(session -> session.getLastAccessedAt().isBefore(cutoff));
        int evicted = before - sessions.size();
        if (evicted > 0) {
            log.info("Evicted {} idle journal sessions ({} active)", evicted, sessions.size());
        }
        return evicted;
    }

    public int activeSessions() {
        return sessions.size();
    }

    Instant now() {
        return clock.instant();
    }
}
