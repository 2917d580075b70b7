package dev.newsjournal.service;

import dev.newsjournal.journal.Journal;
import lombok.Getter;

import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * One open journal and the lock that serializes work on it.
 */
public class JournalSession {

    @Getter
    private final String id;
    @Getter
    private final Instant createdAt;
    private final Journal journal;
    private final ReentrantLock lock = new ReentrantLock();
    private volatile Instant lastAccessedAt;

    JournalSession(String id, Journal journal, Instant createdAt) {
        this.id = id;
        this.journal = journal;
        this.createdAt = createdAt;
        this.lastAccessedAt = createdAt;
    }

    /**
     * Runs {@code action} on the journal while holding this session's lock and marks the session as used.
     */
    public <T> T withJournal(Instant now, Function<Journal, T> action) {
        lock.lock();
        try {
            lastAccessedAt = now;
            return action.apply(journal);
        } finally {
            lock.unlock();
        }
    }

    public Instant getLastAccessedAt() {
        return lastAccessedAt;
    }
}
