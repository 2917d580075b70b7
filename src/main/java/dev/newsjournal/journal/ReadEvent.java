package dev.newsjournal.journal;

import java.time.Instant;

/**
 * Emitted once per article read, for the catalog to bump its read count.
 */
public record ReadEvent(long articleId, Instant timestamp) {}
