package dev.newsjournal.dto;

import java.time.Instant;

/**
 * A freshly opened journal session. The id goes into the {@code X-Journal-Session} header.
 */
public record SessionResponse(String sessionId, Instant createdAt) {}
