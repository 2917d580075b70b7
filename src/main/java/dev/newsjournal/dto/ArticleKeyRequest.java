package dev.newsjournal.dto;

import java.time.LocalDateTime;

/**
 * Identifies an article by author, title and publication timestamp.
 */
public record ArticleKeyRequest(
        String author,
        String title,
        LocalDateTime publishedAt
) {}
