package dev.newsjournal.service;

import dev.newsjournal.journal.ArticleRef;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

/**
 * The article catalog journals draw from. Soft-deleted articles are invisible to every lookup.
 */
public interface ArticleCatalog {

    /** Empty when no active article has this id. */
    Mono<ArticleRef> findById(long id);

    /** Empty when no active article has this key; the lowest id wins on duplicates. */
    Mono<ArticleRef> findByKey(String author, String title, LocalDateTime publishedAt);

    /** Errors when the article is unknown or deleted. */
    Mono<Void> incrementReadCount(long id);

    /** Errors when the article is unknown or already deleted. */
    Mono<Void> softDelete(long id);

    Flux<ArticleRef> listAll();
}
