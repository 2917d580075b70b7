package dev.newsjournal.service;

import dev.newsjournal.entity.Article;
import dev.newsjournal.exception.ResourceNotFoundException;
import dev.newsjournal.journal.ArticleRef;
import dev.newsjournal.repository.ArticleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * {@link ArticleCatalog} backed by the {@code articles} table.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ArticleCatalogService implements ArticleCatalog {

    private final ArticleRepository articleRepository;

    @Override
    public Mono<ArticleRef> findById(long id) {
        return articleRepository.findActiveById(id)
                .map(this::toRef)
                .doOnNext(ref -> log.debug("Catalog article {} found", id));
    }

    @Override
    public Mono<ArticleRef> findByKey(String author, String title, LocalDateTime publishedAt) {
        return articleRepository.findActiveByKey(author, title, publishedAt)
                .map(this::toRef);
    }

    @Override
    public Mono<Void> incrementReadCount(long id) {
        return articleRepository.incrementReadCount(id)
                .flatMap(updated -> updated > 0
                        ? Mono.<Void>empty()
                        : Mono.<Void>error(new ResourceNotFoundException("Article " + id + " not found in catalog")))
                .doOnSuccess(ignored -> log.debug("Incremented read count of article {}", id));
    }

    @Override
    public Mono<Void> softDelete(long id) {
        return articleRepository.softDelete(id)
                .flatMap(updated -> updated > 0
                        ? Mono.<Void>empty()
                        : Mono.<Void>error(new ResourceNotFoundException("Article " + id + " not found in catalog")))
                .doOnSuccess(ignored -> log.info("Article {} marked as deleted", id));
    }

    @Override
    public Flux<ArticleRef> listAll() {
        return articleRepository.findAllActive().map(this::toRef);
    }

    ArticleRef toRef(Article article) {
        return ArticleRef.builder()
                .id(article.getId())
                .name(article.getName())
                .author(article.getAuthor())
                .title(article.getTitle())
                .url(article.getUrl())
                .content(article.getContent())
                .publishedAt(article.getPublishedAt())
                .readingTime(article.getReadingTimeSeconds() != null
                        ? Duration.ofSeconds(article.getReadingTimeSeconds())
                        : null)
                .build();
    }
}
