package dev.newsjournal.repository;

import dev.newsjournal.entity.Article;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
public interface ArticleRepository extends ReactiveCrudRepository<Article, Long> {

    @Query("SELECT * FROM articles WHERE id = :id AND deleted = FALSE")
    Mono<Article> findActiveById(Long id);

    @Query("SELECT * FROM articles WHERE author = :author AND title = :title AND published_at = :publishedAt " +
           "AND deleted = FALSE ORDER BY id LIMIT 1")
    Mono<Article> findActiveByKey(String author, String title, LocalDateTime publishedAt);

    @Query("SELECT * FROM articles WHERE deleted = FALSE ORDER BY id")
    Flux<Article> findAllActive();

    @Modifying
    @Query("UPDATE articles SET read_count = read_count + 1 WHERE id = :id AND deleted = FALSE")
    Mono<Integer> incrementReadCount(Long id);

    @Modifying
    @Query("UPDATE articles SET deleted = TRUE WHERE id = :id AND deleted = FALSE")
    Mono<Integer> softDelete(Long id);
}
