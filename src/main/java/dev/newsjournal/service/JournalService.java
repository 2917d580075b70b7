package dev.newsjournal.service;

import dev.newsjournal.dto.ArticleKeyRequest;
import dev.newsjournal.dto.ArticleRefRequest;
import dev.newsjournal.dto.JournalResponse;
import dev.newsjournal.dto.MoveRequest;
import dev.newsjournal.dto.SessionResponse;
import dev.newsjournal.dto.SwapRequest;
import dev.newsjournal.journal.ArticleRef;
import dev.newsjournal.journal.Journal;
import dev.newsjournal.journal.JournalEntry;
import dev.newsjournal.journal.JournalErrorKind;
import dev.newsjournal.journal.JournalException;
import dev.newsjournal.journal.JournalStats;
import dev.newsjournal.journal.ReadOutcome;
import dev.newsjournal.journal.ReadTracker;
import dev.newsjournal.journal.ReadingTimeEstimator;
import dev.newsjournal.metrics.JournalMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.function.Function;

/**
 * Entry point for every journal operation of a session.
 *
 * <p>Journal rule violations never escape as exceptions: they come back as a {@link JournalResponse}
 * with {@code status = "error"} and the matching error kind. Unknown sessions fail with
 * {@link dev.newsjournal.exception.ResourceNotFoundException}.</p>
 *
 * <p>Journal work runs under the session lock. Read events are published after the lock is released,
 * and the returned {@link Mono} completes only once every event was attempted.</p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JournalService {

    private final JournalSessionRegistry sessionRegistry;
    private final ReadTracker readTracker;
    private final ReadingTimeEstimator readingTimeEstimator;
    private final ArticleCatalog articleCatalog;
    private final JournalMetrics journalMetrics;

    // ==================== Sessions ====================

    public Mono<SessionResponse> openSession() {
        return Mono.fromCallable(sessionRegistry::open)
                .map(session -> new SessionResponse(session.getId(), session.getCreatedAt()));
    }

    public Mono<Boolean> closeSession(String sessionId) {
        return Mono.fromCallable(() -> sessionRegistry.close(sessionId));
    }

    // ==================== Article management ====================

    public Mono<JournalResponse> append(String sessionId, ArticleRefRequest request) {
        if (request == null) {
            return Mono.just(toError("append", JournalException.invalidArgument("Article is required")));
        }
        return appendRef(sessionId, request.toRef());
    }

    public Mono<JournalResponse> appendFromCatalog(String sessionId, long articleId) {
        return Mono.fromCallable(() -> sessionRegistry.require(sessionId))
                .flatMap(session -> articleCatalog.findById(articleId))
                .switchIfEmpty(Mono.error(() ->
                        JournalException.notFound("Article with id " + articleId + " not found in catalog")))
                .flatMap(ref -> appendRef(sessionId, ref))
                .onErrorResume(JournalException.class, ex -> Mono.just(toError("append", ex)));
    }

    public Mono<JournalResponse> appendFromCatalogByKey(String sessionId, ArticleKeyRequest key) {
        return Mono.fromCallable(() -> {
                    sessionRegistry.require(sessionId);
                    return validateKey(key);
                })
                .flatMap(valid -> articleCatalog.findByKey(valid.author(), valid.title(), valid.publishedAt()))
                .switchIfEmpty(Mono.error(() -> JournalException.notFound(
                        "Article '" + key.title() + "' by " + key.author() + " not found in catalog")))
                .flatMap(ref -> appendRef(sessionId, ref))
                .onErrorResume(JournalException.class, ex -> Mono.just(toError("append", ex)));
    }

    public Mono<JournalResponse> removeByArticleNumber(String sessionId, int articleNumber) {
        return execute(sessionId, "remove", journal -> removed(journal, journal.removeByArticleNumber(articleNumber)));
    }

    public Mono<JournalResponse> removeById(String sessionId, long articleId) {
        return execute(sessionId, "remove", journal -> removed(journal, journal.removeById(articleId)));
    }

    public Mono<JournalResponse> removeByKey(String sessionId, ArticleKeyRequest key) {
        return execute(sessionId, "remove", journal -> {
            ArticleKeyRequest valid = validateKey(key);
            return removed(journal, journal.removeByKey(valid.author(), valid.title(), valid.publishedAt()));
        });
    }

    public Mono<JournalResponse> swap(String sessionId, SwapRequest request) {
        return execute(sessionId, "swap", journal -> {
            if (request == null || request.first() == null || request.second() == null) {
                throw JournalException.invalidArgument("Both article numbers are required to swap");
            }
            journal.swap(request.first(), request.second());
            return snapshot(journal);
        });
    }

    public Mono<JournalResponse> move(String sessionId, MoveRequest request) {
        return execute(sessionId, "move", journal -> {
            if (request == null || request.from() == null || request.to() == null) {
                throw JournalException.invalidArgument("Source and target article numbers are required to move");
            }
            journal.moveToPosition(request.from(), request.to());
            return snapshot(journal).toBuilder().articleNumber(request.to()).build();
        });
    }

    public Mono<JournalResponse> moveToFront(String sessionId, int articleNumber) {
        return execute(sessionId, "move", journal -> {
            journal.moveToFront(articleNumber);
            return snapshot(journal).toBuilder().articleNumber(1).build();
        });
    }

    public Mono<JournalResponse> moveToEnd(String sessionId, int articleNumber) {
        return execute(sessionId, "move", journal -> {
            journal.moveToEnd(articleNumber);
            return snapshot(journal).toBuilder().articleNumber(journal.length()).build();
        });
    }

    public Mono<JournalResponse> clear(String sessionId) {
        return execute(sessionId, "clear", journal -> {
            journal.clear();
            return snapshot(journal);
        });
    }

    // ==================== Retrieval ====================

    public Mono<JournalResponse> listEntries(String sessionId) {
        return execute(sessionId, "list", this::snapshot);
    }

    public Mono<JournalResponse> getByArticleNumber(String sessionId, int articleNumber) {
        return execute(sessionId, "get", journal -> entry(journal, journal.entryAt(articleNumber)));
    }

    public Mono<JournalResponse> getById(String sessionId, long articleId) {
        return execute(sessionId, "get", journal -> entry(journal, journal.findById(articleId)));
    }

    public Mono<JournalResponse> getCurrent(String sessionId) {
        return execute(sessionId, "current", journal -> entry(journal, journal.current()));
    }

    public Mono<JournalResponse> goTo(String sessionId, int articleNumber) {
        return execute(sessionId, "goTo", journal -> {
            journal.goTo(articleNumber);
            return position(journal).toBuilder().articleNumber(articleNumber).build();
        });
    }

    public Mono<JournalResponse> stats(String sessionId) {
        return execute(sessionId, "stats", journal -> {
            JournalStats stats = JournalStats.of(journal, readingTimeEstimator);
            return JournalResponse.success().toBuilder()
                    .length(stats.length())
                    .duration(stats.duration().toString())
                    .durationSeconds(stats.duration().getSeconds())
                    .build();
        });
    }

    // ==================== Reading ====================

    public Mono<JournalResponse> readCurrent(String sessionId) {
        return read(sessionId, "readCurrent", readTracker::readCurrent, true);
    }

    public Mono<JournalResponse> readEntireJournal(String sessionId) {
        return read(sessionId, "readEntireJournal", readTracker::readEntireJournal, false);
    }

    public Mono<JournalResponse> readRestOfJournal(String sessionId) {
        return read(sessionId, "readRestOfJournal", readTracker::readRestOfJournal, false);
    }

    public Mono<JournalResponse> rewind(String sessionId) {
        return execute(sessionId, "rewind", journal -> {
            readTracker.rewind(journal);
            return position(journal);
        });
    }

    // ==================== Helpers ====================

    private Mono<JournalResponse> appendRef(String sessionId, ArticleRef ref) {
        return execute(sessionId, "append", journal -> {
            int articleNumber = journal.append(ref);
            journalMetrics.incrementAppended();
            return JournalResponse.success().toBuilder()
                    .articleNumber(articleNumber)
                    .article(ref)
                    .length(journal.length())
                    .cursor(journal.cursor())
                    .build();
        });
    }

    private Mono<JournalResponse> execute(String sessionId, String operation, Function<Journal, JournalResponse> action) {
        return Mono.fromCallable(() -> {
                    JournalSession session = sessionRegistry.require(sessionId);
                    return session.withJournal(sessionRegistry.now(), action);
                })
                .onErrorResume(JournalException.class, ex -> Mono.just(toError(operation, ex)));
    }

    private Mono<JournalResponse> read(String sessionId, String operation,
                                       Function<Journal, Mono<ReadOutcome>> reader, boolean single) {
        return Mono.defer(() -> {
                    JournalSession session = sessionRegistry.require(sessionId);
                    return session.withJournal(sessionRegistry.now(), reader);
                })
                .map(outcome -> toReadResponse(outcome, single))
                .onErrorResume(JournalException.class, ex -> Mono.just(toError(operation, ex)));
    }

    private JournalResponse toReadResponse(ReadOutcome outcome, boolean single) {
        journalMetrics.incrementRead(outcome.articles().size());
        JournalResponse.JournalResponseBuilder builder = JournalResponse.success().toBuilder()
                .articles(outcome.articles())
                .cursor(outcome.cursor());
        if (single && !outcome.articles().isEmpty()) {
            builder.article(outcome.articles().get(0));
        }
        if (outcome.isPartialFailure()) {
            journalMetrics.incrementReadEventFailures(outcome.failedArticleIds().size());
            log.error("Read succeeded but read count could not be recorded for articles {}", outcome.failedArticleIds());
            builder.status(JournalResponse.ERROR)
                    .errorKind(JournalErrorKind.PARTIAL_FAILURE.wireName())
                    .message("Articles were read but the read count of " + outcome.failedArticleIds().size()
                            + " article(s) could not be recorded")
                    .failedArticleIds(outcome.failedArticleIds());
        }
        return builder.build();
    }

    private JournalResponse removed(Journal journal, ArticleRef article) {
        journalMetrics.incrementRemoved();
        return JournalResponse.success().toBuilder()
                .article(article)
                .length(journal.length())
                .cursor(journal.cursor())
                .build();
    }

    private JournalResponse entry(Journal journal, JournalEntry entry) {
        return JournalResponse.success().toBuilder()
                .articleNumber(entry.articleNumber())
                .article(entry.article())
                .cursor(journal.cursor())
                .build();
    }

    private JournalResponse position(Journal journal) {
        return JournalResponse.success().toBuilder()
                .cursor(journal.cursor())
                .length(journal.length())
                .build();
    }

    private JournalResponse snapshot(Journal journal) {
        return JournalResponse.success().toBuilder()
                .entries(journal.entries())
                .cursor(journal.cursor())
                .length(journal.length())
                .build();
    }

    private ArticleKeyRequest validateKey(ArticleKeyRequest key) {
        if (key == null || key.author() == null || key.author().isBlank()
                || key.title() == null || key.title().isBlank()) {
            throw JournalException.invalidArgument("Author and title are required");
        }
        if (key.publishedAt() == null) {
            throw JournalException.invalidArgument("Publication timestamp is required");
        }
        return key;
    }

    private JournalResponse toError(String operation, JournalException ex) {
        log.warn("Journal {} rejected: {} - {}", operation, ex.getKind().wireName(), ex.getMessage());
        return JournalResponse.error(ex.getKind(), ex.getMessage());
    }
}
