package dev.newsjournal.journal;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads articles off a {@link Journal}, moving its cursor and emitting one {@link ReadEvent} per article.
 *
 * <p>Each read method moves the cursor synchronously, before it returns, and hands back a {@link Mono}
 * that publishes the read events. The cursor move is authoritative: a failed publish is reported
 * through {@link ReadOutcome#failedArticleIds()} and never rolls the journal back. Every event is
 * attempted even when an earlier one failed.</p>
 */
@Slf4j
@RequiredArgsConstructor
public class ReadTracker {

    private final ReadEventPublisher publisher;
    private final Clock clock;

    /**
     * Reads the article at the cursor and advances the cursor by one.
     *
     * @throws JournalException {@link JournalErrorKind#JOURNAL_EXHAUSTED} if the cursor is past the end
     */
    public Mono<ReadOutcome> readCurrent(Journal journal) {
        int articleNumber = journal.cursor();
        ArticleRef article = journal.advance();
        log.info("Reading article {} ({}) at article number {}", article.getId(), article.getTitle(), articleNumber);
        return publish(List.of(article), journal.cursor());
    }

    /**
     * Rewinds and reads every article, leaving the cursor at {@code length + 1}.
     *
     * @throws JournalException {@link JournalErrorKind#JOURNAL_EXHAUSTED} if the journal is empty
     */
    public Mono<ReadOutcome> readEntireJournal(Journal journal) {
        if (journal.isEmpty()) {
            throw JournalException.exhausted(journal.exhaustedMessage());
        }
        log.info("Reading entire journal of {} articles", journal.length());
        journal.resetCursor();
        return publish(drain(journal), journal.cursor());
    }

    /**
     * Reads from the cursor to the end, leaving the cursor at {@code length + 1}.
     *
     * @throws JournalException {@link JournalErrorKind#JOURNAL_EXHAUSTED} if the cursor is already past the end
     */
    public Mono<ReadOutcome> readRestOfJournal(Journal journal) {
        if (journal.isExhausted()) {
            throw JournalException.exhausted(journal.exhaustedMessage());
        }
        log.info("Reading rest of journal from article number {}", journal.cursor());
        return publish(drain(journal), journal.cursor());
    }

    public void rewind(Journal journal) {
        log.info("Rewinding journal from article number {} to 1", journal.cursor());
        journal.resetCursor();
    }

    private List<ArticleRef> drain(Journal journal) {
        List<ArticleRef> read = new ArrayList<>();
        while (!journal.isExhausted()) {
            read.add(journal.advance());
        }
        return read;
    }

    private Mono<ReadOutcome> publish(List<ArticleRef> read, int cursorAfter) {
        List<ReadEvent> events = read.stream()
                .map(article -> new ReadEvent(article.getId(), clock.instant()))
                .toList();
        return Flux.fromIterable(events)
                .concatMap(this::publishOne)
                .collectList()
                .map(failed -> new ReadOutcome(read, cursorAfter, failed));
    }

    private Mono<Long> publishOne(ReadEvent event) {
        return Mono.defer(() -> publisher.publish(event))
                .then(Mono.<Long>empty())
                .doOnSuccess(ignored -> log.debug("Recorded read of article {}", event.articleId()))
                .onErrorResume(error -> {
                    log.error("Failed to record read of article {}: {}", event.articleId(), error.getMessage());
                    return Mono.just(event.articleId());
                });
    }
}
