package dev.newsjournal.journal;

import reactor.core.publisher.Mono;

/**
 * Receives read events produced by {@link ReadTracker}.
 * An error signal marks the event as not recorded.
 */
@FunctionalInterface
public interface ReadEventPublisher {

    Mono<Void> publish(ReadEvent event);
}
