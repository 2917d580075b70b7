package dev.newsjournal.journal;

import java.time.Duration;

/**
 * Length and total reading duration of a journal at one moment.
 */
public record JournalStats(int length, Duration duration) {

    public static JournalStats of(Journal journal, ReadingTimeEstimator estimator) {
        Duration total = journal.entries().stream()
                .map(entry -> estimator.estimate(entry.article()))
                .reduce(Duration.ZERO, Duration::plus);
        return new JournalStats(journal.length(), total);
    }
}
