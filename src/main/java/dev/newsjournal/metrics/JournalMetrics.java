package dev.newsjournal.metrics;

import dev.newsjournal.service.JournalSessionRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class JournalMetrics {

    private final MeterRegistry meterRegistry;
    private final JournalSessionRegistry sessionRegistry;

    private Counter appendedCounter;
    private Counter removedCounter;
    private Counter readCounter;
    private Counter readEventFailedCounter;

    @PostConstruct
    public void init() {
        Gauge.builder("journal.sessions.active", sessionRegistry, JournalSessionRegistry::activeSessions)
                .description("Number of open journal sessions")
                .register(meterRegistry);

        appendedCounter = meterRegistry.counter("journal.articles.appended");
        removedCounter = meterRegistry.counter("journal.articles.removed");
        readCounter = meterRegistry.counter("journal.articles.read");
        readEventFailedCounter = meterRegistry.counter("journal.read_events.failed");
    }

    public void incrementAppended() {
        appendedCounter.increment();
    }

    public void incrementRemoved() {
        removedCounter.increment();
    }

    public void incrementRead(int articles) {
        readCounter.increment(articles);
    }

    public void incrementReadEventFailures(int failures) {
        readEventFailedCounter.increment(failures);
    }
}
