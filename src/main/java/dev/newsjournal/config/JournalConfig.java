package dev.newsjournal.config;

import dev.newsjournal.journal.ReadEventPublisher;
import dev.newsjournal.journal.ReadTracker;
import dev.newsjournal.journal.ReadingTimeEstimator;
import dev.newsjournal.service.ArticleCatalog;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the framework-free journal engine into the application context.
 */
@Configuration(proxyBeanMethods = false)
public class JournalConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ReadingTimeEstimator readingTimeEstimator(JournalProperties properties) {
        return new ReadingTimeEstimator(properties.getWordsPerMinute());
    }

    /**
     * Read events go straight to the catalog's read counter.
     */
    @Bean
    public ReadEventPublisher readEventPublisher(ArticleCatalog articleCatalog) {
        return event -> articleCatalog.incrementReadCount(event.articleId());
    }

    @Bean
    public ReadTracker readTracker(ReadEventPublisher readEventPublisher, Clock clock) {
        return new ReadTracker(readEventPublisher, clock);
    }
}
