package dev.newsjournal.journal;

import java.util.List;

/**
 * Result of a read: the articles read in order, the cursor afterwards, and the ids whose
 * read event could not be recorded.
 */
public record ReadOutcome(List<ArticleRef> articles, int cursor, List<Long> failedArticleIds) {

    public ReadOutcome {
        articles = List.copyOf(articles);
        failedArticleIds = List.copyOf(failedArticleIds);
    }

    public boolean isPartialFailure() {
        return !failedArticleIds.isEmpty();
    }
}
