package dev.newsjournal.journal;

import java.time.Duration;

/**
 * Reading duration of an article: the catalog-supplied value when present, otherwise the word count
 * of the content at a fixed reading speed, rounded up to whole seconds.
 */
public class ReadingTimeEstimator {

    public static final int DEFAULT_WORDS_PER_MINUTE = 200;

    private final int wordsPerMinute;

    public ReadingTimeEstimator() {
        this(DEFAULT_WORDS_PER_MINUTE);
    }

    public ReadingTimeEstimator(int wordsPerMinute) {
        if (wordsPerMinute <= 0) {
            throw new IllegalArgumentException("wordsPerMinute must be positive, got " + wordsPerMinute);
        }
        this.wordsPerMinute = wordsPerMinute;
    }

    public Duration estimate(ArticleRef article) {
        if (article.getReadingTime() != null) {
            return article.getReadingTime();
        }
        long words = countWords(article.getContent());
        long seconds = (words * 60 + wordsPerMinute - 1) / wordsPerMinute;
        return Duration.ofSeconds(seconds);
    }

    public int getWordsPerMinute() {
        return wordsPerMinute;
    }

    static long countWords(String content) {
        if (content == null || content.isBlank()) {
            return 0;
        }
        return content.trim().split("\\s+").length;
    }
}
