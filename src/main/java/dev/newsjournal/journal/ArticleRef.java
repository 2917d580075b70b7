package dev.newsjournal.journal;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Immutable snapshot of a catalog article taken when it entered a journal.
 * {@code readingTime} is optional; when absent the reading time is estimated from the content.
 */
@Value
@Builder(toBuilder = true)
public class ArticleRef {

    private static final int MIN_PUBLISHED_YEAR = 1900;

    Long id;
    String name;
    String author;
    String title;
    String url;
    String content;
    LocalDateTime publishedAt;
    Duration readingTime;

    /**
     * Whether this article carries the given author/title/publishedAt key.
     */
    public boolean matchesKey(String author, String title, LocalDateTime publishedAt) {
        return Objects.equals(this.author, author)
                && Objects.equals(this.title, title)
                && Objects.equals(this.publishedAt, publishedAt);
    }

    /**
     * Checks the fields a journal relies on.
     *
     * @throws JournalException with {@link JournalErrorKind#INVALID_ARGUMENT} on the first violation
     */
    public static void validate(ArticleRef ref) {
        if (ref == null) {
            throw JournalException.invalidArgument("Article is required");
        }
        if (ref.getId() == null || ref.getId() <= 0) {
            throw JournalException.invalidArgument("Invalid article id: " + ref.getId());
        }
        if (isBlank(ref.getAuthor())) {
            throw JournalException.invalidArgument("Article author is required");
        }
        if (isBlank(ref.getTitle())) {
            throw JournalException.invalidArgument("Article title is required");
        }
        if (ref.getPublishedAt() != null && ref.getPublishedAt().getYear() <= MIN_PUBLISHED_YEAR) {
            throw JournalException.invalidArgument(
                    "Publication year must be after " + MIN_PUBLISHED_YEAR + ", got " + ref.getPublishedAt().getYear());
        }
        if (ref.getReadingTime() != null && ref.getReadingTime().isNegative()) {
            throw JournalException.invalidArgument("Reading time must not be negative");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
