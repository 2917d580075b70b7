package dev.newsjournal.journal;

/**
 * Failure categories of journal operations, rendered verbatim at the API boundary.
 */
public enum JournalErrorKind {

    /** Article number outside {@code [1, length]}. */
    OUT_OF_RANGE("OutOfRange"),

    /** Lookup by id or by author/title/publishedAt key found nothing. */
    NOT_FOUND("NotFound"),

    /** Malformed article, duplicate article, or swap of an entry with itself. */
    INVALID_ARGUMENT("InvalidArgument"),

    /** Read attempted past the last entry. */
    JOURNAL_EXHAUSTED("JournalExhausted"),

    /** The journal changed but recording the read count in the catalog failed. */
    PARTIAL_FAILURE("PartialFailure");

    private final String wireName;

    JournalErrorKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
