package dev.newsjournal.journal;

/**
 * Raised by {@link Journal} and {@link ReadTracker} when an operation violates a journal rule.
 * The journal is left untouched whenever this is thrown.
 */
public class JournalException extends RuntimeException {

    private final JournalErrorKind kind;

    public JournalException(JournalErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public JournalErrorKind getKind() {
        return kind;
    }

    public static JournalException outOfRange(String message) {
        return new JournalException(JournalErrorKind.OUT_OF_RANGE, message);
    }

    public static JournalException notFound(String message) {
        return new JournalException(JournalErrorKind.NOT_FOUND, message);
    }

    public static JournalException invalidArgument(String message) {
        return new JournalException(JournalErrorKind.INVALID_ARGUMENT, message);
    }

    public static JournalException exhausted(String message) {
        return new JournalException(JournalErrorKind.JOURNAL_EXHAUSTED, message);
    }
}
