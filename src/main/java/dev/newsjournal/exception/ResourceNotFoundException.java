package dev.newsjournal.exception;

/**
 * Thrown when a session or catalog article referenced by a request does not exist.
 * The message is an i18n key or a plain message, resolved by {@link GlobalExceptionHandler}.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
