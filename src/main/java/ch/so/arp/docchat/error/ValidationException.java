package ch.so.arp.docchat.error;

/**
 * Malformed input such as an empty query, an unknown category or an oversized
 * embedding request. Never retried.
 */
public class ValidationException extends DocChatException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
