package ch.so.arp.docchat.error;

/**
 * Duplicate key style violation on write.
 */
public class ConflictException extends DocChatException {

    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
