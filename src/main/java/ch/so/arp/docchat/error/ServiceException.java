package ch.so.arp.docchat.error;

/**
 * Failure reported by an external service (embedding or generation).
 */
public abstract class ServiceException extends DocChatException {

    protected ServiceException(String message) {
        super(message);
    }

    protected ServiceException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * @return {@code true} if repeating the same call may succeed
     */
    public abstract boolean isRetryable();
}
