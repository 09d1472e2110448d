package ch.so.arp.docchat.error;

/**
 * Timeout, rate limit or server side failure of an external service.
 */
public class TransientServiceException extends ServiceException {

    public TransientServiceException(String message) {
        super(message);
    }

    public TransientServiceException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
