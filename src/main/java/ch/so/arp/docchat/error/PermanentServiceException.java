package ch.so.arp.docchat.error;

/**
 * Invalid credentials or a request the external service will never accept.
 */
public class PermanentServiceException extends ServiceException {

    public PermanentServiceException(String message) {
        super(message);
    }

    public PermanentServiceException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
