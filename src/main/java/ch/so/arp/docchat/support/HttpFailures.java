package ch.so.arp.docchat.support;

import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import ch.so.arp.docchat.error.PermanentServiceException;
import ch.so.arp.docchat.error.ServiceException;
import ch.so.arp.docchat.error.TransientServiceException;

/**
 * Classifies HTTP failures of external AI services into transient and
 * permanent errors.
 */
public final class HttpFailures {

    private HttpFailures() {
    }

    public static ServiceException classify(String operation, RestClientResponseException ex) {
        int status = ex.getStatusCode().value();
        String message = operation + " failed with HTTP " + status;
        if (isTransientStatus(status)) {
            return new TransientServiceException(message, ex);
        }
        return new PermanentServiceException(message, ex);
    }

    public static TransientServiceException unreachable(String operation, ResourceAccessException ex) {
        return new TransientServiceException(operation + " failed: " + ex.getMessage(), ex);
    }

    /**
     * A response that could not be read, typically a proxy or gateway page
     * served in place of the API answer.
     */
    public static TransientServiceException unreadable(String operation, RestClientException ex) {
        return new TransientServiceException(operation + " returned an unreadable response: " + ex.getMessage(), ex);
    }

    static boolean isTransientStatus(int status) {
        return status == 408 || status == 425 || status == 429 || status >= 500;
    }
}
