package ch.so.arp.docchat.error;

/**
 * JSON body returned for every failed request.
 */
public record ErrorResponse(String code, String message) {
}
