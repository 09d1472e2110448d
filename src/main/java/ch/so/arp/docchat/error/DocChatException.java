package ch.so.arp.docchat.error;

/**
 * Root of the exceptions raised by the ingestion and retrieval pipeline. Every
 * subtype maps to exactly one client visible failure category.
 */
public abstract class DocChatException extends RuntimeException {

    protected DocChatException(String message) {
        super(message);
    }

    protected DocChatException(String message, Throwable cause) {
        super(message, cause);
    }
}
