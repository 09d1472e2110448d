package ch.so.arp.docchat.error;

/**
 * Raised when the pipeline is configured with values it cannot work with, for
 * example a chunk overlap that is not smaller than the window.
 */
public class ConfigurationException extends DocChatException {

    public ConfigurationException(String message) {
        super(message);
    }
}
