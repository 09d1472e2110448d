package ch.so.arp.docchat.error;

public class NotFoundException extends DocChatException {

    public NotFoundException(String message) {
        super(message);
    }
}
