package io.taskrelay.message;

/** Raised when {@code message_type} is not one of {@link MessageType}. */
public class UnknownMessageTypeException extends MalformedMessageException {

    private final String messageType;

    public UnknownMessageTypeException(String messageType) {
        super("Unknown message_type '" + messageType + "'");
        this.messageType = messageType;
    }

    public String messageType() {
        return messageType;
    }
}
