package io.taskrelay.message;

/**
 * Raised when a delivery cannot be decoded into a {@link RelayMessage}. Malformed messages are
 * permanently unprocessable and are dropped without requeue.
 */
public class MalformedMessageException extends Exception {

    public MalformedMessageException(String message) {
        super(message);
    }

    public MalformedMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
