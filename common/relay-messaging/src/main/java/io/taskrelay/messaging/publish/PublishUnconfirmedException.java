package io.taskrelay.messaging.publish;

public class PublishUnconfirmedException extends RuntimeException {

    private final transient PublishResult result;

    public PublishUnconfirmedException(PublishResult result) {
        super("Publish to '%s' was not confirmed: %s".formatted(result.queue(), result.failureReason()));
        this.result = result;
    }

    public PublishResult result() {
        return result;
    }
}
