package io.taskrelay.messaging.publish;

/**
 * Outcome of one publish. {@code confirmed} is only true when the broker acknowledged the message
 * and did not return it as unroutable.
 */
public record PublishResult(boolean confirmed, String messageId, String queue, String failureReason) {

    public static PublishResult confirmed(String messageId, String queue) {
        return new PublishResult(true, messageId, queue, null);
    }

    public static PublishResult unconfirmed(String messageId, String queue, String reason) {
        return new PublishResult(false, messageId, queue, reason == null ? "unknown" : reason);
    }

    /**
     * @return the message id of a confirmed publish
     * @throws PublishUnconfirmedException when the publish was not confirmed
     */
    public String orElseThrow() {
        if (!confirmed) {
            throw new PublishUnconfirmedException(this);
        }
        return messageId;
    }
}
