package org.blockindex.migrations.pipeline.common;

/**
 * A queue message body that cannot be parsed or fails validation. Never retried in place; the queue's
 * redelivery and dead-letter policy decides what happens to the message.
 */
public class MalformedMessageException extends RuntimeException {
    public MalformedMessageException(String message) {
        super(message);
    }

    public MalformedMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
