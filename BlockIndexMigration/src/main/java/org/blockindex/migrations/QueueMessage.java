package org.blockindex.migrations;

/**
 * One delivery from a queue: the id the queue uses to track it and the raw body.
 */
public record QueueMessage(String messageId, String body) {
}
