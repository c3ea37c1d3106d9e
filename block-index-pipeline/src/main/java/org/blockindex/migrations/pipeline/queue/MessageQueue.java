package org.blockindex.migrations.pipeline.queue;

import reactor.core.publisher.Mono;

/**
 * Port for sending one message body to a durable queue.
 */
public interface MessageQueue {

    /** Cold: nothing is sent until subscription, and resubscribing sends again. */
    Mono<Void> send(String body);
}
