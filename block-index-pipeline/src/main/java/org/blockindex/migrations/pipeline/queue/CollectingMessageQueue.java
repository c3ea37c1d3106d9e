package org.blockindex.migrations.pipeline.queue;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import reactor.core.publisher.Mono;

/**
 * A MessageQueue that keeps every message it is given, for tests and dry runs.
 */
public class CollectingMessageQueue implements MessageQueue {

    private final List<String> messages = new CopyOnWriteArrayList<>();

    @Override
    public Mono<Void> send(String body) {
        return Mono.fromRunnable(() -> messages.add(body));
    }

    public List<String> getMessages() {
        return Collections.unmodifiableList(messages);
    }
}
