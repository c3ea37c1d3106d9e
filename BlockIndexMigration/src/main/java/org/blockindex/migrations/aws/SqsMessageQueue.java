package org.blockindex.migrations.aws;

import org.blockindex.migrations.pipeline.queue.MessageQueue;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;
import software.amazon.awssdk.services.sqs.model.SendMessageRequest;

@Slf4j
public class SqsMessageQueue implements MessageQueue {
    private final SqsAsyncClient client;
    private final String queueUrl;

    public SqsMessageQueue(SqsAsyncClient client, String queueUrl) {
        this.client = client;
        this.queueUrl = queueUrl;
    }

    @Override
    public Mono<Void> send(String body) {
        var request = SendMessageRequest.builder()
            .queueUrl(queueUrl)
            .messageBody(body)
            .build();
        return Mono.fromFuture(() -> client.sendMessage(request))
            .doOnNext(response -> log.debug("Sent message {} to {}", response.messageId(), queueUrl))
            .onErrorMap(AwsErrors::isTransient, e -> AwsErrors.asTransient("SendMessage to " + queueUrl, e))
            .then();
    }
}
