package org.blockindex.migrations.aws;

import java.util.Optional;

import org.blockindex.migrations.pipeline.checkpoint.CheckpointStore;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import software.amazon.awssdk.services.ssm.SsmAsyncClient;
import software.amazon.awssdk.services.ssm.model.GetParameterRequest;
import software.amazon.awssdk.services.ssm.model.ParameterNotFoundException;
import software.amazon.awssdk.services.ssm.model.ParameterTier;
import software.amazon.awssdk.services.ssm.model.ParameterType;
import software.amazon.awssdk.services.ssm.model.PutParameterRequest;

/**
 * Checkpoints kept as SSM Parameter Store parameters. A missing parameter reads as empty.
 */
@Slf4j
public class SsmCheckpointStore implements CheckpointStore {
    private final SsmAsyncClient client;

    public SsmCheckpointStore(SsmAsyncClient client) {
        this.client = client;
    }

    @Override
    public Mono<Optional<String>> get(String key) {
        var request = GetParameterRequest.builder().name(key).build();
        return Mono.fromFuture(() -> client.getParameter(request))
            .map(response -> response.parameter() == null
                ? Optional.<String>empty()
                : Optional.ofNullable(response.parameter().value()))
            .onErrorResume(e -> AwsErrors.unwrap(e) instanceof ParameterNotFoundException,
                e -> {
                    log.debug("No parameter at {}", key);
                    return Mono.just(Optional.<String>empty());
                })
            .onErrorMap(AwsErrors::isTransient, e -> AwsErrors.asTransient("GetParameter " + key, e));
    }

    @Override
    public Mono<Void> put(String key, String value) {
        var request = PutParameterRequest.builder()
            .name(key)
            .value(value)
            .type(ParameterType.STRING)
            .overwrite(true)
            .tier(ParameterTier.STANDARD)
            .build();
        return Mono.fromFuture(() -> client.putParameter(request))
            .doOnNext(response -> log.debug("Stored {} version {}", key, response.version()))
            .onErrorMap(AwsErrors::isTransient, e -> AwsErrors.asTransient("PutParameter " + key, e))
            .then();
    }
}
