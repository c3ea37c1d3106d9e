package org.blockindex.migrations.aws;

import org.blockindex.migrations.ScanRequest;
import org.blockindex.migrations.pipeline.ir.ScanPartition;
import org.blockindex.migrations.pipeline.scan.ContinuationScheduler;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.lambda.LambdaAsyncClient;
import software.amazon.awssdk.services.lambda.model.InvocationType;
import software.amazon.awssdk.services.lambda.model.InvokeRequest;
import software.amazon.awssdk.services.lambda.model.LogType;

/**
 * Continues a partition scan by invoking the scanner function asynchronously with the same partition.
 */
@Slf4j
public class LambdaContinuationScheduler implements ContinuationScheduler {
    private static final int ACCEPTED = 202;

    private final LambdaAsyncClient client;
    private final String functionName;

    public LambdaContinuationScheduler(LambdaAsyncClient client, String functionName) {
        this.client = client;
        this.functionName = functionName;
    }

    @Override
    public Mono<Void> schedule(ScanPartition partition) {
        return Mono.fromCallable(() -> InvokeRequest.builder()
                .functionName(functionName)
                .invocationType(InvocationType.EVENT)
                .logType(LogType.NONE)
                .payload(SdkBytes.fromUtf8String(ScanRequest.forPartition(partition).toJson()))
                .build())
            .flatMap(request -> Mono.fromFuture(() -> client.invoke(request)))
            .flatMap(response -> {
                if (response.statusCode() == null || response.statusCode() != ACCEPTED) {
                    return Mono.<Void>error(new IllegalStateException("Invocation of " + functionName
                        + " for partition " + partition + " was not accepted: " + response.statusCode()));
                }
                log.info("Scheduled {} for partition {}", functionName, partition);
                return Mono.<Void>empty();
            })
            .onErrorMap(AwsErrors::isTransient, e -> AwsErrors.asTransient("Invoke " + functionName, e));
    }
}
