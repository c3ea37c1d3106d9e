package org.blockindex.migrations.aws;

import java.net.URI;

import org.blockindex.migrations.MigrationConfig;

import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.awscore.client.builder.AwsClientBuilder;
import software.amazon.awssdk.core.retry.RetryMode;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbAsyncClient;
import software.amazon.awssdk.services.lambda.LambdaAsyncClient;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;
import software.amazon.awssdk.services.ssm.SsmAsyncClient;

/**
 * The async clients one invocation needs, sharing region, credentials and endpoint override.
 */
@Slf4j
public record AwsClients(
    DynamoDbAsyncClient dynamoDb,
    SqsAsyncClient sqs,
    SsmAsyncClient ssm,
    LambdaAsyncClient lambda
) implements AutoCloseable {

    public static AwsClients create(MigrationConfig config) {
        log.info("Creating AWS clients for region {}{}", config.getRegion() == null ? "(default)" : config.getRegion(),
            config.getEndpoint() == null ? "" : " with endpoint " + config.getEndpoint());
        return new AwsClients(
            configure(DynamoDbAsyncClient.builder(), config).build(),
            configure(SqsAsyncClient.builder(), config).build(),
            configure(SsmAsyncClient.builder(), config).build(),
            configure(LambdaAsyncClient.builder(), config).build());
    }

    private static <B extends AwsClientBuilder<B, ?>> B configure(B builder, MigrationConfig config) {
        builder.credentialsProvider(DefaultCredentialsProvider.create())
            .overrideConfiguration(o -> o.retryPolicy(RetryMode.STANDARD));
        if (config.getRegion() != null) {
            builder.region(Region.of(config.getRegion()));
        }
        if (config.getEndpoint() != null) {
            builder.endpointOverride(URI.create(config.getEndpoint()));
        }
        return builder;
    }

    @Override
    public void close() {
        dynamoDb.close();
        sqs.close();
        ssm.close();
        lambda.close();
    }
}
