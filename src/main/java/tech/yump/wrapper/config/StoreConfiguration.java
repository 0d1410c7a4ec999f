package tech.yump.wrapper.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.DynamoDbClientBuilder;
import tech.yump.wrapper.storage.DynamoDbWrapperStore;
import tech.yump.wrapper.storage.InMemoryWrapperStore;
import tech.yump.wrapper.storage.WrapperStore;

import java.net.URI;
import java.time.Clock;

/**
 * Wires the {@link WrapperStore} selected by {@code wrapper.store.backend}. The DynamoDB
 * client is built once here and shared by every request.
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class StoreConfiguration {

    private final WrapperProperties wrapperProperties;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(name = "wrapper.store.backend", havingValue = "dynamodb", matchIfMissing = true)
    public DynamoDbClient dynamoDbClient() {
        WrapperProperties.DynamoDbProperties props = wrapperProperties.store().dynamodb();
        DynamoDbClientBuilder builder = DynamoDbClient.builder();

        if (props.region() != null && !props.region().isBlank()) {
            builder.region(Region.of(props.region()));
        }
        if (props.hasEndpointOverride()) {
            log.info("Using DynamoDB endpoint override: {}", props.endpoint());
            builder.endpointOverride(URI.create(props.endpoint()));
        }
        if (props.hasStaticCredentials()) {
            builder.credentialsProvider(StaticCredentialsProvider.create(
                    AwsBasicCredentials.create(props.accessKeyId(), props.secretAccessKey())));
        } else {
            builder.credentialsProvider(DefaultCredentialsProvider.create());
        }
        return builder.build();
    }

    @Bean
    @ConditionalOnProperty(name = "wrapper.store.backend", havingValue = "dynamodb", matchIfMissing = true)
    public WrapperStore dynamoDbWrapperStore(DynamoDbClient dynamoDbClient) {
        WrapperProperties.DynamoDbProperties props = wrapperProperties.store().dynamodb();
        log.info("Configuring DynamoDB Wrapper Store on table '{}'", props.tableName());
        if (props.createTable()) {
            new DynamoDbTableInitializer(dynamoDbClient, props.tableName()).ensureTable();
        }
        return new DynamoDbWrapperStore(dynamoDbClient, props.tableName());
    }

    @Bean
    @ConditionalOnProperty(name = "wrapper.store.backend", havingValue = "memory")
    public WrapperStore inMemoryWrapperStore(Clock clock) {
        log.warn("Configuring in-memory Wrapper Store. Records do not survive a restart "
                + "and are not shared between instances.");
        return new InMemoryWrapperStore(clock);
    }
}
