package tech.yump.wrapper.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeDefinition;
import software.amazon.awssdk.services.dynamodb.model.BillingMode;
import software.amazon.awssdk.services.dynamodb.model.CreateTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;
import software.amazon.awssdk.services.dynamodb.model.KeySchemaElement;
import software.amazon.awssdk.services.dynamodb.model.KeyType;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;
import software.amazon.awssdk.services.dynamodb.model.ScalarAttributeType;
import software.amazon.awssdk.services.dynamodb.model.TimeToLiveSpecification;
import software.amazon.awssdk.services.dynamodb.model.UpdateTimeToLiveRequest;
import tech.yump.wrapper.storage.DynamoDbWrapperStore;
import tech.yump.wrapper.storage.StorageException;

/**
 * Creates the wrapper table for local development (e.g. against DynamoDB Local): string
 * partition key {@code id}, on-demand billing, TTL on the {@code ttl} attribute.
 * Deployed environments provision the table outside this application.
 */
@Slf4j
@RequiredArgsConstructor
public class DynamoDbTableInitializer {

    private final DynamoDbClient dynamoDbClient;
    private final String tableName;

    /**
     * @return true if the table was created, false if it already existed
     */
    public boolean ensureTable() {
        try {
            if (tableExists()) {
                log.info("DynamoDB table '{}' already exists", tableName);
                return false;
            }
            createTable();
            enableTimeToLive();
            log.info("Created DynamoDB table '{}' with TTL attribute '{}'", tableName, DynamoDbWrapperStore.ATTR_TTL);
            return true;
        } catch (SdkException e) {
            throw new StorageException("Failed to bootstrap DynamoDB table " + tableName, e);
        }
    }

    private boolean tableExists() {
        try {
            dynamoDbClient.describeTable(DescribeTableRequest.builder().tableName(tableName).build());
            return true;
        } catch (ResourceNotFoundException e) {
            return false;
        }
    }

    private void createTable() {
        dynamoDbClient.createTable(CreateTableRequest.builder()
                .tableName(tableName)
                .attributeDefinitions(AttributeDefinition.builder()
                        .attributeName(DynamoDbWrapperStore.ATTR_ID)
                        .attributeType(ScalarAttributeType.S)
                        .build())
                .keySchema(KeySchemaElement.builder()
                        .attributeName(DynamoDbWrapperStore.ATTR_ID)
                        .keyType(KeyType.HASH)
                        .build())
                .billingMode(BillingMode.PAY_PER_REQUEST)
                .build());
        dynamoDbClient.waiter().waitUntilTableExists(DescribeTableRequest.builder().tableName(tableName).build());
    }

    private void enableTimeToLive() {
        dynamoDbClient.updateTimeToLive(UpdateTimeToLiveRequest.builder()
                .tableName(tableName)
                .timeToLiveSpecification(TimeToLiveSpecification.builder()
                        .attributeName(DynamoDbWrapperStore.ATTR_TTL)
                        .enabled(true)
                        .build())
                .build());
    }
}
