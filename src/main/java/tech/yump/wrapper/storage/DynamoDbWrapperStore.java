package tech.yump.wrapper.storage;

import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemResponse;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.ReturnValue;

import java.util.Map;
import java.util.Optional;

/**
 * {@link WrapperStore} backed by a DynamoDB table whose partition key is {@code id} and
 * whose TTL attribute is {@code ttl}. All AWS SDK types are confined to this class and
 * the configuration that builds the client.
 */
@Slf4j
public class DynamoDbWrapperStore implements WrapperStore {

    public static final String ATTR_ID = "id";
    public static final String ATTR_VALUE = "value";
    public static final String ATTR_TTL = "ttl";

    static final String ID_ABSENT_CONDITION = "attribute_not_exists(#id)";

    private final DynamoDbClient dynamoDbClient;
    private final String tableName;

    public DynamoDbWrapperStore(DynamoDbClient dynamoDbClient, String tableName) {
        this.dynamoDbClient = dynamoDbClient;
        this.tableName = tableName;
    }

    @Override
    public void putIfAbsent(WrapperRecord record) throws StorageException {
        PutItemRequest request = PutItemRequest.builder()
                .tableName(tableName)
                .item(Map.of(
                        ATTR_ID, AttributeValue.fromS(record.id()),
                        ATTR_VALUE, AttributeValue.fromS(record.value()),
                        ATTR_TTL, AttributeValue.fromN(Long.toString(record.expireAt()))))
                .conditionExpression(ID_ABSENT_CONDITION)
                .expressionAttributeNames(Map.of("#id", ATTR_ID))
                .build();
        try {
            dynamoDbClient.putItem(request);
            log.debug("Stored wrapper record in table {}", tableName);
        } catch (ConditionalCheckFailedException e) {
            throw new DuplicateWrapperIdException(record.id(), e);
        } catch (SdkException e) {
            throw new StorageException("Failed to write wrapper record to table " + tableName, e);
        }
    }

    @Override
    public Optional<WrapperRecord> deleteAndGet(String id) throws StorageException {
        DeleteItemRequest request = DeleteItemRequest.builder()
                .tableName(tableName)
                .key(Map.of(ATTR_ID, AttributeValue.fromS(id)))
                .returnValues(ReturnValue.ALL_OLD)
                .build();

        DeleteItemResponse response;
        try {
            response = dynamoDbClient.deleteItem(request);
        } catch (SdkException e) {
            throw new StorageException("Failed to delete wrapper record from table " + tableName, e);
        }

        if (!response.hasAttributes() || response.attributes().isEmpty()) {
            log.debug("No item under id {} in table {}", id, tableName);
            return Optional.empty();
        }
        return Optional.of(toRecord(response.attributes()));
    }

    private WrapperRecord toRecord(Map<String, AttributeValue> item) {
        String id = requireString(item, ATTR_ID);
        String value = requireString(item, ATTR_VALUE);
        AttributeValue ttl = item.get(ATTR_TTL);
        if (ttl == null || ttl.n() == null) {
            throw new StorageException("Stored item " + id + " has no numeric '" + ATTR_TTL + "' attribute");
        }
        try {
            return new WrapperRecord(id, value, Long.parseLong(ttl.n()));
        } catch (NumberFormatException e) {
            throw new StorageException("Stored item " + id + " has a non-integer '" + ATTR_TTL + "' attribute", e);
        }
    }

    private static String requireString(Map<String, AttributeValue> item, String name) {
        AttributeValue attribute = item.get(name);
        if (attribute == null || attribute.s() == null) {
            throw new StorageException("Stored item is missing string attribute '" + name + "'");
        }
        return attribute.s();
    }
}
