package tech.yump.wrapper.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the wrapper service under the 'wrapper' prefix.
 */
@ConfigurationProperties(prefix = "wrapper")
@Validated
public record WrapperProperties(

        @NotBlank(message = "Application name (wrapper.app-name) must be provided.")
        String appName,

        @NotBlank(message = "Deployment environment tag (wrapper.env) must be provided.")
        String env,

        @Valid
        @NotNull(message = "Store configuration (wrapper.store) is required.")
        StoreProperties store
) {

    public enum StoreBackend {
        DYNAMODB, MEMORY
    }

    @Validated
    public record StoreProperties(
            @DefaultValue("dynamodb")
            StoreBackend backend,

            @Valid
            DynamoDbProperties dynamodb
    ) {
        @AssertTrue(message = "DynamoDB table name (wrapper.store.dynamodb.table-name) must be provided when the dynamodb store backend is selected.")
        public boolean isDynamoDbConfigValid() {
            return backend != StoreBackend.DYNAMODB
                    || (dynamodb != null && StringUtils.hasText(dynamodb.tableName()));
        }
    }

    /**
     * Connection settings for the DynamoDB table holding wrapper records.
     * {@code endpoint} is only set when targeting DynamoDB Local or another emulator.
     */
    @Validated
    public record DynamoDbProperties(
            String tableName,
            String region,
            String endpoint,
            String accessKeyId,
            String secretAccessKey,
            boolean createTable
    ) {
        public boolean hasEndpointOverride() {
            return StringUtils.hasText(endpoint);
        }

        public boolean hasStaticCredentials() {
            return StringUtils.hasText(accessKeyId) && StringUtils.hasText(secretAccessKey);
        }

        @Override
        public String toString() {
            return "DynamoDbProperties[" +
                    "tableName='" + tableName + '\'' +
                    ", region='" + region + '\'' +
                    ", endpoint='" + endpoint + '\'' +
                    ", accessKeyId='" + accessKeyId + '\'' +
                    ", secretAccessKey=******" +
                    ", createTable=" + createTable +
                    ']';
        }
    }
}
