package tech.yump.wrapper.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.validation.BindValidationException;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import tech.yump.wrapper.storage.DynamoDbWrapperStore;
import tech.yump.wrapper.storage.InMemoryWrapperStore;
import tech.yump.wrapper.storage.WrapperStore;

import static org.assertj.core.api.Assertions.assertThat;

class ConfigurationValidationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(TestConfig.class, StoreConfiguration.class));

    @EnableConfigurationProperties(WrapperProperties.class)
    static class TestConfig {}

    @Test
    @DisplayName("Config Validation: Should FAIL when app name and environment are missing")
    void missingAppNameAndEnv_shouldFail() {
        contextRunner
                .withPropertyValues("wrapper.store.backend=memory")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure())
                            .hasRootCauseInstanceOf(BindValidationException.class)
                            .rootCause()
                            .hasMessageContaining("wrapper.app-name")
                            .hasMessageContaining("wrapper.env");
                });
    }

    @Test
    @DisplayName("Config Validation: Should FAIL when the dynamodb backend has no table name")
    void dynamoBackendWithoutTable_shouldFail() {
        contextRunner
                .withPropertyValues(
                        "wrapper.app-name=WrapperApp",
                        "wrapper.env=dev",
                        "wrapper.store.backend=dynamodb",
                        "wrapper.store.dynamodb.region=us-east-2")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure())
                            .hasRootCauseInstanceOf(BindValidationException.class)
                            .rootCause()
                            .hasMessageContaining("wrapper.store.dynamodb.table-name");
                });
    }

    @Test
    @DisplayName("Config Validation: Should wire the in-memory store when selected")
    void memoryBackend_shouldPass() {
        contextRunner
                .withPropertyValues(
                        "wrapper.app-name=WrapperApp",
                        "wrapper.env=test",
                        "wrapper.store.backend=memory")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context).hasSingleBean(WrapperStore.class);
                    assertThat(context.getBean(WrapperStore.class)).isInstanceOf(InMemoryWrapperStore.class);
                    assertThat(context).doesNotHaveBean(DynamoDbClient.class);
                });
    }

    @Test
    @DisplayName("Config Validation: Should default to the DynamoDB store")
    void defaultBackend_isDynamoDb() {
        contextRunner
                .withPropertyValues(
                        "wrapper.app-name=WrapperApp",
                        "wrapper.env=dev",
                        "wrapper.store.dynamodb.table-name=wrappers",
                        "wrapper.store.dynamodb.region=us-east-2",
                        "wrapper.store.dynamodb.access-key-id=local",
                        "wrapper.store.dynamodb.secret-access-key=local")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    WrapperProperties props = context.getBean(WrapperProperties.class);
                    assertThat(props.store().backend()).isEqualTo(WrapperProperties.StoreBackend.DYNAMODB);
                    assertThat(props.store().dynamodb().toString()).doesNotContain("secretAccessKey='local'");
                    assertThat(context.getBean(WrapperStore.class)).isInstanceOf(DynamoDbWrapperStore.class);
                    assertThat(context).hasSingleBean(DynamoDbClient.class);
                });
    }
}
