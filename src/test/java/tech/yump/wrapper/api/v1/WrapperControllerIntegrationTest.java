package tech.yump.wrapper.api.v1;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import tech.yump.wrapper.MutableClock;
import tech.yump.wrapper.api.RequestCorrelationFilter;
import tech.yump.wrapper.storage.WrapperStore;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.matchesPattern;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@ExtendWith(OutputCaptureExtension.class)
class WrapperControllerIntegrationTest {

    private static final Instant START = Instant.parse("2026-10-19T12:00:00Z");

    @TestConfiguration
    static class ClockConfig {
        @Bean
        @Primary
        MutableClock mutableClock() {
            return new MutableClock(START);
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private MutableClock clock;

    @SpyBean
    private WrapperStore wrapperStore;

    @BeforeEach
    void setUp() {
        clock.set(START);
    }

    private JsonNode create(Object value, Object ttl) throws Exception {
        MvcResult result = mockMvc.perform(post("/v1/wrapper")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("value", value, "ttl", ttl))))
                .andExpect(status().isOk())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    private JsonNode unwrap(String id) throws Exception {
        MvcResult result = mockMvc.perform(get("/v1/wrapper/{id}", id))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    // ========================================
    // Create
    // ========================================

    @Test
    @DisplayName("POST: Should wrap a value and return a 32-char id with expire = now + ttl")
    void create_success() throws Exception {
        MvcResult result = mockMvc.perform(post("/v1/wrapper")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"value\":\"s3cr3t\",\"ttl\":\"60\"}"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.status").value("success"))
                .andExpect(jsonPath("$.data.id").value(matchesPattern("[0-9a-f]{32}")))
                .andExpect(jsonPath("$.data.value").doesNotExist())
                .andExpect(jsonPath("$.error").doesNotExist())
                .andExpect(jsonPath("$.ref").isNotEmpty())
                .andExpect(header().exists(RequestCorrelationFilter.REQUEST_ID_HEADER))
                .andReturn();

        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        assertThat(body.path("data").path("expire").asLong()).isEqualTo(START.getEpochSecond() + 60);
        assertThat(body.path("ref").asText())
                .isEqualTo(result.getResponse().getHeader(RequestCorrelationFilter.REQUEST_ID_HEADER));
    }

    @Test
    @DisplayName("POST: Should accept ttl as a JSON integer")
    void create_integerTtl() throws Exception {
        JsonNode body = create("token", 30);

        assertThat(body.path("status").asText()).isEqualTo("success");
        assertThat(body.path("data").path("expire").asLong()).isEqualTo(START.getEpochSecond() + 30);
    }

    @Test
    @DisplayName("POST: Should fail with a ttl field error below 30 seconds, still HTTP 200")
    void create_ttlTooShort() throws Exception {
        mockMvc.perform(post("/v1/wrapper")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"value\":\"s3cr3t\",\"ttl\":\"29\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("failed"))
                .andExpect(jsonPath("$.error[0].loc[0]").value("ttl"))
                .andExpect(jsonPath("$.error[0].msg").value("must be greater than 30 seconds"))
                .andExpect(jsonPath("$.data").doesNotExist())
                .andExpect(jsonPath("$.ref").isNotEmpty());

        verify(wrapperStore, never()).putIfAbsent(any());
    }

    @Test
    @DisplayName("POST: Should report a missing value and a non-numeric ttl together")
    void create_missingValueAndBadTtl() throws Exception {
        mockMvc.perform(post("/v1/wrapper")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"ttl\":\"soon\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("failed"))
                .andExpect(jsonPath("$.error[0].loc[0]").value("ttl"))
                .andExpect(jsonPath("$.error[0].type").value("type_error.integer"))
                .andExpect(jsonPath("$.error[1].loc[0]").value("value"))
                .andExpect(jsonPath("$.error[1].msg").value("field required"));
    }

    @Test
    @DisplayName("POST: Should fail with a body field error for malformed JSON")
    void create_malformedJson() throws Exception {
        mockMvc.perform(post("/v1/wrapper")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"value\": \"unterminated"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("failed"))
                .andExpect(jsonPath("$.error[0].loc[0]").value("body"))
                .andExpect(jsonPath("$.ref").isNotEmpty());
    }

    @Test
    @DisplayName("POST: Should treat an absent body as missing fields")
    void create_noBody() throws Exception {
        mockMvc.perform(post("/v1/wrapper").contentType(MediaType.APPLICATION_JSON))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("failed"))
                .andExpect(jsonPath("$.error.length()").value(2));
    }

    @Test
    @DisplayName("POST: Should echo the platform-supplied request id as ref")
    void create_echoesRequestId() throws Exception {
        mockMvc.perform(post("/v1/wrapper")
                        .header(RequestCorrelationFilter.REQUEST_ID_HEADER, "c0ffee-1234")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"value\":\"v\",\"ttl\":45}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ref").value("c0ffee-1234"))
                .andExpect(header().string(RequestCorrelationFilter.REQUEST_ID_HEADER, "c0ffee-1234"));
    }

    @Test
    @DisplayName("POST: Should reject a ttl too large for an epoch-second expiry as a ttl field error")
    void create_ttlTooLarge() throws Exception {
        mockMvc.perform(post("/v1/wrapper")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"value\":\"v\",\"ttl\":\"9223372036854775807\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("failed"))
                .andExpect(jsonPath("$.error[0].loc[0]").value("ttl"))
                .andExpect(jsonPath("$.error[0].type").value("value_error.number.not_le"))
                .andExpect(jsonPath("$.ref").isNotEmpty());

        verify(wrapperStore, never()).putIfAbsent(any());
    }

    @Test
    @DisplayName("POST: Should accept the largest allowed ttl")
    void create_maximumTtl() throws Exception {
        JsonNode body = create("v", Long.toString(Long.MAX_VALUE / 2));

        assertThat(body.path("status").asText()).isEqualTo("success");
        assertThat(body.path("data").path("expire").asLong()).isEqualTo(START.getEpochSecond() + Long.MAX_VALUE / 2);
    }

    @Test
    @DisplayName("POST: Should keep the new wrapper id out of the logs")
    void create_doesNotLogId(CapturedOutput output) throws Exception {
        String id = create("s3cr3t", 60).path("data").path("id").asText();

        assertThat(id).hasSize(32);
        assertThat(output.getOut())
                .contains("Wrap request successful")
                .doesNotContain(id)
                .doesNotContain("s3cr3t");
    }

    @Test
    @DisplayName("POST: Validation rejections should be logged at INFO")
    void create_rejectionLoggedAtInfo(CapturedOutput output) throws Exception {
        create("v", 5);

        assertThat(output.getOut().lines().filter(line -> line.contains("Wrap request rejected")))
                .isNotEmpty()
                .allSatisfy(line -> assertThat(line).contains(" INFO "));
    }

    // ========================================
    // Retrieve
    // ========================================

    @Test
    @DisplayName("GET: Should return the value once, then report not found")
    void roundTrip_thenNotFound() throws Exception {
        JsonNode created = create("s3cr3t", "60");
        String id = created.path("data").path("id").asText();
        long expire = created.path("data").path("expire").asLong();

        JsonNode first = unwrap(id);
        assertThat(first.path("status").asText()).isEqualTo("success");
        assertThat(first.path("data").path("id").asText()).isEqualTo(id);
        assertThat(first.path("data").path("value").asText()).isEqualTo("s3cr3t");
        assertThat(first.path("data").path("expire").asLong()).isEqualTo(expire);

        JsonNode second = unwrap(id);
        assertThat(second.path("status").asText()).isEqualTo("failed");
        assertThat(second.path("error").asText()).isEqualTo("wrapper id not found or expired");
        assertThat(second.has("data")).isFalse();
    }

    @Test
    @DisplayName("GET: Should round-trip an empty value")
    void roundTrip_emptyValue() throws Exception {
        String id = create("", 30).path("data").path("id").asText();

        JsonNode body = unwrap(id);

        assertThat(body.path("status").asText()).isEqualTo("success");
        assertThat(body.path("data").path("value").isTextual()).isTrue();
        assertThat(body.path("data").path("value").asText()).isEmpty();
    }

    @Test
    @DisplayName("GET: Should report not found for a never-created id, every time")
    void unknownId_notFoundTwice() throws Exception {
        for (int i = 0; i < 2; i++) {
            mockMvc.perform(get("/v1/wrapper/{id}", "0123456789abcdef0123456789abcdef"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("failed"))
                    .andExpect(jsonPath("$.error").value("wrapper id not found or expired"));
        }
    }

    @Test
    @DisplayName("GET: Should reject a non-alphanumeric id without touching the store")
    void invalidId_rejectedBeforeStore() throws Exception {
        mockMvc.perform(get("/v1/wrapper/{id}", "abc-123"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("failed"))
                .andExpect(jsonPath("$.error[0].loc[0]").value("id"))
                .andExpect(jsonPath("$.error[0].msg").value("id contains invalid characters"));

        verify(wrapperStore, never()).deleteAndGet(anyString());
    }

    @ParameterizedTest
    @ValueSource(strings = {"/v1/wrapper/abc;x", "/v1/wrapper/abc%2Fdef", "/v1/wrapper/abc%25", "/v1/wrapper/abc%5Cx"})
    @DisplayName("GET: Ids refused by the request firewall should still get an id field error envelope")
    void firewallRejectedId_reportedAsInvalidId(String path) throws Exception {
        mockMvc.perform(get(URI.create(path)))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.status").value("failed"))
                .andExpect(jsonPath("$.error[0].loc[0]").value("id"))
                .andExpect(jsonPath("$.error[0].msg").value("id contains invalid characters"))
                .andExpect(jsonPath("$.ref").isNotEmpty())
                .andExpect(header().exists(RequestCorrelationFilter.REQUEST_ID_HEADER));

        verify(wrapperStore, never()).deleteAndGet(anyString());
    }

    @Test
    @DisplayName("POST: A create path refused by the request firewall should keep 400 but carry the envelope")
    void firewallRejectedCreatePath_badRequestEnvelope() throws Exception {
        mockMvc.perform(post(URI.create("/v1/wrapper;jsessionid=1"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"value\":\"v\",\"ttl\":60}"))
                .andExpect(status().isBadRequest())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.status").value("failed"))
                .andExpect(jsonPath("$.error").value("bad request"))
                .andExpect(jsonPath("$.ref").isNotEmpty());

        verify(wrapperStore, never()).putIfAbsent(any());
    }

    @Test
    @DisplayName("GET: Not-found outcomes should be logged at ERROR")
    void notFound_loggedAtError(CapturedOutput output) throws Exception {
        unwrap("ffffffffffffffffffffffffffffffff");

        assertThat(output.getOut().lines().filter(line -> line.contains("wrapper id not found or expired")))
                .isNotEmpty()
                .allSatisfy(line -> assertThat(line).contains("ERROR"));
    }

    @Test
    @DisplayName("GET: Should report not found once the ttl has elapsed")
    void expiredWrapper_notFound() throws Exception {
        String id = create("short-lived", 30).path("data").path("id").asText();

        clock.advance(Duration.ofSeconds(30));

        JsonNode body = unwrap(id);
        assertThat(body.path("status").asText()).isEqualTo("failed");
        assertThat(body.path("error").asText()).isEqualTo("wrapper id not found or expired");
    }

    @Test
    @DisplayName("GET: Should still return the value just before expiry")
    void almostExpiredWrapper_found() throws Exception {
        String id = create("v", 30).path("data").path("id").asText();

        clock.advance(Duration.ofSeconds(29));

        assertThat(unwrap(id).path("status").asText()).isEqualTo("success");
    }

    @Test
    @DisplayName("GET: Exactly one of several concurrent retrievals should succeed")
    void concurrentRetrievals_exactlyOneSucceeds() throws Exception {
        String id = create("race", 60).path("data").path("id").asText();

        int callers = 6;
        ExecutorService executor = Executors.newFixedThreadPool(callers);
        try {
            List<Callable<JsonNode>> calls = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                calls.add(() -> unwrap(id));
            }
            List<JsonNode> bodies = new ArrayList<>();
            for (Future<JsonNode> future : executor.invokeAll(calls, 10, TimeUnit.SECONDS)) {
                bodies.add(future.get());
            }

            assertThat(bodies).filteredOn(b -> "success".equals(b.path("status").asText()))
                    .singleElement()
                    .satisfies(b -> assertThat(b.path("data").path("value").asText()).isEqualTo("race"));
            assertThat(bodies).filteredOn(b -> "failed".equals(b.path("status").asText()))
                    .hasSize(callers - 1)
                    .allSatisfy(b -> assertThat(b.path("error").asText()).isEqualTo("wrapper id not found or expired"));
        } finally {
            executor.shutdownNow();
        }
    }

    // ========================================
    // Surface
    // ========================================

    @Test
    @DisplayName("Health endpoint should be reachable anonymously")
    void health_isPublic() throws Exception {
        mockMvc.perform(get("/actuator/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"));
    }

    @Test
    @DisplayName("Paths outside the public surface should be denied")
    void otherPaths_denied() throws Exception {
        mockMvc.perform(get("/v1/kv/data/anything"))
                .andExpect(status().isForbidden());
    }
}
