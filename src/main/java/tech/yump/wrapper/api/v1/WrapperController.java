package tech.yump.wrapper.api.v1;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import tech.yump.wrapper.api.RequestCorrelationFilter;
import tech.yump.wrapper.api.dto.CreatedWrapperData;
import tech.yump.wrapper.api.dto.WrapperCreateRequest;
import tech.yump.wrapper.api.dto.WrapperData;
import tech.yump.wrapper.api.dto.WrapperResponse;
import tech.yump.wrapper.gateway.CreatedWrapper;
import tech.yump.wrapper.gateway.SecretStoreGateway;
import tech.yump.wrapper.storage.WrapperRecord;
import tech.yump.wrapper.validation.CreateCommand;
import tech.yump.wrapper.validation.Validated;
import tech.yump.wrapper.validation.WrapperValidator;

import java.util.Optional;

@RestController
@RequestMapping("/v1/wrapper")
@Slf4j
@RequiredArgsConstructor
@Tag(name = "Wrapper", description = "Wrap a secret once, unwrap it once")
public class WrapperController {

    public static final String NOT_FOUND_MESSAGE = "wrapper id not found or expired";

    private final WrapperValidator validator;
    private final SecretStoreGateway gateway;

    @PostMapping
    @Operation(
            summary = "Wrap a secret",
            description = "Stores the value for 'ttl' seconds and returns the id that unwraps it. "
                    + "The outcome is in the 'status' field; the HTTP status is always 200."
    )
    @ApiResponse(responseCode = "200", description = "Success or failure envelope.",
            content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = WrapperResponse.class)))
    public ResponseEntity<WrapperResponse<CreatedWrapperData>> createWrapper(
            @RequestBody(required = false) WrapperCreateRequest body,
            HttpServletRequest request
    ) {
        String ref = RequestCorrelationFilter.currentRef(request);
        log.info("Validating incoming wrap request");

        Validated<CreateCommand> command = body == null
                ? validator.validateCreatePayload(null, null)
                : validator.validateCreatePayload(body.value(), body.ttl());
        if (!command.isValid()) {
            log.info("Wrap request rejected: {}", command.errors());
            return respond(WrapperResponse.failed(command.errors(), ref));
        }

        CreatedWrapper created = gateway.create(command.get().value(), command.get().ttlSeconds());
        // The id alone unwraps the secret; it stays out of the logs while the record is live.
        log.info("Wrap request successful, expires at {}", created.expireAt());
        return respond(WrapperResponse.success(new CreatedWrapperData(created.id(), created.expireAt()), ref));
    }

    @GetMapping("/{id}")
    @Operation(
            summary = "Unwrap a secret",
            description = "Returns the wrapped value and deletes it. A second call for the same id fails, "
                    + "as does a call for an unknown or expired id."
    )
    @ApiResponse(responseCode = "200", description = "Success or failure envelope.",
            content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = WrapperResponse.class)))
    public ResponseEntity<WrapperResponse<WrapperData>> unwrap(
            @Parameter(description = "Wrapper id returned by the wrap call. Alphanumeric only.", required = true, example = "9f1c2b7de04a4b7c8a3e6f5d2c1b0a99")
            @PathVariable String id,
            HttpServletRequest request
    ) {
        String ref = RequestCorrelationFilter.currentRef(request);

        Validated<String> validId = validator.validateId(id);
        if (!validId.isValid()) {
            log.info("Unwrap request rejected: {}", validId.errors());
            return respond(WrapperResponse.failed(validId.errors(), ref));
        }

        Optional<WrapperRecord> record = gateway.retrieveAndDelete(validId.get());
        if (record.isEmpty()) {
            log.error("{}: {}", NOT_FOUND_MESSAGE, id);
            return respond(WrapperResponse.failed(NOT_FOUND_MESSAGE, ref));
        }

        WrapperRecord unwrapped = record.get();
        log.info("Unwrap request successful, id {}", unwrapped.id());
        return respond(WrapperResponse.success(
                new WrapperData(unwrapped.id(), unwrapped.value(), unwrapped.expireAt()), ref));
    }

    private static <T> ResponseEntity<WrapperResponse<T>> respond(WrapperResponse<T> body) {
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_JSON)
                .body(body);
    }
}
