package tech.yump.wrapper.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Envelope for every wrapper API response. Always sent with HTTP 200; {@code status} is the
 * outcome callers must branch on.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Response envelope. Exactly one of 'data' or 'error' is present.")
public record WrapperResponse<T>(
        @Schema(description = "Outcome of the call.", allowableValues = {"success", "failed"}, requiredMode = Schema.RequiredMode.REQUIRED)
        String status,
        @Schema(description = "Payload on success.")
        T data,
        @Schema(description = "Failure detail: a message, or a list of field errors for invalid input.")
        Object error,
        @Schema(description = "Request correlation reference.", requiredMode = Schema.RequiredMode.REQUIRED)
        String ref
) {
    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_FAILED = "failed";

    public static <T> WrapperResponse<T> success(T data, String ref) {
        return new WrapperResponse<>(STATUS_SUCCESS, data, null, ref);
    }

    public static <T> WrapperResponse<T> failed(Object error, String ref) {
        return new WrapperResponse<>(STATUS_FAILED, null, error, ref);
    }
}
