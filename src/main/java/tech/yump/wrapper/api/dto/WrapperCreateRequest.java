package tech.yump.wrapper.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Raw create payload. Fields stay untyped so that shape problems are reported as field
 * errors by the validator instead of failing JSON binding.
 */
@Schema(description = "Secret to wrap and its lifetime")
public record WrapperCreateRequest(
        @Schema(description = "Secret value, stored verbatim.", example = "s3cr3t", requiredMode = Schema.RequiredMode.REQUIRED)
        Object value,
        @Schema(description = "Time-to-live in seconds, as a number or decimal string. Minimum 30.", example = "60", requiredMode = Schema.RequiredMode.REQUIRED)
        Object ttl
) {
    @Override
    public String toString() {
        return "WrapperCreateRequest[value=******, ttl=" + ttl + ']';
    }
}
