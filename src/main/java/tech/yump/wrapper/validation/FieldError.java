package tech.yump.wrapper.validation;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "A single field-level validation failure")
public record FieldError(
        @Schema(description = "Location of the offending field.", example = "[\"ttl\"]")
        List<String> loc,
        @Schema(description = "Human-readable reason.", example = "must be greater than 30 seconds")
        String msg,
        @Schema(description = "Machine-readable error category.", example = "value_error")
        String type
) {
    public static final String TYPE_VALUE_ERROR = "value_error";
    public static final String TYPE_MISSING = "value_error.missing";
    public static final String TYPE_INTEGER = "type_error.integer";
    public static final String TYPE_NOT_LE = "value_error.number.not_le";
    public static final String TYPE_STRING = "type_error.str";
    public static final String TYPE_JSON = "value_error.jsondecode";

    public FieldError {
        loc = List.copyOf(loc);
    }

    public static FieldError of(String field, String msg, String type) {
        return new FieldError(List.of(field), msg, type);
    }

    public String field() {
        return loc.isEmpty() ? null : loc.get(loc.size() - 1);
    }
}
