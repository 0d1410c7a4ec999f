package tech.yump.wrapper.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "An unwrapped secret. It has been deleted from the store.")
public record WrapperData(
        @Schema(description = "Wrapper id.", example = "9f1c2b7de04a4b7c8a3e6f5d2c1b0a99")
        String id,
        @Schema(description = "The secret value.", example = "s3cr3t")
        String value,
        @Schema(description = "Expiry the record was created with, as epoch seconds.", example = "1760905260")
        long expire
) {
    @Override
    public String toString() {
        return "WrapperData[id=" + id + ", value=******, expire=" + expire + ']';
    }
}
