package tech.yump.wrapper.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Identifier of a newly wrapped secret")
public record CreatedWrapperData(
        @Schema(description = "Wrapper id to hand to the recipient.", example = "9f1c2b7de04a4b7c8a3e6f5d2c1b0a99")
        String id,
        @Schema(description = "Expiry as epoch seconds.", example = "1760905260")
        long expire
) {}
