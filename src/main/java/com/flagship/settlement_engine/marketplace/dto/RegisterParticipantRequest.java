package com.flagship.settlement_engine.marketplace.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class RegisterParticipantRequest {

    @NotBlank(message = "Display name is required")
    @Size(max = 64, message = "Display name must be at most 64 characters")
    @JsonProperty("display_name")
    String displayName;
}
