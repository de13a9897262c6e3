package com.lumen.gateway.capability.setting;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

public record NetworkSettingInput(
        @NotBlank @Pattern(regexp = "^https?://[^\\s/]+(/\\S*)?$", message = "must be an http or https URL") String externalUrl) {
}
