package com.lumen.gateway.capability.repository;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * @param apiBase required for self-hosted kinds only
 */
public record IntegrationInput(
        @NotNull IntegrationKind kind,
        @NotBlank @Size(max = 64) String displayName,
        @NotBlank String accessToken,
        @Pattern(regexp = "^https?://\\S+$", message = "must be an http or https URL") String apiBase) {

    @Override
    public String toString() {
        return "IntegrationInput[kind=" + kind + ", displayName=" + displayName + "]";
    }
}
