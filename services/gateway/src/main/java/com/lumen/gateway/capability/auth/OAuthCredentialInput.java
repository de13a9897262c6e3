package com.lumen.gateway.capability.auth;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * @param clientSecret null keeps the stored secret
 */
public record OAuthCredentialInput(@NotNull OAuthProvider provider, @NotBlank String clientId, String clientSecret) {

    @Override
    public String toString() {
        return "OAuthCredentialInput[provider=" + provider + ", clientId=" + clientId + "]";
    }
}
