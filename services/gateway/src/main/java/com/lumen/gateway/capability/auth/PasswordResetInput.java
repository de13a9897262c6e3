package com.lumen.gateway.capability.auth;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record PasswordResetInput(
        @NotBlank String code,
        @NotBlank @Size(min = 8, max = 20) String password1,
        @NotBlank String password2) {
}
