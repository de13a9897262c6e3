package com.lumen.gateway.capability.auth;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * @param oldPassword current password, may be null for accounts created through SSO
 */
public record PasswordChangeInput(
        String oldPassword,
        @NotBlank @Size(min = 8, max = 20) String newPassword1,
        @NotBlank String newPassword2) {
}
