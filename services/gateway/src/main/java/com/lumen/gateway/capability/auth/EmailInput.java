package com.lumen.gateway.capability.auth;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

public record EmailInput(@NotBlank @Email String email) {
}
