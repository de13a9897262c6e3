package com.lumen.gateway.capability.auth;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record UserNameInput(@NotBlank @Size(max = 64) String name) {
}
