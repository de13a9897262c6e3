package com.lumen.gateway.capability.auth;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

public record TokenAuthInput(@NotBlank @Email String email, @NotBlank String password) {

    @Override
    public String toString() {
        return "TokenAuthInput[email=" + email + "]";
    }
}
