package com.lumen.gateway.capability.auth;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RegisterInput(
        @NotBlank @Email String email,
        @NotBlank @Size(min = 8, max = 20) String password1,
        @NotBlank String password2,
        String invitationCode,
        @NotBlank @Size(max = 64) String name) {

    @Override
    public String toString() {
        return "RegisterInput[email=" + email + ", name=" + name + "]";
    }
}
