package com.lumen.gateway.capability.repository;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record GitRepositoryInput(
        @NotBlank @Size(max = 255) @Pattern(regexp = "^[A-Za-z0-9_.\\-]+$", message = "may only contain letters, digits, '.', '_' and '-'") String name,
        @NotBlank @Pattern(regexp = "^(https?|ssh|git|file)://\\S+$", message = "must be a git URL") String gitUrl) {
}
