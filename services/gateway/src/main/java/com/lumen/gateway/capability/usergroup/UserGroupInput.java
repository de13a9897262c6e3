package com.lumen.gateway.capability.usergroup;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record UserGroupInput(
        @NotBlank @Size(max = 64) @Pattern(regexp = "^[A-Za-z0-9_\\- ]+$", message = "may only contain letters, digits, spaces, '_' and '-'") String name) {
}
