package com.lumen.gateway.capability.page;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Replacement title or content of a page or section.
 */
public record TextInput(@NotBlank @Size(max = 65536) String value) {
}
