package com.lumen.gateway.capability.page;

import jakarta.validation.constraints.NotBlank;

public record CreateThreadToPageRunInput(@NotBlank String threadId) {
}
