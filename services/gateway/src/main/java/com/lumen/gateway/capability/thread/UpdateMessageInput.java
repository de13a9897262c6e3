package com.lumen.gateway.capability.thread;

import jakarta.validation.constraints.NotBlank;

public record UpdateMessageInput(@NotBlank String id, @NotBlank String threadId, @NotBlank String content) {
}
