package com.lumen.gateway.capability.thread;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record CreateThreadRunInput(
        @NotBlank String threadId,
        @NotNull @Valid CreateMessageInput additionalUserMessage,
        ThreadRunOptions options) {

    public CreateThreadRunInput {
        options = options == null ? ThreadRunOptions.defaults() : options;
    }
}
