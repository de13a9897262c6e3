package com.lumen.gateway.capability.thread;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

public record CreateThreadAndRunInput(@NotNull @Valid CreateThreadInput thread, ThreadRunOptions options) {

    public CreateThreadAndRunInput {
        options = options == null ? ThreadRunOptions.defaults() : options;
    }
}
