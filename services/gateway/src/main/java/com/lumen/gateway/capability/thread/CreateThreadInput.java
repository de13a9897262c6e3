package com.lumen.gateway.capability.thread;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

public record CreateThreadInput(@NotNull @Valid CreateMessageInput userMessage) {
}
