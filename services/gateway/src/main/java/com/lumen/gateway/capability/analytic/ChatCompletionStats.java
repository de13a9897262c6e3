package com.lumen.gateway.capability.analytic;

import java.time.Instant;

public record ChatCompletionStats(Instant start, int chats) {
}
