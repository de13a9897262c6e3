package com.lumen.gateway.capability.analytic;

import java.time.Instant;

public record CompletionStats(Instant start, String language, int completions, int views, int selects) {
}
