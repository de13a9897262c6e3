package com.lumen.gateway.operation;

import com.lumen.gateway.capability.model.ModelKind;

public record ModelHealth(ModelKind kind, long latencyMs) {
}
