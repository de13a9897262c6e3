package com.lumen.gateway.capability.model;

public enum ModelKind {
    CHAT,
    COMPLETION,
    EMBEDDING
}
