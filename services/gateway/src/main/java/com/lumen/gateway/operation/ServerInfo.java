package com.lumen.gateway.operation;

/**
 * Public facts about the deployment, readable without signing in.
 */
public record ServerInfo(
        boolean adminInitialized,
        boolean chatEnabled,
        boolean pageEnabled,
        boolean demoMode,
        boolean emailConfigured) {
}
