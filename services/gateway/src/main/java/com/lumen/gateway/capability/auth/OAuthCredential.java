package com.lumen.gateway.capability.auth;

/**
 * OAuth client registration. The client secret is write-only and never returned.
 */
public record OAuthCredential(OAuthProvider provider, String clientId) {
}
