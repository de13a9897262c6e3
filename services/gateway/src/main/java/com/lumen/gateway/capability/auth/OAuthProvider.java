package com.lumen.gateway.capability.auth;

public enum OAuthProvider {
    GITHUB,
    GOOGLE,
    GITLAB
}
