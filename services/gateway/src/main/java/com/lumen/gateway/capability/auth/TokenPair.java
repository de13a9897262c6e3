package com.lumen.gateway.capability.auth;

/**
 * Session credentials issued by register, token auth and refresh.
 *
 * @param accessToken  short-lived JWT
 * @param refreshToken long-lived refresh token
 */
public record TokenPair(String accessToken, String refreshToken) {

    @Override
    public String toString() {
        return "TokenPair[accessToken=***, refreshToken=***]";
    }
}
