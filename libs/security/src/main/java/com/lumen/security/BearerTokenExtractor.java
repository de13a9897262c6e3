package com.lumen.security;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the credential out of an {@code Authorization} header.
 * <p>
 * Accepts {@code Bearer <token>} with any casing of the scheme. The token is returned as-is; it
 * may be a session JWT or a long-lived user auth token, which the auth capability tells apart.
 */
public final class BearerTokenExtractor {

    private static final Pattern BEARER = Pattern.compile("^\\s*bearer\\s+(\\S+)\\s*$", Pattern.CASE_INSENSITIVE);

    private BearerTokenExtractor() {
        // utility class
    }

    /**
     * @param authorizationHeader the header value (may be null)
     * @return the token, or empty when the header is missing, uses another scheme, or is malformed
     */
    public static Optional<String> extract(String authorizationHeader) {
        if (authorizationHeader == null) {
            return Optional.empty();
        }
        Matcher matcher = BEARER.matcher(authorizationHeader);
        return matcher.matches() ? Optional.of(matcher.group(1)) : Optional.empty();
    }
}
