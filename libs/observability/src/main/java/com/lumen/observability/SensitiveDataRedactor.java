package com.lumen.observability;

import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Masks secrets inside free text before it reaches a log line or a client-visible error message.
 * <p>
 * Sensitive keys: password, token, secret, authorization, apikey, api_key, credential. Matching is
 * case-insensitive and also catches keys that merely contain one of them, such as
 * {@code smtpPassword} or {@code refresh_token}.
 */
public final class SensitiveDataRedactor {

    /** The replacement string for redacted values. */
    public static final String REDACTED = "[REDACTED]";

    private static final Set<String> SENSITIVE_KEYS = Set.of(
            "password", "token", "secret", "authorization", "apikey", "api_key", "credential"
    );

    private static final Pattern BEARER = Pattern.compile("(?i)bearer\\s+[A-Za-z0-9._~+/=-]+");

    private final Pattern assignmentPattern;

    public SensitiveDataRedactor() {
        String alternatives = String.join("|", SENSITIVE_KEYS.stream()
                .map(Pattern::quote)
                .toList());
        // key=value, key: value, "key":"value"
        this.assignmentPattern = Pattern.compile(
                "([\\w.\\-]*(?:" + alternatives + ")[\\w.\\-]*\"?\\s*[:=]\\s*\"?)([^\\s,;\"&]+)",
                Pattern.CASE_INSENSITIVE);
    }

    /**
     * Masks {@code key=value} style secrets and bearer credentials inside free text such as a
     * downstream error message. Text without sensitive fragments is returned unchanged.
     *
     * @param message the message to scrub (may be null)
     * @return the scrubbed message, or null when the input was null
     */
    public String redactMessage(String message) {
        if (message == null || message.isEmpty()) {
            return message;
        }
        String scrubbed = BEARER.matcher(message).replaceAll("Bearer " + Matcher.quoteReplacement(REDACTED));
        Matcher matcher = assignmentPattern.matcher(scrubbed);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String value = matcher.group(2);
            String replacement = value.equals(REDACTED) || value.equalsIgnoreCase("bearer")
                    ? matcher.group(0)
                    : matcher.group(1) + REDACTED;
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
