package com.lumen.security;

/**
 * Subscription tiers. Some settings are only available on higher tiers.
 */
public enum LicenseTier {

    COMMUNITY("community"),
    TEAM("team"),
    ENTERPRISE("enterprise");

    private final String value;

    LicenseTier(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
