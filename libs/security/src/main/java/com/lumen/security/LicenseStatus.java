package com.lumen.security;

public enum LicenseStatus {
    OK,
    EXPIRED,
    SEATS_EXCEEDED
}
