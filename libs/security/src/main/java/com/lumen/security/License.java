package com.lumen.security;

import com.lumen.errors.CoreException;

import java.time.Instant;

/**
 * Current license of the instance as read from the license service.
 *
 * @param tier      subscription tier
 * @param status    validity as computed by the license service
 * @param seats     seats included in the subscription
 * @param seatsUsed active users
 * @param issuedAt  issue time, null for the community tier
 * @param expiresAt expiry time, null for the community tier
 */
public record License(
        LicenseTier tier,
        LicenseStatus status,
        int seats,
        int seatsUsed,
        Instant issuedAt,
        Instant expiresAt) {

    public static License community(int seatsUsed) {
        return new License(LicenseTier.COMMUNITY, LicenseStatus.OK, 5, seatsUsed, null, null);
    }

    /**
     * @throws CoreException INVALID_LICENSE when the license is expired or over its seat count
     */
    public void ensureValid() {
        switch (status) {
            case OK -> {
            }
            case EXPIRED -> throw CoreException.invalidLicense("Your enterprise license is expired");
            case SEATS_EXCEEDED -> throw CoreException.invalidLicense(
                    "You have more active users than seats included in your subscription");
        }
    }
}
