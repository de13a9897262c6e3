package com.lumen.gateway.capability.license;

import com.lumen.security.License;

public interface LicenseService {

    License read();

    /**
     * Installs a signed license key.
     *
     * @throws com.lumen.errors.CoreException INVALID_LICENSE when the key does not verify
     */
    void update(String licenseKey);

    /** Falls back to the community tier. */
    void reset();
}
