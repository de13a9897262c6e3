package com.lumen.gateway.capability.auth;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * @param bindPassword null keeps the stored password
 */
public record LdapCredentialInput(
        @NotBlank String host,
        @Min(1) @Max(65535) int port,
        @NotBlank String bindDn,
        String bindPassword,
        @NotBlank String baseDn,
        @NotBlank String userFilter,
        @NotBlank String emailAttribute,
        String nameAttribute) {

    @Override
    public String toString() {
        return "LdapCredentialInput[host=" + host + ", port=" + port + ", bindDn=" + bindDn + "]";
    }
}
