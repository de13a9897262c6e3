package com.lumen.gateway.capability.auth;

/**
 * LDAP connection settings. The bind password is write-only and never returned.
 */
public record LdapCredential(
        String host,
        int port,
        String bindDn,
        String baseDn,
        String userFilter,
        String emailAttribute,
        String nameAttribute) {
}
