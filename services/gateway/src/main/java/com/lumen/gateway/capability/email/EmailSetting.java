package com.lumen.gateway.capability.email;

public record EmailSetting(
        String smtpUsername,
        String smtpServer,
        int smtpPort,
        String fromAddress,
        Encryption encryption,
        AuthMethod authMethod) {

    public enum Encryption {
        NONE,
        SSL_TLS,
        STARTTLS
    }

    public enum AuthMethod {
        NONE,
        PLAIN,
        LOGIN
    }
}
