package com.lumen.gateway.capability.email;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * @param smtpPassword null keeps the stored password
 */
public record EmailSettingInput(
        @NotBlank String smtpUsername,
        String smtpPassword,
        @NotBlank String smtpServer,
        @Min(1) @Max(65535) int smtpPort,
        @NotBlank @Email String fromAddress,
        @NotNull EmailSetting.Encryption encryption,
        @NotNull EmailSetting.AuthMethod authMethod) {

    @Override
    public String toString() {
        return "EmailSettingInput[smtpUsername=" + smtpUsername + ", smtpServer=" + smtpServer + "]";
    }
}
