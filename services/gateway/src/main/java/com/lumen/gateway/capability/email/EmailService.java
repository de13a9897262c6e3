package com.lumen.gateway.capability.email;

import java.util.Optional;

public interface EmailService {

    /** Stored SMTP settings, empty when email is not configured. */
    Optional<EmailSetting> readSetting();

    void updateSetting(EmailSettingInput input);

    void deleteSetting();

    void sendTest(String to);
}
