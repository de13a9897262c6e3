package com.lumen.gateway.operation;

import com.lumen.errors.CoreException;
import com.lumen.errors.ErrorKind;
import com.lumen.errors.InputValidator;
import com.lumen.gateway.capability.auth.EmailInput;
import com.lumen.gateway.capability.auth.PasswordChangeInput;
import com.lumen.gateway.capability.auth.RegisterInput;
import com.lumen.gateway.capability.auth.TokenPair;
import com.lumen.gateway.capability.auth.User;
import com.lumen.gateway.capability.email.EmailSetting;
import com.lumen.gateway.support.TestServices;
import com.lumen.security.Principal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("IdentityOperations")
class IdentityOperationsTest {

    private final TestServices services = new TestServices();
    private final IdentityOperations operations = new IdentityOperations(InputValidator.withDefaultProvider());

    private static ErrorKind kindOf(Throwable t) {
        return ((CoreException) t).kind();
    }

    @Test
    @DisplayName("me accepts auth-token callers")
    void meWithAuthToken() {
        User alice = services.user("alice", false);

        assertThat(operations.me(services.withAuthToken("alice"))).isEqualTo(alice);
    }

    @Test
    @DisplayName("register rejects mismatching passwords on password2")
    void registerPasswordMismatch() {
        var input = new RegisterInput("a@lumen.dev", "password1", "password2", null, "Alice");

        assertThatThrownBy(() -> operations.register(services.anonymous(), input))
                .satisfies(t -> {
                    assertThat(kindOf(t)).isEqualTo(ErrorKind.INVALID_INPUT);
                    assertThat(((CoreException) t).violations()).extracting("path").containsExactly("password2");
                });
        verify(services.auth, never()).register(any());
    }

    @Test
    @DisplayName("register reports every invalid field at once")
    void registerAllViolations() {
        var input = new RegisterInput("not-an-email", "short", "short", null, "");

        assertThatThrownBy(() -> operations.register(services.anonymous(), input))
                .satisfies(t -> assertThat(((CoreException) t).violations())
                        .extracting("path")
                        .contains("email", "password1", "name"));
    }

    @Test
    @DisplayName("register returns the issued tokens")
    void registerIssuesTokens() {
        var input = new RegisterInput("a@lumen.dev", "password1", "password1", "code", "Alice");
        when(services.auth.register(input)).thenReturn(new TokenPair("access", "refresh"));

        assertThat(operations.register(services.anonymous(), input).accessToken()).isEqualTo("access");
    }

    @Test
    @DisplayName("verifyToken is UNAUTHORIZED for a rejected token")
    void verifyRejectedToken() {
        when(services.auth.verifyAccessToken("bad")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> operations.verifyToken(services.anonymous(), "bad"))
                .satisfies(t -> assertThat(kindOf(t)).isEqualTo(ErrorKind.UNAUTHORIZED));
    }

    @Test
    @DisplayName("verifyToken is true for a valid token")
    void verifyValidToken() {
        when(services.auth.verifyAccessToken("good")).thenReturn(Optional.of(new Principal("alice", false, false)));

        assertThat(operations.verifyToken(services.anonymous(), "good")).isTrue();
    }

    @Test
    @DisplayName("passwordChange needs only valid claims")
    void passwordChangeWithClaimsOnly() {
        var input = new PasswordChangeInput("old-password", "new-password", "new-password");

        assertThat(operations.passwordChange(services.as("alice"), input)).isTrue();
        verify(services.auth).updateUserPassword("alice", "old-password", "new-password");
        verify(services.auth, never()).getUser(anyString());
    }

    @Test
    @DisplayName("password reset email is NOT_ENABLED without SMTP")
    void resetEmailWithoutSmtp() {
        assertThatThrownBy(() -> operations.requestPasswordResetEmail(services.anonymous(), new EmailInput("a@lumen.dev")))
                .hasMessage("SMTP is not configured")
                .satisfies(t -> assertThat(((CoreException) t).kind().code()).hasValueSatisfying(
                        code -> assertThat(code.name()).isEqualTo("NOT_ENABLED")));
        verify(services.auth, never()).requestPasswordResetEmail(anyString());
    }

    @Test
    @DisplayName("password reset email is sent when SMTP is configured")
    void resetEmailWithSmtp() {
        when(services.email.readSetting()).thenReturn(Optional.of(new EmailSetting("mailer", "smtp.lumen.dev", 587,
                "noreply@lumen.dev", EmailSetting.Encryption.STARTTLS, EmailSetting.AuthMethod.LOGIN)));

        assertThat(operations.requestPasswordResetEmail(services.anonymous(), new EmailInput("a@lumen.dev"))).isTrue();
        verify(services.auth).requestPasswordResetEmail("a@lumen.dev");
    }
}
