package com.lumen.gateway.operation;

import com.lumen.errors.CoreException;
import com.lumen.errors.InputValidator;
import com.lumen.gateway.capability.auth.EmailInput;
import com.lumen.gateway.capability.auth.PasswordChangeInput;
import com.lumen.gateway.capability.auth.PasswordResetInput;
import com.lumen.gateway.capability.auth.RegisterInput;
import com.lumen.gateway.capability.auth.TokenAuthInput;
import com.lumen.gateway.capability.auth.TokenPair;
import com.lumen.gateway.capability.auth.User;
import com.lumen.gateway.context.RequestContext;
import com.lumen.gateway.guard.Guards;
import com.lumen.security.AuthorizedUser;
import com.lumen.security.Principal;
import org.springframework.stereotype.Service;

/**
 * Sign-up, sign-in and session management.
 */
@Service
public class IdentityOperations {

    private final InputValidator validator;

    public IdentityOperations(InputValidator validator) {
        this.validator = validator;
    }

    /** The calling user. Auth-token callers are accepted. */
    public User me(RequestContext ctx) {
        AuthorizedUser user = Guards.userAllowingAuthToken(ctx);
        return ctx.services().auth().getUser(user.id())
                .orElseThrow(() -> CoreException.unauthorized("User not found or no longer active"));
    }

    public TokenPair register(RequestContext ctx, RegisterInput input) {
        validator.validate(input);
        requireMatchingPasswords("password2", input.password1(), input.password2());
        return ctx.services().auth().register(input);
    }

    public TokenPair tokenAuth(RequestContext ctx, TokenAuthInput input) {
        validator.validate(input);
        return ctx.services().auth().tokenAuth(input.email(), input.password());
    }

    public TokenPair refreshToken(RequestContext ctx, String refreshToken) {
        if (refreshToken == null || refreshToken.isBlank()) {
            throw CoreException.invalidInput("refreshToken", "must not be blank");
        }
        return ctx.services().auth().refreshToken(refreshToken);
    }

    public boolean verifyToken(RequestContext ctx, String token) {
        if (token == null || token.isBlank()) {
            throw CoreException.invalidInput("token", "must not be blank");
        }
        ctx.services().auth().verifyAccessToken(token)
                .orElseThrow(() -> CoreException.unauthorized("Invalid access token"));
        return true;
    }

    /** Only valid claims are needed, so a password can be changed right after sign-in. */
    public boolean passwordChange(RequestContext ctx, PasswordChangeInput input) {
        Principal claims = Guards.claims(ctx);
        validator.validate(input);
        requireMatchingPasswords("newPassword2", input.newPassword1(), input.newPassword2());
        ctx.services().auth().updateUserPassword(claims.subject(), input.oldPassword(), input.newPassword1());
        return true;
    }

    public boolean resetUserAuthToken(RequestContext ctx) {
        AuthorizedUser user = Guards.user(ctx);
        ctx.services().auth().resetUserAuthToken(user.id());
        return true;
    }

    public boolean logoutAllSessions(RequestContext ctx) {
        Principal claims = Guards.claims(ctx);
        ctx.services().auth().logoutAllSessions(claims.subject());
        return true;
    }

    /**
     * @throws CoreException NOT_ENABLED when SMTP is not configured
     */
    public boolean requestPasswordResetEmail(RequestContext ctx, EmailInput input) {
        validator.validate(input);
        if (ctx.services().email().readSetting().isEmpty()) {
            throw CoreException.emailNotConfigured();
        }
        ctx.services().auth().requestPasswordResetEmail(input.email());
        return true;
    }

    public boolean passwordReset(RequestContext ctx, PasswordResetInput input) {
        validator.validate(input);
        requireMatchingPasswords("password2", input.password1(), input.password2());
        ctx.services().auth().passwordReset(input.code(), input.password1());
        return true;
    }

    private static void requireMatchingPasswords(String path, String password, String confirmation) {
        if (!password.equals(confirmation)) {
            throw CoreException.invalidInput(path, "Passwords do not match");
        }
    }
}
