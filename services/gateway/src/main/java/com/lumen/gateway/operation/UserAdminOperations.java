package com.lumen.gateway.operation;

import com.lumen.errors.CoreException;
import com.lumen.errors.InputValidator;
import com.lumen.gateway.capability.auth.User;
import com.lumen.gateway.capability.auth.UserNameInput;
import com.lumen.gateway.context.RequestContext;
import com.lumen.gateway.guard.Guards;
import com.lumen.pagination.Connection;
import com.lumen.pagination.ConnectionBuilder;
import com.lumen.security.AuthorizationGuard;
import org.springframework.stereotype.Service;

import java.util.Base64;
import java.util.List;

@Service
public class UserAdminOperations {

    private final InputValidator validator;

    public UserAdminOperations(InputValidator validator) {
        this.validator = validator;
    }

    public Connection<User> users(RequestContext ctx, List<String> ids, PageArguments page) {
        Guards.user(ctx);
        return ConnectionBuilder.query(page.window(), window -> ctx.services().auth().listUsers(ids, window));
    }

    public boolean updateUserActive(RequestContext ctx, String id, boolean active) {
        Guards.admin(ctx);
        AuthorizationGuard.requireNotSelf(ctx.principal(), id, "You cannot change your own active status");
        ctx.services().auth().updateUserActive(id, active);
        return true;
    }

    public boolean updateUserRole(RequestContext ctx, String id, boolean admin) {
        Guards.admin(ctx);
        AuthorizationGuard.requireNotSelf(ctx.principal(), id, "You cannot update your own role");
        ctx.services().auth().updateUserRole(id, admin);
        return true;
    }

    /**
     * Replaces the caller's avatar; a null payload removes it.
     *
     * @throws CoreException UNAUTHORIZED for another user's avatar, INVALID_INPUT for bad base64
     */
    public boolean uploadUserAvatarBase64(RequestContext ctx, String id, String avatarBase64) {
        AuthorizationGuard.requireSelf(ctx.principal(), id, "You cannot change another user's avatar");
        byte[] avatar = null;
        if (avatarBase64 != null) {
            try {
                avatar = Base64.getDecoder().decode(avatarBase64);
            } catch (IllegalArgumentException e) {
                throw CoreException.invalidInput("avatarBase64", "must be valid base64");
            }
        }
        ctx.services().auth().updateUserAvatar(id, avatar);
        return true;
    }

    public boolean updateUserName(RequestContext ctx, String id, UserNameInput input) {
        AuthorizationGuard.requireSelf(ctx.principal(), id, "You cannot change another user's name");
        validator.validate(input);
        ctx.services().auth().updateUserName(id, input.name());
        return true;
    }

    public String generateResetPasswordUrl(RequestContext ctx, String userId) {
        Guards.admin(ctx);
        return ctx.services().auth().generateResetPasswordUrl(userId);
    }
}
