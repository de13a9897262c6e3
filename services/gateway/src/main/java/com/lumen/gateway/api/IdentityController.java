package com.lumen.gateway.api;

import com.lumen.gateway.capability.auth.EmailInput;
import com.lumen.gateway.capability.auth.PasswordChangeInput;
import com.lumen.gateway.capability.auth.PasswordResetInput;
import com.lumen.gateway.capability.auth.RegisterInput;
import com.lumen.gateway.capability.auth.TokenAuthInput;
import com.lumen.gateway.capability.auth.TokenPair;
import com.lumen.gateway.capability.auth.User;
import com.lumen.gateway.context.RequestContext;
import com.lumen.gateway.operation.IdentityOperations;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/auth")
public class IdentityController {

    private final IdentityOperations operations;

    public IdentityController(IdentityOperations operations) {
        this.operations = operations;
    }

    @GetMapping("/me")
    public User me(RequestContext ctx) {
        return operations.me(ctx);
    }

    @PostMapping("/register")
    public TokenPair register(RequestContext ctx, @RequestBody RegisterInput input) {
        return operations.register(ctx, input);
    }

    @PostMapping("/token")
    public TokenPair tokenAuth(RequestContext ctx, @RequestBody TokenAuthInput input) {
        return operations.tokenAuth(ctx, input);
    }

    @PostMapping("/token/refresh")
    public TokenPair refreshToken(RequestContext ctx, @RequestBody TokenRequest request) {
        return operations.refreshToken(ctx, request.token());
    }

    @PostMapping("/token/verify")
    public boolean verifyToken(RequestContext ctx, @RequestBody TokenRequest request) {
        return operations.verifyToken(ctx, request.token());
    }

    @PostMapping("/password/change")
    public boolean passwordChange(RequestContext ctx, @RequestBody PasswordChangeInput input) {
        return operations.passwordChange(ctx, input);
    }

    @PostMapping("/password/reset-email")
    public boolean requestPasswordResetEmail(RequestContext ctx, @RequestBody EmailInput input) {
        return operations.requestPasswordResetEmail(ctx, input);
    }

    @PostMapping("/password/reset")
    public boolean passwordReset(RequestContext ctx, @RequestBody PasswordResetInput input) {
        return operations.passwordReset(ctx, input);
    }

    @PostMapping("/auth-token/reset")
    public boolean resetUserAuthToken(RequestContext ctx) {
        return operations.resetUserAuthToken(ctx);
    }

    @PostMapping("/sessions/logout-all")
    public boolean logoutAllSessions(RequestContext ctx) {
        return operations.logoutAllSessions(ctx);
    }

    public record TokenRequest(String token) {

        @Override
        public String toString() {
            return "TokenRequest[token=***]";
        }
    }
}
