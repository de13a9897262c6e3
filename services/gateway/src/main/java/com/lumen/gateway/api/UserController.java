package com.lumen.gateway.api;

import com.lumen.gateway.capability.auth.User;
import com.lumen.gateway.capability.auth.UserNameInput;
import com.lumen.gateway.context.RequestContext;
import com.lumen.gateway.operation.PageArguments;
import com.lumen.gateway.operation.UserAdminOperations;
import com.lumen.pagination.Connection;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/users")
public class UserController {

    private final UserAdminOperations operations;

    public UserController(UserAdminOperations operations) {
        this.operations = operations;
    }

    @GetMapping
    public Connection<User> users(
            RequestContext ctx, @RequestParam(required = false) List<String> ids, PageArguments page) {
        return operations.users(ctx, ids, page);
    }

    @PutMapping("/{id}/active")
    public boolean updateUserActive(RequestContext ctx, @PathVariable String id, @RequestBody ActiveRequest request) {
        return operations.updateUserActive(ctx, id, request.active());
    }

    @PutMapping("/{id}/role")
    public boolean updateUserRole(RequestContext ctx, @PathVariable String id, @RequestBody RoleRequest request) {
        return operations.updateUserRole(ctx, id, request.admin());
    }

    @PutMapping("/{id}/avatar")
    public boolean uploadUserAvatarBase64(
            RequestContext ctx, @PathVariable String id, @RequestBody AvatarRequest request) {
        return operations.uploadUserAvatarBase64(ctx, id, request.avatarBase64());
    }

    @PutMapping("/{id}/name")
    public boolean updateUserName(RequestContext ctx, @PathVariable String id, @RequestBody UserNameInput input) {
        return operations.updateUserName(ctx, id, input);
    }

    @PostMapping("/{id}/reset-password-url")
    public String generateResetPasswordUrl(RequestContext ctx, @PathVariable String id) {
        return operations.generateResetPasswordUrl(ctx, id);
    }

    public record ActiveRequest(boolean active) {
    }

    public record RoleRequest(boolean admin) {
    }

    public record AvatarRequest(String avatarBase64) {
    }
}
