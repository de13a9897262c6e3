package com.lumen.gateway.api;

import com.lumen.gateway.capability.auth.EmailInput;
import com.lumen.gateway.capability.auth.Invitation;
import com.lumen.gateway.context.RequestContext;
import com.lumen.gateway.operation.InvitationOperations;
import com.lumen.gateway.operation.PageArguments;
import com.lumen.pagination.Connection;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1")
public class InvitationController {

    private final InvitationOperations operations;

    public InvitationController(InvitationOperations operations) {
        this.operations = operations;
    }

    @GetMapping("/invitations")
    public Connection<Invitation> invitations(RequestContext ctx, PageArguments page) {
        return operations.invitations(ctx, page);
    }

    @PostMapping("/invitations")
    public String createInvitation(RequestContext ctx, @RequestBody EmailInput input) {
        return operations.createInvitation(ctx, input);
    }

    @DeleteMapping("/invitations/{id}")
    public String deleteInvitation(RequestContext ctx, @PathVariable String id) {
        return operations.deleteInvitation(ctx, id);
    }

    @PostMapping("/email/test")
    public boolean sendTestEmail(RequestContext ctx, @RequestBody EmailInput to) {
        return operations.sendTestEmail(ctx, to);
    }
}
