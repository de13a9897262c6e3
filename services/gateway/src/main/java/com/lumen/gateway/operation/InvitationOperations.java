package com.lumen.gateway.operation;

import com.lumen.errors.CoreException;
import com.lumen.errors.InputValidator;
import com.lumen.gateway.capability.auth.EmailInput;
import com.lumen.gateway.capability.auth.Invitation;
import com.lumen.gateway.context.RequestContext;
import com.lumen.gateway.guard.Guards;
import com.lumen.pagination.Connection;
import com.lumen.pagination.ConnectionBuilder;
import org.springframework.stereotype.Service;

@Service
public class InvitationOperations {

    private final InputValidator validator;

    public InvitationOperations(InputValidator validator) {
        this.validator = validator;
    }

    public Connection<Invitation> invitations(RequestContext ctx, PageArguments page) {
        Guards.admin(ctx);
        return ConnectionBuilder.query(page.window(), window -> ctx.services().auth().listInvitations(window));
    }

    /** @return id of the new invitation */
    public String createInvitation(RequestContext ctx, EmailInput input) {
        Guards.admin(ctx);
        validator.validate(input);
        return ctx.services().auth().createInvitation(input.email());
    }

    public String deleteInvitation(RequestContext ctx, String id) {
        Guards.admin(ctx);
        return ctx.services().auth().deleteInvitation(id);
    }

    /**
     * @throws CoreException NOT_ENABLED when SMTP is not configured
     */
    public boolean sendTestEmail(RequestContext ctx, EmailInput to) {
        Guards.admin(ctx);
        validator.validate(to);
        if (ctx.services().email().readSetting().isEmpty()) {
            throw CoreException.emailNotConfigured();
        }
        ctx.services().email().sendTest(to.email());
        return true;
    }
}
