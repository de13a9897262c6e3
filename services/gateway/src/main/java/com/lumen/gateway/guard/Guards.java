package com.lumen.gateway.guard;

import com.lumen.errors.CoreException;
import com.lumen.gateway.capability.ServiceLocator;
import com.lumen.gateway.capability.page.PageService;
import com.lumen.gateway.context.RequestContext;
import com.lumen.security.AccessPolicy;
import com.lumen.security.AuthorizationGuard;
import com.lumen.security.AuthorizedUser;
import com.lumen.security.LicenseTier;
import com.lumen.security.Principal;
import com.lumen.security.UserResolver;

import java.util.EnumSet;
import java.util.Set;

/**
 * Binds {@link AuthorizationGuard} to a {@link RequestContext}. Every operation calls exactly one
 * of these before touching a capability.
 */
public final class Guards {

    public static final Set<LicenseTier> ENTERPRISE = EnumSet.of(LicenseTier.ENTERPRISE);
    public static final Set<LicenseTier> TEAM_OR_ENTERPRISE = EnumSet.of(LicenseTier.TEAM, LicenseTier.ENTERPRISE);

    private Guards() {
        // utility class
    }

    /** Valid claims only; the user record is not looked up. */
    public static Principal claims(RequestContext ctx) {
        return AuthorizationGuard.requirePrincipal(ctx.principal());
    }

    public static AuthorizedUser user(RequestContext ctx) {
        return AuthorizationGuard.requireAuthenticated(ctx.principal(), false, users(ctx.services()));
    }

    /** Like {@link #user} but also accepts principals derived from a user auth token. */
    public static AuthorizedUser userAllowingAuthToken(RequestContext ctx) {
        return AuthorizationGuard.requireAuthenticated(ctx.principal(), true, users(ctx.services()));
    }

    public static AuthorizedUser admin(RequestContext ctx) {
        return AuthorizationGuard.requireAdmin(ctx.principal(), users(ctx.services()));
    }

    public static void license(RequestContext ctx, Set<LicenseTier> allowedTiers) {
        AuthorizationGuard.requireLicense(ctx.services().license().read(), allowedTiers);
    }

    /**
     * @throws CoreException FORBIDDEN when the page feature is disabled on this deployment
     */
    public static PageService pageService(RequestContext ctx) {
        return ctx.services().page()
                .orElseThrow(() -> CoreException.forbidden("Page service is not enabled"));
    }

    static UserResolver users(ServiceLocator services) {
        ServicePolicyLookup lookup = new ServicePolicyLookup(services.userGroup(), services.accessPolicy());
        return principal -> services.auth().getUser(principal.subject())
                .filter(user -> user.active())
                .map(user -> new AuthorizedUser(user.id(), user.admin(), new AccessPolicy(user.id(), user.admin(), lookup)));
    }
}
