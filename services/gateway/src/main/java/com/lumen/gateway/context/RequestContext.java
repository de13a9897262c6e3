package com.lumen.gateway.context;

import com.lumen.gateway.capability.ServiceLocator;
import com.lumen.security.Principal;

import java.util.Optional;

/**
 * Per-request input to every operation: the verified claims, if any, and the shared service
 * locator. Built by {@link PrincipalResolver} and discarded when the request ends.
 */
public record RequestContext(Optional<Principal> principal, ServiceLocator services) {

    public RequestContext {
        principal = principal == null ? Optional.empty() : principal;
    }

    public static RequestContext anonymous(ServiceLocator services) {
        return new RequestContext(Optional.empty(), services);
    }

    public static RequestContext of(Principal principal, ServiceLocator services) {
        return new RequestContext(Optional.of(principal), services);
    }
}
