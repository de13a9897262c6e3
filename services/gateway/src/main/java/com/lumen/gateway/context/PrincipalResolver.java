package com.lumen.gateway.context;

import com.lumen.gateway.capability.ServiceLocator;
import com.lumen.security.BearerTokenExtractor;
import com.lumen.security.Principal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Turns the {@code Authorization} header into a {@link RequestContext}.
 * <p>
 * A missing, malformed or rejected credential yields an anonymous context; operations that need
 * a user fail later in the guard with UNAUTHORIZED.
 */
public class PrincipalResolver {

    private static final Logger log = LoggerFactory.getLogger(PrincipalResolver.class);

    private final ServiceLocator services;

    public PrincipalResolver(ServiceLocator services) {
        this.services = services;
    }

    public RequestContext resolve(String authorizationHeader) {
        Optional<Principal> principal = BearerTokenExtractor.extract(authorizationHeader)
                .flatMap(this::verify);
        return new RequestContext(principal, services);
    }

    private Optional<Principal> verify(String token) {
        Optional<Principal> principal = services.auth().verifyAccessToken(token);
        if (principal.isEmpty()) {
            log.debug("Rejected bearer credential, continuing as anonymous");
        }
        return principal;
    }
}
