package com.lumen.gateway.context;

import com.lumen.gateway.support.TestServices;
import com.lumen.security.Principal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("PrincipalResolver")
class PrincipalResolverTest {

    private final TestServices services = new TestServices();
    private final PrincipalResolver resolver = new PrincipalResolver(services.locator());

    @Test
    @DisplayName("a missing header yields an anonymous context")
    void missingHeader() {
        RequestContext ctx = resolver.resolve(null);

        assertThat(ctx.principal()).isEmpty();
        assertThat(ctx.services()).isSameAs(services.locator());
        verify(services.auth, never()).verifyAccessToken(anyString());
    }

    @Test
    @DisplayName("a header without the bearer scheme yields an anonymous context")
    void nonBearerHeader() {
        assertThat(resolver.resolve("Basic dXNlcjpwYXNz").principal()).isEmpty();
    }

    @Test
    @DisplayName("a rejected token yields an anonymous context")
    void rejectedToken() {
        when(services.auth.verifyAccessToken("expired")).thenReturn(Optional.empty());

        assertThat(resolver.resolve("Bearer expired").principal()).isEmpty();
    }

    @Test
    @DisplayName("a verified token yields its claims")
    void verifiedToken() {
        var claims = new Principal("alice", false, true);
        when(services.auth.verifyAccessToken("auth_abc")).thenReturn(Optional.of(claims));

        assertThat(resolver.resolve("bearer auth_abc").principal()).contains(claims);
    }
}
