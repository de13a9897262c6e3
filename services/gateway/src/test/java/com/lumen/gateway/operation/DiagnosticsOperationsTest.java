package com.lumen.gateway.operation;

import com.lumen.errors.CoreException;
import com.lumen.errors.ErrorKind;
import com.lumen.gateway.capability.model.ModelKind;
import com.lumen.gateway.config.GatewayProperties;
import com.lumen.gateway.support.TestServices;
import com.lumen.observability.MetricFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("DiagnosticsOperations")
class DiagnosticsOperationsTest {

    private final TestServices services = new TestServices();
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final DiagnosticsOperations operations = new DiagnosticsOperations(
            new GatewayProperties("lumen-gateway", "test", new GatewayProperties.Features(true, true), null),
            new MetricFactory(registry, "lumen-gateway"));

    @BeforeEach
    void users() {
        services.user("root", true);
        services.user("bob", false);
    }

    private static ErrorKind kindOf(Throwable t) {
        return ((CoreException) t).kind();
    }

    @Test
    @DisplayName("testing an absent chat backend is NOT_ENABLED")
    void chatAbsent() {
        assertThatThrownBy(() -> operations.testModelConnection(services.asAdmin("root"), ModelKind.CHAT))
                .hasMessage("Chat model is not enabled")
                .satisfies(t -> assertThat(kindOf(t)).isEqualTo(ErrorKind.FEATURE_NOT_ENABLED));
    }

    @Test
    @DisplayName("a failing backend is a generic failure carrying its message")
    void embeddingFails() {
        when(services.embedding.embed(DiagnosticsOperations.PROBE_PROMPT))
                .thenThrow(new IllegalStateException("connection refused"));

        assertThatThrownBy(() -> operations.testModelConnection(services.asAdmin("root"), ModelKind.EMBEDDING))
                .hasMessage("Failed to connect to the embedding model: connection refused")
                .satisfies(t -> {
                    assertThat(kindOf(t)).isEqualTo(ErrorKind.OTHER);
                    assertThat(((CoreException) t).kind().code()).isEmpty();
                });
    }

    @Test
    @DisplayName("a healthy backend reports its latency")
    void chatHealthy() {
        services.withChat(prompt -> Flux.just("Hi", "!"));

        ModelHealth health = operations.testModelConnection(services.asAdmin("root"), ModelKind.CHAT);

        assertThat(health.kind()).isEqualTo(ModelKind.CHAT);
        assertThat(health.latencyMs()).isNotNegative();
        assertThat(registry.find("lumen.model.connection").tag("backend", "chat").timer().count()).isEqualTo(1);
    }

    @Test
    @DisplayName("model checks are admin-only")
    void adminOnly() {
        assertThatThrownBy(() -> operations.testModelConnection(services.as("bob"), ModelKind.EMBEDDING))
                .satisfies(t -> assertThat(kindOf(t)).isEqualTo(ErrorKind.FORBIDDEN));
    }

    @Test
    @DisplayName("serverInfo is answered for anonymous callers")
    void serverInfo() {
        when(services.auth.isAdminInitialized()).thenReturn(true);

        ServerInfo info = operations.serverInfo(services.anonymous());

        assertThat(info).isEqualTo(new ServerInfo(true, false, true, true, false));
    }

    @Test
    @DisplayName("uploadLicense trims the key and rejects blanks")
    void uploadLicense() {
        assertThatThrownBy(() -> operations.uploadLicense(services.asAdmin("root"), "  "))
                .satisfies(t -> assertThat(kindOf(t)).isEqualTo(ErrorKind.INVALID_INPUT));

        operations.uploadLicense(services.asAdmin("root"), " key \n");

        verify(services.license).update("key");
    }
}
