package com.lumen.gateway.operation;

import com.lumen.errors.CoreException;
import com.lumen.gateway.capability.ServiceLocator;
import com.lumen.gateway.capability.model.ChatModel;
import com.lumen.gateway.capability.model.CompletionModel;
import com.lumen.gateway.capability.model.ModelKind;
import com.lumen.gateway.config.GatewayProperties;
import com.lumen.gateway.context.RequestContext;
import com.lumen.gateway.guard.Guards;
import com.lumen.observability.MetricFactory;
import com.lumen.security.License;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Model connectivity checks, license management and public server info.
 */
@Service
public class DiagnosticsOperations {

    private static final Logger log = LoggerFactory.getLogger(DiagnosticsOperations.class);

    static final String PROBE_PROMPT = "Hello";

    private final GatewayProperties properties;
    private final MetricFactory metrics;

    public DiagnosticsOperations(GatewayProperties properties, MetricFactory metrics) {
        this.properties = properties;
        this.metrics = metrics;
    }

    /**
     * Sends a trivial request to the model backend and reports the round trip.
     *
     * @throws CoreException NOT_ENABLED when the backend is not configured, OTHER when the call fails
     */
    public ModelHealth testModelConnection(RequestContext ctx, ModelKind kind) {
        Guards.admin(ctx);
        if (kind == null) {
            throw CoreException.invalidInput("backend", "must not be null");
        }
        ServiceLocator services = ctx.services();
        Runnable probe = switch (kind) {
            case CHAT -> {
                ChatModel chat = services.chat()
                        .orElseThrow(() -> CoreException.notEnabled("Chat model is not enabled"));
                yield () -> chat.chat(PROBE_PROMPT).blockLast();
            }
            case COMPLETION -> {
                CompletionModel completion = services.completion()
                        .orElseThrow(() -> CoreException.notEnabled("Completion model is not enabled"));
                yield () -> completion.complete(PROBE_PROMPT, 1);
            }
            case EMBEDDING -> () -> services.embedding().embed(PROBE_PROMPT);
        };

        Timer timer = metrics.timer("lumen.model.connection", "Model connection test round trip",
                "backend", kind.name().toLowerCase());
        long started = System.nanoTime();
        try {
            probe.run();
        } catch (CoreException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Connection test to {} model failed: {}", kind, e.getMessage());
            throw CoreException.other("Failed to connect to the " + kind.name().toLowerCase() + " model: "
                    + e.getMessage(), e);
        }
        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
        timer.record(elapsed);
        return new ModelHealth(kind, elapsed.toMillis());
    }

    public License license(RequestContext ctx) {
        Guards.user(ctx);
        return ctx.services().license().read();
    }

    public boolean uploadLicense(RequestContext ctx, String licenseKey) {
        Guards.admin(ctx);
        if (licenseKey == null || licenseKey.isBlank()) {
            throw CoreException.invalidInput("license", "must not be blank");
        }
        ctx.services().license().update(licenseKey.strip());
        return true;
    }

    public boolean resetLicense(RequestContext ctx) {
        Guards.admin(ctx);
        ctx.services().license().reset();
        return true;
    }

    /** Anonymous. */
    public ServerInfo serverInfo(RequestContext ctx) {
        ServiceLocator services = ctx.services();
        return new ServerInfo(
                services.auth().isAdminInitialized(),
                services.chat().isPresent(),
                services.page().isPresent(),
                properties.features().demoMode(),
                services.email().readSetting().isPresent());
    }
}
