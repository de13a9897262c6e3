package com.lumen.gateway.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Gateway configuration bound from {@code lumen.gateway.*}:
 *
 * <pre>
 * lumen:
 *   gateway:
 *     name: lumen-gateway
 *     environment: production
 *     features:
 *       pages-enabled: true
 *       demo-mode: false
 *     streaming:
 *       buffer-size: 32
 * </pre>
 *
 * @param name        service name used in logs and as the {@code service} metric tag. Required.
 * @param environment deployment environment, defaults to {@code development}
 * @param features    optional capabilities switched on for this deployment
 * @param streaming   subscription tuning
 */
@ConfigurationProperties(prefix = "lumen.gateway")
@Validated
public record GatewayProperties(
        @NotBlank String name, String environment, @Valid Features features, @Valid Streaming streaming) {

    /** Defaults are applied before Bean Validation runs. */
    public GatewayProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (features == null) {
            features = new Features(false, false);
        }
        if (streaming == null) {
            streaming = new Streaming(0);
        }
    }

    /**
     * @param pagesEnabled wires the page service when a {@code PageService} bean exists
     * @param demoMode     reported by {@code serverInfo}
     */
    public record Features(boolean pagesEnabled, boolean demoMode) {
    }

    /**
     * @param bufferSize events buffered between a run's producer and its subscriber, defaults to 32
     */
    public record Streaming(@Min(1) @Max(4096) int bufferSize) {

        public Streaming {
            if (bufferSize <= 0) {
                bufferSize = 32;
            }
        }
    }
}
