package com.lumen.gateway;

import com.lumen.gateway.config.GatewayProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Lumen gateway: authorization-aware API in front of the knowledge and assistant services.
 * <p>
 * Domain services are contributed as beans implementing the interfaces in
 * {@code com.lumen.gateway.capability}; startup fails when a required one is missing.
 */
@SpringBootApplication
@EnableConfigurationProperties(GatewayProperties.class)
public class GatewayApplication {

    private static final Logger log = LoggerFactory.getLogger(GatewayApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(GatewayApplication.class, args);
        log.info("Lumen gateway started successfully");
    }
}
