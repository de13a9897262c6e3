package com.lumen.gateway.config;

import com.lumen.gateway.infrastructure.web.RequestContextArgumentResolver;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.List;

/**
 * CORS for local frontends and {@link com.lumen.gateway.context.RequestContext} injection into
 * controller methods.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final RequestContextArgumentResolver requestContextArgumentResolver;

    public WebConfig(RequestContextArgumentResolver requestContextArgumentResolver) {
        this.requestContextArgumentResolver = requestContextArgumentResolver;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
                .allowedOrigins("http://localhost:3000", "http://localhost:5173")
                .allowedMethods("GET", "POST", "PUT", "DELETE", "PATCH", "OPTIONS")
                .allowedHeaders("*")
                .allowCredentials(true)
                .maxAge(3600);
    }

    @Override
    public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(requestContextArgumentResolver);
    }
}
