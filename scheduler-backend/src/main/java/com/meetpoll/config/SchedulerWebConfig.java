package com.meetpoll.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.net.URI;

/**
 * Lets the response and dashboard pages served from {@code meetpoll.public-base-url} call the API.
 */
@Configuration
@RequiredArgsConstructor
public class SchedulerWebConfig implements WebMvcConfigurer {

    private final MeetPollProperties properties;

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        String origin = resolveOrigin(properties.safePublicBaseUrl());
        if (origin == null) {
            return;
        }
        registry.addMapping("/api/**")
                .allowedMethods("GET", "POST", "PUT", "DELETE", "OPTIONS")
                .allowedOrigins(origin)
                .allowedHeaders("*")
                .allowCredentials(false);
    }

    static String resolveOrigin(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            URI uri = URI.create(url.trim());
            String scheme = uri.getScheme();
            String host = uri.getHost();
            int port = uri.getPort();
            if (scheme == null || host == null) {
                return null;
            }
            StringBuilder origin = new StringBuilder(scheme).append("://").append(host);
            if (port > 0) {
                origin.append(":").append(port);
            }
            return origin.toString();
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
