package com.meetpoll.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "meetpoll.session")
public record SessionProperties(
        String secret,
        Duration ttl
) {
    public Duration safeTtl() {
        return ttl == null || ttl.isNegative() || ttl.isZero() ? Duration.ofHours(12) : ttl;
    }

    public boolean hasSecret() {
        return secret != null && !secret.isBlank();
    }
}
