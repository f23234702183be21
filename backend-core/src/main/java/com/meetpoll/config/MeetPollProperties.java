package com.meetpoll.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.ZoneId;

@Validated
@ConfigurationProperties(prefix = "meetpoll")
public record MeetPollProperties(
        String publicBaseUrl,
        String timeZone,
        @Valid Scoring scoring,
        @Valid Storage storage,
        Tokens tokens,
        Mail mail
) {

    /** Largest byte count whose unpadded Base64 form fits the 64 character token column. */
    public static final int MAX_TOKEN_BYTES = 48;

    public String safePublicBaseUrl() {
        return notBlank(publicBaseUrl) ? stripTrailingSlash(publicBaseUrl.trim()) : "http://localhost:8080";
    }

    public ZoneId safeZone() {
        if (!notBlank(timeZone)) {
            return ZoneId.of("UTC");
        }
        return ZoneId.of(timeZone.trim());
    }

    public double safeMaybeWeight() {
        return scoring == null || scoring.maybeWeight() == null ? 0.5 : scoring.maybeWeight();
    }

    public Duration safeStorageTimeout() {
        return storage == null || storage.timeout() == null ? Duration.ofSeconds(5) : storage.timeout();
    }

    public int safeMaxAttempts() {
        return storage == null || storage.maxAttempts() == null || storage.maxAttempts() < 1 ? 3 : storage.maxAttempts();
    }

    public int safeTokenBytes() {
        if (tokens == null || tokens.bytes() == null || tokens.bytes() < 16) {
            return 32;
        }
        return Math.min(tokens.bytes(), MAX_TOKEN_BYTES);
    }

    public String safeFromName() {
        return mail != null && notBlank(mail.fromName()) ? mail.fromName() : "Meeting Scheduler";
    }

    public String fromAddress() {
        return mail == null ? null : mail.fromAddress();
    }

    private static String stripTrailingSlash(String value) {
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }

    public record Scoring(
            @DecimalMin("0.0") @DecimalMax("1.0") Double maybeWeight
    ) {
    }

    public record Storage(
            Duration timeout,
            Integer maxAttempts
    ) {
    }

    public record Tokens(Integer bytes) {
    }

    public record Mail(String fromAddress, String fromName) {
    }
}
