package com.meetpoll.config;

import com.meetpoll.scoring.SlotScoringPolicy;
import com.meetpoll.scoring.WeightedMaybePolicy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.crypto.password.Pbkdf2PasswordEncoder;

@Configuration
public class SchedulingConfig {

    private static final int PBKDF2_ITERATIONS = 100_000;
    private static final int PBKDF2_SALT_LENGTH = 16;

    @Bean
    public SlotScoringPolicy slotScoringPolicy(MeetPollProperties properties) {
        return new WeightedMaybePolicy(properties.safeMaybeWeight());
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new Pbkdf2PasswordEncoder("", PBKDF2_SALT_LENGTH, PBKDF2_ITERATIONS,
                Pbkdf2PasswordEncoder.SecretKeyFactoryAlgorithm.PBKDF2WithHmacSHA256);
    }
}
