package com.meetpoll.config;

import com.meetpoll.storage.StorageInitializer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class StorageBootstrap implements ApplicationRunner {

    private final StorageInitializer storageInitializer;
    private final MeetPollProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        log.info("Scheduler config: publicBaseUrl={}, timeZone={}, maybeWeight={}, mailConfigured={}",
                properties.safePublicBaseUrl(),
                properties.safeZone(),
                properties.safeMaybeWeight(),
                properties.fromAddress() != null && !properties.fromAddress().isBlank());
        storageInitializer.initializeStorage();
    }
}
