package com.meetpoll.scheduler;

import com.meetpoll.config.MeetPollProperties;
import com.meetpoll.config.SessionProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@SpringBootApplication(scanBasePackages = "com.meetpoll")
@EntityScan("com.meetpoll.domain")
@EnableJpaRepositories("com.meetpoll.repository")
@EnableConfigurationProperties({MeetPollProperties.class, SessionProperties.class})
public class SchedulerApplication {

    public static void main(String[] args) {
        SpringApplication.run(SchedulerApplication.class, args);
    }
}
