package com.meetpoll.notification;

import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.JavaMailSenderImpl;
import org.springframework.stereotype.Component;

import java.util.Properties;

/**
 * Builds a sender for an organizer's own SMTP account. The application-wide sender stays with
 * Spring Boot's mail auto-configuration.
 */
@Component
public class MailSenderFactory {

    static final String TIMEOUT_MILLIS = "10000";

    public JavaMailSender create(SmtpSettings settings) {
        JavaMailSenderImpl sender = new JavaMailSenderImpl();
        sender.setHost(settings.host());
        sender.setPort(settings.port());
        sender.setDefaultEncoding("UTF-8");
        if (settings.hasCredentials()) {
            sender.setUsername(settings.username());
            sender.setPassword(settings.password());
        }

        Properties props = sender.getJavaMailProperties();
        props.put("mail.smtp.auth", String.valueOf(settings.hasCredentials()));
        props.put("mail.smtp.starttls.enable", String.valueOf(settings.startTls()));
        props.put("mail.smtp.connectiontimeout", TIMEOUT_MILLIS);
        props.put("mail.smtp.timeout", TIMEOUT_MILLIS);
        props.put("mail.smtp.writetimeout", TIMEOUT_MILLIS);
        return sender;
    }
}
