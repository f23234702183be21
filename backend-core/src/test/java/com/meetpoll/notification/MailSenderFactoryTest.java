package com.meetpoll.notification;

import org.junit.jupiter.api.Test;
import org.springframework.mail.javamail.JavaMailSenderImpl;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;

class MailSenderFactoryTest {

    private final MailSenderFactory factory = new MailSenderFactory();

    @Test
    void create_shouldConfigureAuthenticatedStartTlsAccount() {
        JavaMailSenderImpl sender = assertInstanceOf(JavaMailSenderImpl.class, factory.create(
                new SmtpSettings("smtp.owner.test", 587, "owner", "app-password", "owner@example.com", null, true)));

        assertEquals("smtp.owner.test", sender.getHost());
        assertEquals(587, sender.getPort());
        assertEquals("owner", sender.getUsername());
        assertEquals("app-password", sender.getPassword());
        assertEquals("true", sender.getJavaMailProperties().getProperty("mail.smtp.auth"));
        assertEquals("true", sender.getJavaMailProperties().getProperty("mail.smtp.starttls.enable"));
        assertEquals(MailSenderFactory.TIMEOUT_MILLIS, sender.getJavaMailProperties().getProperty("mail.smtp.timeout"));
    }

    @Test
    void create_shouldSkipAuthenticationWithoutUsername() {
        JavaMailSenderImpl sender = assertInstanceOf(JavaMailSenderImpl.class, factory.create(
                new SmtpSettings("relay.internal", 25, null, null, "owner@example.com", null, false)));

        assertNull(sender.getUsername());
        assertEquals("false", sender.getJavaMailProperties().getProperty("mail.smtp.auth"));
        assertEquals("false", sender.getJavaMailProperties().getProperty("mail.smtp.starttls.enable"));
    }
}
