package com.meetpoll.notification;

import com.meetpoll.config.MeetPollProperties;
import com.meetpoll.domain.enums.DeliveryStatus;
import com.meetpoll.domain.enums.NotificationKind;
import com.meetpoll.repository.OrganizerMailSettingsRepository;
import com.meetpoll.util.EmailAddresses;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.dao.DataAccessException;
import org.springframework.mail.MailAuthenticationException;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Sends plain-text mail on behalf of the meeting's organizer. An organizer with saved SMTP settings
 * sends through that account; everyone else goes through the auto-configured {@link JavaMailSender}.
 * Without an SMTP host ({@code spring.mail.host}) or a sender address the message is only logged
 * and reported as {@link DeliveryStatus#SIMULATED}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MailNotifier implements Notifier {

    private final ObjectProvider<JavaMailSender> mailSender;
    private final MailSenderFactory mailSenderFactory;
    private final OrganizerMailSettingsRepository settingsRepository;
    private final MeetPollProperties properties;

    @Override
    public DeliveryStatus notify(NotificationKind kind, String recipient, NotificationPayload payload) {
        MailTemplates.Mail mail = MailTemplates.render(kind, payload);
        Optional<SmtpSettings> own = organizerSettings(payload.organizerEmail());
        JavaMailSender sender = own.map(mailSenderFactory::create).orElseGet(mailSender::getIfAvailable);
        String from = own.map(SmtpSettings::fromAddress).filter(MailNotifier::notBlank)
                .orElse(properties.fromAddress());
        if (sender == null || !notBlank(from)) {
            log.info("[mail simulated] kind={} to={} subject=\"{}\"", kind, recipient, mail.subject());
            return DeliveryStatus.SIMULATED;
        }

        String fromName = own.map(SmtpSettings::fromName).filter(MailNotifier::notBlank)
                .orElse(properties.safeFromName());
        try {
            sender.send(message(fromName, from, recipient, mail));
            return DeliveryStatus.DELIVERED;
        } catch (MailException e) {
            log.warn("Failed to send {} mail to {}: {}", kind, recipient, e.getMessage());
            return DeliveryStatus.FAILED;
        }
    }

    /**
     * Sends a short test message through the given account so an organizer can check their settings.
     */
    public TestMailResult sendTestMail(SmtpSettings settings, String recipient) {
        String fromName = notBlank(settings.fromName()) ? settings.fromName() : properties.safeFromName();
        SimpleMailMessage message = message(fromName, settings.fromAddress(), recipient, MailTemplates.connectionTest());
        try {
            mailSenderFactory.create(settings).send(message);
            log.info("Test mail sent to {} via {}:{}", recipient, settings.host(), settings.port());
            return new TestMailResult(true, "Test email sent successfully to " + recipient);
        } catch (MailAuthenticationException e) {
            log.warn("Test mail to {} rejected by {}: {}", recipient, settings.host(), e.getMessage());
            return new TestMailResult(false, "Authentication failed. Check your username and password.");
        } catch (MailException e) {
            log.warn("Test mail to {} via {}:{} failed: {}", recipient, settings.host(), settings.port(), e.getMessage());
            return new TestMailResult(false,
                    "Could not send through " + settings.host() + ":" + settings.port() + ": " + e.getMessage());
        }
    }

    private Optional<SmtpSettings> organizerSettings(String organizerEmail) {
        if (!notBlank(organizerEmail)) {
            return Optional.empty();
        }
        try {
            return settingsRepository.findByOrganizer_Email(EmailAddresses.canonical(organizerEmail))
                    .map(SmtpSettings::of);
        } catch (DataAccessException e) {
            log.warn("Could not load mail settings for {}, using the default sender: {}", organizerEmail, e.getMessage());
            return Optional.empty();
        }
    }

    private static SimpleMailMessage message(String fromName, String from, String recipient, MailTemplates.Mail mail) {
        SimpleMailMessage message = new SimpleMailMessage();
        message.setFrom(fromName + " <" + from + ">");
        message.setTo(recipient);
        message.setSubject(mail.subject());
        message.setText(mail.body());
        return message;
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }

    public record TestMailResult(boolean sent, String message) {
    }
}
