package com.meetpoll.service;

import com.meetpoll.context.OrganizerContext;
import com.meetpoll.domain.model.OrganizerMailSettings;
import com.meetpoll.exception.InvalidArgumentException;
import com.meetpoll.notification.MailNotifier;
import com.meetpoll.notification.SmtpSettings;
import com.meetpoll.repository.OrganizerMailSettingsRepository;
import com.meetpoll.repository.OrganizerRepository;
import com.meetpoll.storage.StorageTransactions;
import com.meetpoll.util.EmailAddresses;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Per-organizer SMTP account used for every mail sent on the organizer's behalf, with a test send
 * to check the settings before relying on them.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MailSettingsService {

    static final int DEFAULT_PORT = 587;

    private final OrganizerMailSettingsRepository settingsRepository;
    private final OrganizerRepository organizerRepository;
    private final MailNotifier mailNotifier;
    private final StorageTransactions storage;

    public Optional<MailSettingsView> getSettings(OrganizerContext ctx) {
        return storage.read(() -> settingsRepository.findByOrganizer_Id(ctx.organizerId()).map(MailSettingsView::of));
    }

    public MailSettingsView saveSettings(OrganizerContext ctx, MailSettingsUpdate update) {
        SmtpSettings submitted = normalize(ctx, update);
        MailSettingsView saved = storage.writeWithRetry(() -> {
            OrganizerMailSettings settings = settingsRepository.findByOrganizer_Id(ctx.organizerId())
                    .orElseGet(() -> {
                        OrganizerMailSettings created = new OrganizerMailSettings();
                        created.setOrganizer(organizerRepository.getReferenceById(ctx.organizerId()));
                        return created;
                    });
            settings.setHost(submitted.host());
            settings.setPort(submitted.port());
            settings.setUsername(submitted.username());
            if (submitted.password() != null) {
                settings.setPassword(submitted.password());
            }
            settings.setFromAddress(submitted.fromAddress());
            settings.setFromName(submitted.fromName());
            settings.setStartTls(submitted.startTls());
            return MailSettingsView.of(settingsRepository.saveAndFlush(settings));
        });
        log.info("Saved mail settings for organizer {} (host {})", ctx.organizerId(), saved.host());
        return saved;
    }

    /**
     * Drops the organizer's own account; mail falls back to the application-wide sender.
     */
    public boolean clearSettings(OrganizerContext ctx) {
        boolean removed = storage.write(() -> settingsRepository.deleteByOrganizerId(ctx.organizerId()) > 0);
        if (removed) {
            log.info("Cleared mail settings for organizer {}", ctx.organizerId());
        }
        return removed;
    }

    /**
     * Sends a test message to the organizer's own address. Uses the submitted settings when given,
     * otherwise the saved ones; a blank submitted password falls back to the saved password.
     */
    public MailNotifier.TestMailResult sendTestEmail(OrganizerContext ctx, MailSettingsUpdate candidate) {
        Optional<SmtpSettings> stored = storage.read(() ->
                settingsRepository.findByOrganizer_Id(ctx.organizerId()).map(SmtpSettings::of));
        SmtpSettings settings;
        if (candidate == null) {
            settings = stored.orElseThrow(() -> new InvalidArgumentException("No mail settings saved"));
        } else {
            SmtpSettings submitted = normalize(ctx, candidate);
            String password = submitted.password() != null
                    ? submitted.password()
                    : stored.map(SmtpSettings::password).orElse(null);
            settings = new SmtpSettings(submitted.host(), submitted.port(), submitted.username(), password,
                    submitted.fromAddress(), submitted.fromName(), submitted.startTls());
        }
        if (!settings.hasCredentials() || settings.password() == null) {
            throw new InvalidArgumentException("Please fill in all SMTP fields (host, username, password, from address)");
        }
        return mailNotifier.sendTestMail(settings, ctx.email());
    }

    private static SmtpSettings normalize(OrganizerContext ctx, MailSettingsUpdate update) {
        if (update == null) {
            throw new InvalidArgumentException("Mail settings are required");
        }
        String host = blankToNull(update.host());
        if (host == null) {
            throw new InvalidArgumentException("SMTP host is required");
        }
        int port = update.port() == null ? DEFAULT_PORT : update.port();
        if (port < 1 || port > 65535) {
            throw new InvalidArgumentException("SMTP port must be between 1 and 65535");
        }
        String fromAddress = blankToNull(update.fromAddress()) == null
                ? ctx.email()
                : EmailAddresses.canonical(update.fromAddress());
        if (!EmailAddresses.looksValid(fromAddress)) {
            throw new InvalidArgumentException("Invalid sender address: %s", fromAddress);
        }
        return new SmtpSettings(
                host,
                port,
                blankToNull(update.username()),
                update.password() == null || update.password().isBlank() ? null : update.password(),
                fromAddress,
                blankToNull(update.fromName()),
                update.startTls() == null || update.startTls());
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
