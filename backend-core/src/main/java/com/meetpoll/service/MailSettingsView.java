package com.meetpoll.service;

import com.meetpoll.domain.model.OrganizerMailSettings;

/**
 * Saved SMTP settings as shown back to their owner. The password itself never leaves the service.
 */
public record MailSettingsView(
        String host,
        int port,
        String username,
        boolean passwordSet,
        String fromAddress,
        String fromName,
        boolean startTls
) {

    static MailSettingsView of(OrganizerMailSettings settings) {
        return new MailSettingsView(settings.getHost(), settings.getPort(), settings.getUsername(),
                settings.getPassword() != null && !settings.getPassword().isEmpty(),
                settings.getFromAddress(), settings.getFromName(), settings.isStartTls());
    }
}
