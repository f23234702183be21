package com.meetpoll.notification;

import com.meetpoll.domain.model.OrganizerMailSettings;

/**
 * Connection and sender details for one SMTP account.
 */
public record SmtpSettings(
        String host,
        int port,
        String username,
        String password,
        String fromAddress,
        String fromName,
        boolean startTls
) {

    public static SmtpSettings of(OrganizerMailSettings settings) {
        return new SmtpSettings(settings.getHost(), settings.getPort(), settings.getUsername(),
                settings.getPassword(), settings.getFromAddress(), settings.getFromName(), settings.isStartTls());
    }

    public boolean hasCredentials() {
        return username != null && !username.isBlank();
    }

    @Override
    public String toString() {
        return "SmtpSettings[host=" + host + ", port=" + port + ", username=" + username
                + ", fromAddress=" + fromAddress + ", startTls=" + startTls + "]";
    }
}
