package com.meetpoll.service;

/**
 * Submitted SMTP settings. A blank password keeps the one already saved; a blank sender address
 * defaults to the organizer's own email.
 */
public record MailSettingsUpdate(
        String host,
        Integer port,
        String username,
        String password,
        String fromAddress,
        String fromName,
        Boolean startTls
) {
    @Override
    public String toString() {
        return "MailSettingsUpdate[host=" + host + ", port=" + port + ", username=" + username + "]";
    }
}
