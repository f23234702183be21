package com.meetpoll.notification;

public record Envelope(String recipient, NotificationPayload payload) {
}
