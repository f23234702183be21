package com.meetpoll.notification;

import com.meetpoll.domain.enums.DeliveryStatus;
import com.meetpoll.domain.enums.NotificationKind;

/**
 * Outbound delivery contract. Implementations report failures through the returned status and
 * should not throw; callers still guard against it.
 */
public interface Notifier {

    DeliveryStatus notify(NotificationKind kind, String recipient, NotificationPayload payload);
}
