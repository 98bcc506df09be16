package com.share_link_repair.service.notification;

public interface NotificationManager {

    Notification createNotification();

    /**
     * Deliver the notification to its current target user.
     *
     * @throws IllegalArgumentException when the notification is incomplete
     */
    void notify(Notification notification);
}
