package com.share_link_repair.service.notification;

import lombok.Getter;

import java.time.ZonedDateTime;

/**
 * Mutable notification payload. Setters return {@code this} so a caller can
 * configure it once and then only swap the target user between submissions.
 */
@Getter
public class Notification {

    private String app;
    private String user;
    private ZonedDateTime dateTime;
    private String objectType;
    private String objectId;
    private String subject;

    public Notification setApp(String app) {
        this.app = app;
        return this;
    }

    public Notification setUser(String user) {
        this.user = user;
        return this;
    }

    public Notification setDateTime(ZonedDateTime dateTime) {
        this.dateTime = dateTime;
        return this;
    }

    public Notification setObject(String type, String id) {
        this.objectType = type;
        this.objectId = id;
        return this;
    }

    public Notification setSubject(String subject) {
        this.subject = subject;
        return this;
    }

    public boolean isValid() {
        return hasText(app)
                && hasText(user)
                && dateTime != null
                && hasText(objectType)
                && hasText(objectId)
                && hasText(subject);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
