package com.share_link_repair.service.repair;

import com.share_link_repair.service.notification.Notification;
import com.share_link_repair.service.notification.NotificationManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.ZonedDateTime;

@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationDispatcher {

    static final String APP = "core";
    static final String OBJECT_TYPE = "repair";
    static final String OBJECT_ID = "exposing_links";
    static final String SUBJECT = "repair_exposing_links";

    private final NotificationManager notificationManager;
    private final Clock clock;

    public void addToNotify(AffectedUserSet usersToNotify, String uid) {
        if (uid == null || uid.isBlank()) {
            log.debug("Skipping empty user id");
            return;
        }
        usersToNotify.add(uid);
    }

    /**
     * Send one notification per user. A failing submission is propagated and the
     * users already notified stay notified.
     *
     * @return number of notifications submitted
     */
    public int sendNotification(AffectedUserSet usersToNotify) {
        ZonedDateTime time = ZonedDateTime.now(clock);

        Notification notification = notificationManager.createNotification();
        notification.setApp(APP)
                .setDateTime(time)
                .setObject(OBJECT_TYPE, OBJECT_ID)
                .setSubject(SUBJECT);

        int sent = 0;
        for (String user : usersToNotify) {
            notification.setUser(user);
            notificationManager.notify(notification);
            sent++;
        }
        log.info("Sent {} repair notifications", sent);
        return sent;
    }
}
