package com.share_link_repair.service.notification;

import com.share_link_repair.entity.NotificationRecord;
import com.share_link_repair.repository.NotificationRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Stores each submitted notification as its own row for out-of-process delivery.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PersistentNotificationManager implements NotificationManager {

    private final NotificationRecordRepository notificationRecordRepository;

    @Override
    public Notification createNotification() {
        return new Notification();
    }

    @Override
    @Transactional
    public void notify(Notification notification) {
        if (!notification.isValid()) {
            throw new IllegalArgumentException("The given notification is invalid");
        }

        NotificationRecord record = NotificationRecord.builder()
                .app(notification.getApp())
                .userUid(notification.getUser())
                .notifiedAt(notification.getDateTime())
                .objectType(notification.getObjectType())
                .objectId(notification.getObjectId())
                .subject(notification.getSubject())
                .build();
        notificationRecordRepository.save(record);
        log.debug("Queued notification '{}' for user '{}'", record.getSubject(), record.getUserUid());
    }
}
