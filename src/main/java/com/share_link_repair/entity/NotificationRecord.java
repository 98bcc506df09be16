package com.share_link_repair.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.ZonedDateTime;

/**
 * One delivered notification. A row is written for every submission, even when
 * the caller re-submits the same {@code Notification} object with another user.
 */
@Entity
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Table(name = "notifications")
public class NotificationRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 32)
    private String app;

    @Column(name = "user_uid", nullable = false, length = 64)
    private String userUid;

    @Column(name = "notified_at", nullable = false)
    private ZonedDateTime notifiedAt;

    @Column(name = "object_type", nullable = false, length = 64)
    private String objectType;

    @Column(name = "object_id", nullable = false, length = 64)
    private String objectId;

    @Column(nullable = false, length = 64)
    private String subject;
}
