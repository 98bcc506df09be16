package com.share_link_repair.unit_tests.service.repair;

import com.share_link_repair.config.RepairProperties;
import com.share_link_repair.dto.share.AffectedShare;
import com.share_link_repair.entity.User;
import com.share_link_repair.enumeration.RepairStateEnum;
import com.share_link_repair.service.GroupService;
import com.share_link_repair.service.notification.Notification;
import com.share_link_repair.service.notification.NotificationManager;
import com.share_link_repair.service.repair.*;
import jakarta.persistence.EntityNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class RemoveLinkSharesRepairStepTest {

    @Mock private VersionGate versionGate;
    @Mock private ShareQueryEngine shareQueryEngine;
    @Mock private ShareRemediator shareRemediator;
    @Mock private NotificationManager notificationManager;
    @Mock private GroupService groupService;
    @Mock private PlatformTransactionManager transactionManager;
    @Mock private RepairOutput output;

    private RemoveLinkSharesRepairStep repairStep;
    private List<String> notifiedUsers;

    @BeforeEach
    void setUp() {
        NotificationDispatcher notificationDispatcher = new NotificationDispatcher(notificationManager, Clock.systemUTC());
        RepairProperties repairProperties = new RepairProperties(false, "", "admin");
        repairStep = new RemoveLinkSharesRepairStep(versionGate, shareQueryEngine, shareRemediator,
                notificationDispatcher, groupService, repairProperties, transactionManager);

        notifiedUsers = new ArrayList<>();
        when(notificationManager.createNotification()).thenAnswer(invocation -> new Notification());
        doAnswer(invocation -> {
            notifiedUsers.add(((Notification) invocation.getArgument(0)).getUser());
            return null;
        }).when(notificationManager).notify(any(Notification.class));

        when(groupService.getAllGroupMembers("admin")).thenReturn(Set.of(user("dave")));
    }

    private static User user(String uid) {
        return User.builder().id(UUID.randomUUID()).uid(uid).build();
    }

    @Nested
    @DisplayName("Skipping")
    class SkipTests {

        @Test
        @DisplayName("Should skip without counting when the gate is closed")
        void execute_GateClosed() {
            // Given
            when(versionGate.shouldRun()).thenReturn(false);

            // When
            RepairSummary summary = repairStep.execute(output);

            // Then
            assertEquals(RepairStateEnum.SKIPPED, summary.state());
            verify(shareQueryEngine, never()).countAffected();
            verify(output).info("No need to remove link shares.");
            verifyNoInteractions(shareRemediator, notificationManager, transactionManager);
        }

        @Test
        @DisplayName("Should skip without streaming when nothing is affected")
        void execute_NothingAffected() {
            // Given
            when(versionGate.shouldRun()).thenReturn(true);
            when(shareQueryEngine.countAffected()).thenReturn(0);

            // When
            RepairSummary summary = repairStep.execute(output);

            // Then
            assertEquals(RepairStateEnum.SKIPPED, summary.state());
            verify(shareQueryEngine, never()).streamAffected();
            verify(output, never()).startProgress(anyInt());
            verify(output).info("No need to remove link shares.");
            verifyNoInteractions(shareRemediator, notificationManager, groupService);
        }
    }

    @Nested
    @DisplayName("Remediation")
    class RemediationTests {

        @BeforeEach
        void openGate() {
            when(versionGate.shouldRun()).thenReturn(true);
        }

        @Test
        @DisplayName("Should delete every streamed link share and notify owners, initiators and admins once")
        void execute_RemovesAndNotifies() {
            // Given
            AtomicBoolean closed = new AtomicBoolean(false);
            when(shareQueryEngine.countAffected()).thenReturn(2);
            when(shareQueryEngine.streamAffected()).thenReturn(Stream.of(
                    new AffectedShare(11, "bob", "carol"),
                    new AffectedShare(12, "bob", "dave")
            ).onClose(() -> closed.set(true)));

            // When
            RepairSummary summary = repairStep.execute(output);

            // Then
            assertEquals(RepairStateEnum.DONE, summary.state());
            assertEquals(2, summary.removedShares());
            assertEquals(3, summary.notifiedUsers());
            assertTrue(closed.get());

            verify(shareRemediator).deleteShare(11);
            verify(shareRemediator).deleteShare(12);
            assertThat(notifiedUsers).containsExactlyInAnyOrder("bob", "carol", "dave");

            InOrder inOrder = inOrder(output, shareRemediator, notificationManager);
            inOrder.verify(output).info("Removing potentially over exposing link shares");
            inOrder.verify(output).startProgress(2);
            inOrder.verify(shareRemediator).deleteShare(11);
            inOrder.verify(output).advance();
            inOrder.verify(shareRemediator).deleteShare(12);
            inOrder.verify(output).advance();
            inOrder.verify(output).finishProgress();
            inOrder.verify(output).info("Sending notifications to admins and affected users");
            inOrder.verify(notificationManager, atLeastOnce()).notify(any(Notification.class));
            inOrder.verify(output).info("Removed potentially over exposing link shares");
        }

        @Test
        @DisplayName("Should tolerate the same share id appearing twice")
        void execute_RepeatedId() {
            // Given
            when(shareQueryEngine.countAffected()).thenReturn(1);
            when(shareQueryEngine.streamAffected()).thenReturn(Stream.of(
                    new AffectedShare(7, "bob", "bob"),
                    new AffectedShare(7, "bob", "bob")
            ));

            // When
            RepairSummary summary = repairStep.execute(output);

            // Then
            verify(shareRemediator, times(2)).deleteShare(7);
            assertEquals(RepairStateEnum.DONE, summary.state());
            assertThat(notifiedUsers).containsExactlyInAnyOrder("bob", "dave");
        }

        @Test
        @DisplayName("Should close the stream and skip notifications when a delete fails")
        void execute_DeleteFailure() {
            // Given
            AtomicBoolean closed = new AtomicBoolean(false);
            when(shareQueryEngine.countAffected()).thenReturn(2);
            when(shareQueryEngine.streamAffected()).thenReturn(Stream.of(
                    new AffectedShare(1, "bob", "carol"),
                    new AffectedShare(2, "erin", "erin")
            ).onClose(() -> closed.set(true)));
            doNothing().when(shareRemediator).deleteShare(1);
            doThrow(new IllegalStateException("connection lost")).when(shareRemediator).deleteShare(2);

            // When / Then
            assertThrows(IllegalStateException.class, () -> repairStep.execute(output));
            assertTrue(closed.get());
            verify(shareRemediator).deleteShare(1);
            verify(output, never()).finishProgress();
            verify(notificationManager, never()).notify(any());
        }

        @Test
        @DisplayName("Should propagate a missing administrators group")
        void execute_MissingAdminGroup() {
            // Given
            when(shareQueryEngine.countAffected()).thenReturn(1);
            when(shareQueryEngine.streamAffected()).thenReturn(Stream.of(new AffectedShare(3, "bob", "carol")));
            when(groupService.getAllGroupMembers("admin")).thenThrow(new EntityNotFoundException("Group not found: admin"));

            // When / Then
            assertThrows(EntityNotFoundException.class, () -> repairStep.execute(output));
            verify(shareRemediator).deleteShare(3);
            verify(notificationManager, never()).notify(any());
        }

        @Test
        @DisplayName("Should propagate a notification failure")
        void execute_NotificationFailure() {
            // Given
            when(shareQueryEngine.countAffected()).thenReturn(1);
            when(shareQueryEngine.streamAffected()).thenReturn(Stream.of(new AffectedShare(3, "bob", "carol")));
            doThrow(new IllegalArgumentException("The given notification is invalid"))
                    .when(notificationManager).notify(any(Notification.class));

            // When / Then
            assertThrows(IllegalArgumentException.class, () -> repairStep.execute(output));
            verify(output, never()).info("Removed potentially over exposing link shares");
        }
    }

    @Test
    void getName() {
        assertEquals("Remove potentially over exposing share links", repairStep.getName());
    }
}
