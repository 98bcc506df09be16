package com.share_link_repair.service.repair;

import com.share_link_repair.config.RepairProperties;
import com.share_link_repair.dto.share.AffectedShare;
import com.share_link_repair.entity.User;
import com.share_link_repair.enumeration.RepairStateEnum;
import com.share_link_repair.service.GroupService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Iterator;
import java.util.stream.Stream;

/**
 * Removes link shares that expose an item which is already shared with a user or
 * group, then tells the owners, initiators and all administrators about it.
 */
@Service
@Slf4j
public class RemoveLinkSharesRepairStep implements RepairStep {

    private final VersionGate versionGate;
    private final ShareQueryEngine shareQueryEngine;
    private final ShareRemediator shareRemediator;
    private final NotificationDispatcher notificationDispatcher;
    private final GroupService groupService;
    private final RepairProperties repairProperties;
    private final TransactionTemplate streamTransaction;

    public RemoveLinkSharesRepairStep(VersionGate versionGate,
                                      ShareQueryEngine shareQueryEngine,
                                      ShareRemediator shareRemediator,
                                      NotificationDispatcher notificationDispatcher,
                                      GroupService groupService,
                                      RepairProperties repairProperties,
                                      PlatformTransactionManager transactionManager) {
        this.versionGate = versionGate;
        this.shareQueryEngine = shareQueryEngine;
        this.shareRemediator = shareRemediator;
        this.notificationDispatcher = notificationDispatcher;
        this.groupService = groupService;
        this.repairProperties = repairProperties;
        // Holds the cursor only; every delete commits in its own transaction
        this.streamTransaction = new TransactionTemplate(transactionManager);
        this.streamTransaction.setReadOnly(true);
    }

    @Override
    public String getName() {
        return "Remove potentially over exposing share links";
    }

    @Override
    public void run(RepairOutput output) {
        RepairSummary summary = execute(output);
        log.info("{} finished in state {}: {} shares removed, {} users notified",
                getName(), summary.state(), summary.removedShares(), summary.notifiedUsers());
    }

    public RepairSummary execute(RepairOutput output) {
        RepairStateEnum state = transition(RepairStateEnum.IDLE, RepairStateEnum.GATED);
        if (!versionGate.shouldRun()) {
            return skip(output, state);
        }

        state = transition(state, RepairStateEnum.COUNTING);
        int total = shareQueryEngine.countAffected();
        if (total == 0) {
            return skip(output, state);
        }

        output.info("Removing potentially over exposing link shares");
        AffectedUserSet usersToNotify = new AffectedUserSet();

        state = transition(state, RepairStateEnum.REMEDIATING);
        int removed = repair(output, total, usersToNotify);

        state = transition(state, RepairStateEnum.NOTIFYING_ADMINS);
        addAdmins(usersToNotify);

        state = transition(state, RepairStateEnum.NOTIFYING);
        output.info("Sending notifications to admins and affected users");
        int notified = notificationDispatcher.sendNotification(usersToNotify);

        state = transition(state, RepairStateEnum.DONE);
        output.info("Removed potentially over exposing link shares");
        return new RepairSummary(state, removed, notified);
    }

    private int repair(RepairOutput output, int total, AffectedUserSet usersToNotify) {
        output.startProgress(total);

        Integer processed = streamTransaction.execute(status -> {
            int count = 0;
            try (Stream<AffectedShare> shares = shareQueryEngine.streamAffected()) {
                Iterator<AffectedShare> iterator = shares.iterator();
                while (iterator.hasNext()) {
                    processShare(iterator.next(), usersToNotify);
                    output.advance();
                    count++;
                }
            }
            return count;
        });

        output.finishProgress();
        return processed == null ? 0 : processed;
    }

    private void processShare(AffectedShare share, AffectedUserSet usersToNotify) {
        notificationDispatcher.addToNotify(usersToNotify, share.uidOwner());
        notificationDispatcher.addToNotify(usersToNotify, share.uidInitiator());

        shareRemediator.deleteShare(share.id());
    }

    private void addAdmins(AffectedUserSet usersToNotify) {
        for (User admin : groupService.getAllGroupMembers(repairProperties.getAdminGroup())) {
            notificationDispatcher.addToNotify(usersToNotify, admin.getUid());
        }
    }

    private RepairSummary skip(RepairOutput output, RepairStateEnum from) {
        transition(from, RepairStateEnum.SKIPPED);
        output.info("No need to remove link shares.");
        return RepairSummary.skipped();
    }

    private RepairStateEnum transition(RepairStateEnum from, RepairStateEnum to) {
        log.debug("{}: {} -> {}", getName(), from, to);
        return to;
    }
}
