package com.share_link_repair.service.repair;

import com.share_link_repair.enumeration.RepairStateEnum;

public record RepairSummary(RepairStateEnum state, int removedShares, int notifiedUsers) {

    public static RepairSummary skipped() {
        return new RepairSummary(RepairStateEnum.SKIPPED, 0, 0);
    }
}
