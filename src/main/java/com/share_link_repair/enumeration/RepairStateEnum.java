package com.share_link_repair.enumeration;

public enum RepairStateEnum {
    IDLE,
    GATED,
    COUNTING,
    REMEDIATING,
    NOTIFYING_ADMINS,
    NOTIFYING,
    DONE,
    SKIPPED
}
