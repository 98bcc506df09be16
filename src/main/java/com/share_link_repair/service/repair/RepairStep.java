package com.share_link_repair.service.repair;

/**
 * A data repair executed by {@link RepairRunner} as part of an upgrade.
 */
public interface RepairStep {

    String getName();

    /**
     * Run the repair. Any exception aborts the upgrade.
     */
    void run(RepairOutput output);
}
