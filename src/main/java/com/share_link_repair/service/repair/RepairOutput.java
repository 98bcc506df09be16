package com.share_link_repair.service.repair;

/**
 * Progress sink handed to a {@link RepairStep}. Purely observational.
 */
public interface RepairOutput {

    void startProgress(int total);

    void advance();

    void finishProgress();

    void info(String message);
}
