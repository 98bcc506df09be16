package com.share_link_repair.service.repair;

import lombok.extern.slf4j.Slf4j;

/**
 * Writes step messages to the log and reports progress at every 10%.
 */
@Slf4j
public class LoggingRepairOutput implements RepairOutput {

    private final String stepName;
    private long total;
    private long current;
    private int lastReportedDecile;

    public LoggingRepairOutput(String stepName) {
        this.stepName = stepName;
    }

    @Override
    public void startProgress(int total) {
        this.total = total;
        this.current = 0;
        this.lastReportedDecile = 0;
        log.info("[{}] Processing {} items", stepName, total);
    }

    @Override
    public void advance() {
        current++;
        if (total <= 0) {
            log.debug("[{}] {} items processed", stepName, current);
            return;
        }
        int decile = (int) Math.min(10, current * 10 / total);
        if (decile > lastReportedDecile) {
            lastReportedDecile = decile;
            log.info("[{}] {}/{} ({}%)", stepName, current, total, decile * 10);
        }
    }

    @Override
    public void finishProgress() {
        log.info("[{}] Finished, {} items processed", stepName, current);
    }

    @Override
    public void info(String message) {
        log.info("[{}] {}", stepName, message);
    }
}
