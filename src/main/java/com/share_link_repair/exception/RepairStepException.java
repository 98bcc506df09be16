package com.share_link_repair.exception;

public class RepairStepException extends RuntimeException {

    private final String stepName;

    public RepairStepException(String stepName, Throwable cause) {
        super("Repair step failed: " + stepName, cause);
        this.stepName = stepName;
    }

    public String getStepName() {
        return stepName;
    }
}
