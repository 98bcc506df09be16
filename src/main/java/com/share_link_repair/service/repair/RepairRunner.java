package com.share_link_repair.service.repair;

import com.share_link_repair.config.RepairProperties;
import com.share_link_repair.exception.RepairStepException;
import com.share_link_repair.service.SystemConfigService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Runs every {@link RepairStep} once at startup, in order. The first failing step
 * aborts the run and the installed version is left untouched.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RepairRunner implements CommandLineRunner {

    private final List<RepairStep> repairSteps;
    private final SystemConfigService systemConfigService;
    private final RepairProperties repairProperties;

    @Override
    public void run(String... args) {
        if (!repairProperties.isRunOnStartup()) {
            log.info("Repair steps disabled (repair.run-on-startup=false)");
            return;
        }
        runAll();
    }

    public void runAll() {
        log.info("🚀 Running {} repair step(s)", repairSteps.size());

        for (RepairStep step : repairSteps) {
            log.info("Repair step: {}", step.getName());
            try {
                step.run(new LoggingRepairOutput(step.getName()));
            } catch (RuntimeException e) {
                log.error("❌ Repair step '{}' failed: {}", step.getName(), e.getMessage());
                throw new RepairStepException(step.getName(), e);
            }
        }

        recordInstalledVersion();
        log.info("✅ Repair steps completed");
    }

    private void recordInstalledVersion() {
        String installedVersion = repairProperties.getInstalledVersion();
        if (installedVersion == null || installedVersion.isBlank()) {
            return;
        }
        systemConfigService.setSystemValue(SystemConfigService.VERSION_KEY, installedVersion);
    }
}
