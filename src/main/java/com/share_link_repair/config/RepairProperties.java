package com.share_link_repair.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class RepairProperties {

    private final boolean runOnStartup;
    private final String installedVersion;
    private final String adminGroup;

    public RepairProperties(
            @Value("${repair.run-on-startup:true}") boolean runOnStartup,
            @Value("${repair.installed-version:}") String installedVersion,
            @Value("${repair.admin-group:admin}") String adminGroup
    ) {
        this.runOnStartup = runOnStartup;
        this.installedVersion = installedVersion;
        this.adminGroup = adminGroup;
    }

    public boolean isRunOnStartup() {
        return runOnStartup;
    }

    public String getInstalledVersion() {
        return installedVersion;
    }

    public String getAdminGroup() {
        return adminGroup;
    }
}
