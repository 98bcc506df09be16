package com.share_link_repair.service.repair;

import com.share_link_repair.service.SystemConfigService;
import com.share_link_repair.util.VersionUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Decides from the version recorded before the update whether the link share
 * repair still has to run.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VersionGate {

    static final String DEFAULT_VERSION = "0.0.0";

    private final SystemConfigService systemConfigService;

    public boolean shouldRun() {
        String versionFromBeforeUpdate = systemConfigService.getSystemValueString(SystemConfigService.VERSION_KEY, DEFAULT_VERSION);
        log.debug("Version before update: {}", versionFromBeforeUpdate);

        // The ranges overlap; each release line got its own threshold and they are kept apart.
        if (VersionUtil.isLessThan(versionFromBeforeUpdate, "14.0.11")) {
            return true;
        }
        if (VersionUtil.isLessThan(versionFromBeforeUpdate, "15.0.8")) {
            return true;
        }
        if (VersionUtil.isLessThanOrEqual(versionFromBeforeUpdate, "16.0.0")) {
            return true;
        }

        return false;
    }
}
