package com.share_link_repair.service;

import com.share_link_repair.entity.SystemSetting;
import com.share_link_repair.repository.SystemSettingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Persisted system-wide settings. Read failures are not caught here.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SystemConfigService {

    public static final String VERSION_KEY = "version";

    private final SystemSettingRepository systemSettingRepository;

    @Transactional(readOnly = true)
    public String getSystemValueString(String key, String defaultValue) {
        return systemSettingRepository.findById(key)
                .map(SystemSetting::getConfigValue)
                .orElse(defaultValue);
    }

    @Transactional
    public void setSystemValue(String key, String value) {
        SystemSetting setting = systemSettingRepository.findById(key)
                .orElseGet(() -> new SystemSetting(key, null));
        setting.setConfigValue(value);
        systemSettingRepository.save(setting);
        log.info("System setting '{}' set to '{}'", key, value);
    }
}
