package com.questrail.hwm.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration record for one ground station device.
 *
 * @param id                 unique device id
 * @param driver             driver name resolved through the driver catalog
 * @param allowConcurrentUse whether several pipelines may hold the device at once
 * @param settings           opaque driver settings (connection details, options)
 */
public record DeviceConfig(
    String id,
    String driver,
    boolean allowConcurrentUse,
    Map<String, Object> settings
) {
    public DeviceConfig {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(driver, "driver");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Device id must not be blank");
        }
        settings = settings == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(settings));
    }

    public static Builder builder(String id, String driver) {
        return new Builder(id, driver);
    }

    public static final class Builder {
        private final String id;
        private final String driver;
        private boolean allowConcurrentUse = false;
        private final Map<String, Object> settings = new LinkedHashMap<>();

        private Builder(String id, String driver) {
            this.id = id;
            this.driver = driver;
        }

        public Builder withConcurrentUse(boolean allowConcurrentUse) {
            this.allowConcurrentUse = allowConcurrentUse;
            return this;
        }

        public Builder withSetting(String key, Object value) {
            settings.put(Objects.requireNonNull(key, "key"), value);
            return this;
        }

        public DeviceConfig build() {
            return new DeviceConfig(id, driver, allowConcurrentUse, settings);
        }
    }
}
