package com.questrail.hwm.device;

import com.questrail.hwm.config.DeviceConfig;
import com.questrail.hwm.device.drivers.LoopbackDevice;
import com.questrail.hwm.device.drivers.StationClockDevice;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * DriverCatalog
 * -----------------------------------------------------------------------------
 * Explicit mapping from the driver names used in device configuration to the
 * factories that build them. Populated once at process startup.
 */
public final class DriverCatalog
{
    private final Map<String, DeviceDriverFactory> factories;

    private DriverCatalog(Map<String, DeviceDriverFactory> factories) {
        this.factories = Collections.unmodifiableMap(new LinkedHashMap<>(factories));
    }

    /**
     * Returns a catalog holding the built-in drivers.
     */
    public static DriverCatalog defaults() {
        return builder().withDefaults().build();
    }

    /**
     * Instantiates the driver named by the configuration.
     *
     * @throws DriverNotFoundException if no factory is registered for the driver name
     * @throws DriverInitException if the factory fails
     */
    public Device create(DeviceConfig configuration, DeviceContext context) {
        DeviceDriverFactory factory = factories.get(configuration.driver());
        if (factory == null) {
            throw new DriverNotFoundException("The driver '" + configuration.driver() + "' for device '"
                + configuration.id() + "' could not be located.");
        }

        Device device;
        try {
            device = factory.create(configuration, context);
        } catch (RuntimeException e) {
            throw new DriverInitException("The '" + configuration.driver() + "' driver failed to initialize device '"
                + configuration.id() + "': " + e.getMessage(), e);
        }
        if (device == null) {
            throw new DriverInitException("The '" + configuration.driver() + "' driver returned no device for '"
                + configuration.id() + "'");
        }
        return device;
    }

    public Set<String> driverNames() {
        return factories.keySet();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<String, DeviceDriverFactory> factories = new LinkedHashMap<>();

        public Builder withDefaults() {
            factories.put(LoopbackDevice.DRIVER_NAME, LoopbackDevice::new);
            factories.put(StationClockDevice.DRIVER_NAME, StationClockDevice::new);
            return this;
        }

        public Builder withDriver(String name, DeviceDriverFactory factory) {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(factory, "factory");
            if (factories.putIfAbsent(name, factory) != null) {
                throw new IllegalArgumentException("Driver already registered: " + name);
            }
            return this;
        }

        public DriverCatalog build() {
            return new DriverCatalog(factories);
        }
    }
}
