package com.questrail.hwm.device;

import com.questrail.hwm.config.DeviceConfig;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * DeviceRegistry
 * -----------------------------------------------------------------------------
 * Owns every configured device for the lifetime of the process.
 *
 * <p>Drivers are instantiated once, in configuration order, when the registry
 * is created. All device locking is done by the devices themselves.</p>
 */
public final class DeviceRegistry
{
    private final Map<String, Device> devices;

    /**
     * @throws DeviceConfigInvalidException if two entries share an id
     * @throws DriverNotFoundException if an entry names an unknown driver
     * @throws DriverInitException if a driver fails to initialize
     */
    public DeviceRegistry(List<DeviceConfig> configurations, DriverCatalog catalog, DeviceContext context) {
        Objects.requireNonNull(configurations, "configurations");
        Objects.requireNonNull(catalog, "catalog");
        Objects.requireNonNull(context, "context");

        Map<String, Device> loaded = new LinkedHashMap<>();
        for (DeviceConfig configuration : configurations) {
            if (loaded.containsKey(configuration.id())) {
                throw new DeviceConfigInvalidException("The device configuration contains a duplicate device: "
                    + configuration.id());
            }
            loaded.put(configuration.id(), catalog.create(configuration, context));
        }
        this.devices = Collections.unmodifiableMap(loaded);
    }

    /**
     * @throws DeviceNotFoundException if no device with that id was loaded
     */
    public Device getDevice(String deviceId) {
        Device device = devices.get(deviceId);
        if (device == null) {
            throw new DeviceNotFoundException("The '" + deviceId + "' device hasn't been loaded into the device registry.");
        }
        return device;
    }

    public boolean contains(String deviceId) {
        return devices.containsKey(deviceId);
    }

    /**
     * Returns all devices in configuration order.
     */
    public Collection<Device> allDevices() {
        return devices.values();
    }
}
