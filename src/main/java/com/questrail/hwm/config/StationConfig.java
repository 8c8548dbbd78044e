package com.questrail.hwm.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Aggregated configuration for the hardware manager runtime.
 *
 * @param permissionsFile   local permissions resource, if permission checks are enabled
 * @param permissionMaxAge  age after which a cached permission record is no longer honoured
 * @param workerThreads     size of the command worker pool
 */
public record StationConfig(
    List<DeviceConfig> devices,
    List<PipelineConfig> pipelines,
    Path permissionsFile,
    Duration permissionMaxAge,
    int workerThreads
) {
    public static final Duration DEFAULT_PERMISSION_MAX_AGE = Duration.ofHours(1);
    public static final int DEFAULT_WORKER_THREADS = 4;

    public StationConfig {
        devices = List.copyOf(Objects.requireNonNull(devices, "devices"));
        pipelines = List.copyOf(Objects.requireNonNull(pipelines, "pipelines"));
        Objects.requireNonNull(permissionMaxAge, "permissionMaxAge");
        if (permissionMaxAge.isNegative() || permissionMaxAge.isZero()) {
            throw new IllegalArgumentException("permissionMaxAge must be > 0");
        }
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be >= 1");
        }
    }

    public Optional<Path> permissions() {
        return Optional.ofNullable(permissionsFile);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<DeviceConfig> devices = new ArrayList<>();
        private final List<PipelineConfig> pipelines = new ArrayList<>();
        private Path permissionsFile;
        private Duration permissionMaxAge = DEFAULT_PERMISSION_MAX_AGE;
        private int workerThreads = DEFAULT_WORKER_THREADS;

        public Builder withDevice(DeviceConfig device) {
            devices.add(Objects.requireNonNull(device, "device"));
            return this;
        }

        public Builder withDevices(List<DeviceConfig> devices) {
            this.devices.addAll(devices);
            return this;
        }

        public Builder withPipeline(PipelineConfig pipeline) {
            pipelines.add(Objects.requireNonNull(pipeline, "pipeline"));
            return this;
        }

        public Builder withPipelines(List<PipelineConfig> pipelines) {
            this.pipelines.addAll(pipelines);
            return this;
        }

        public Builder withPermissionsFile(Path permissionsFile) {
            this.permissionsFile = permissionsFile;
            return this;
        }

        public Builder withPermissionMaxAge(Duration maxAge) {
            this.permissionMaxAge = maxAge;
            return this;
        }

        public Builder withWorkerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
            return this;
        }

        public StationConfig build() {
            return new StationConfig(devices, pipelines, permissionsFile, permissionMaxAge, workerThreads);
        }
    }
}
