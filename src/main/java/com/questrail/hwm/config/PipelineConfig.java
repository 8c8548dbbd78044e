package com.questrail.hwm.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Configuration record for one pipeline.
 *
 * <p>Structural checks against the device registry (unknown ids, duplicates,
 * several output devices) happen when the pipeline is constructed, not here,
 * so that invalid configurations still load and are rejected in one place.</p>
 */
public record PipelineConfig(
    String id,
    List<Member> devices,
    List<SetupCommand> setupCommands
) {
    /**
     * A device reference inside a pipeline.
     *
     * @param deviceId       id of a device in the registry
     * @param pipelineInput  whether pipeline input is written to this device
     * @param pipelineOutput whether this device's output is the pipeline output
     */
    public record Member(String deviceId, boolean pipelineInput, boolean pipelineOutput) {
        public Member {
            Objects.requireNonNull(deviceId, "deviceId");
        }

        public static Member of(String deviceId) {
            return new Member(deviceId, false, false);
        }
    }

    public PipelineConfig {
        Objects.requireNonNull(id, "id");
        devices = List.copyOf(Objects.requireNonNull(devices, "devices"));
        setupCommands = setupCommands == null ? List.of() : List.copyOf(setupCommands);
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public static final class Builder {
        private final String id;
        private final List<Member> devices = new ArrayList<>();
        private final List<SetupCommand> setupCommands = new ArrayList<>();

        private Builder(String id) {
            this.id = id;
        }

        public Builder withDevice(String deviceId) {
            devices.add(Member.of(deviceId));
            return this;
        }

        public Builder withInputDevice(String deviceId) {
            devices.add(new Member(deviceId, true, false));
            return this;
        }

        public Builder withOutputDevice(String deviceId) {
            devices.add(new Member(deviceId, false, true));
            return this;
        }

        public Builder withDevice(Member member) {
            devices.add(Objects.requireNonNull(member, "member"));
            return this;
        }

        public Builder withSetupCommand(SetupCommand command) {
            setupCommands.add(Objects.requireNonNull(command, "command"));
            return this;
        }

        public PipelineConfig build() {
            return new PipelineConfig(id, devices, setupCommands);
        }
    }
}
