package com.questrail.hwm.session;

import com.questrail.hwm.config.SetupCommand;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reservation that a session was created from.
 *
 * @param activeServices service type to service id selections for the pipeline
 * @param setupCommands  commands run after the pipeline's own setup commands;
 *                       device targets must belong to the pipeline
 */
public record ReservationConfig(
    String reservationId,
    String pipelineId,
    String userId,
    Map<String, String> activeServices,
    List<SetupCommand> setupCommands
) {
    public ReservationConfig {
        Objects.requireNonNull(reservationId, "reservationId");
        Objects.requireNonNull(pipelineId, "pipelineId");
        activeServices = activeServices == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(activeServices));
        setupCommands = setupCommands == null ? List.of() : List.copyOf(setupCommands);
    }

    public static Builder builder(String reservationId, String pipelineId) {
        return new Builder(reservationId, pipelineId);
    }

    public static final class Builder {
        private final String reservationId;
        private final String pipelineId;
        private String userId;
        private final Map<String, String> activeServices = new LinkedHashMap<>();
        private final List<SetupCommand> setupCommands = new ArrayList<>();

        private Builder(String reservationId, String pipelineId) {
            this.reservationId = reservationId;
            this.pipelineId = pipelineId;
        }

        public Builder withUser(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder withActiveService(String type, String serviceId) {
            activeServices.put(Objects.requireNonNull(type, "type"), Objects.requireNonNull(serviceId, "serviceId"));
            return this;
        }

        public Builder withSetupCommand(SetupCommand command) {
            setupCommands.add(Objects.requireNonNull(command, "command"));
            return this;
        }

        public ReservationConfig build() {
            return new ReservationConfig(reservationId, pipelineId, userId, activeServices, setupCommands);
        }
    }
}
