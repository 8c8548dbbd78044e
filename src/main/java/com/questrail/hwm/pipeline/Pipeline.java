package com.questrail.hwm.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.hwm.command.CommandParser;
import com.questrail.hwm.command.CommandResponse;
import com.questrail.hwm.config.PipelineConfig;
import com.questrail.hwm.config.SetupCommand;
import com.questrail.hwm.device.Device;
import com.questrail.hwm.device.DeviceInUseException;
import com.questrail.hwm.device.DeviceNotFoundException;
import com.questrail.hwm.device.DeviceRegistry;
import com.questrail.hwm.internal.time.WallClock;
import com.questrail.hwm.observability.NullObservabilitySink;
import com.questrail.hwm.observability.ReservationEvent;
import com.questrail.hwm.observability.StationObservabilitySink;
import com.questrail.hwm.session.Session;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Pipeline
 * -----------------------------------------------------------------------------
 * A named signal chain: a subset of the station's devices, at most one input
 * device, at most one output device, the services those devices offer, and
 * at most one registered session.
 *
 * <h2>Reservation</h2>
 * {@link #reservePipeline()} acquires the pipeline lock and every device lock
 * as one unit. Devices are reserved in configuration order; when one of them
 * is already held, every device reserved by the same attempt is freed again
 * and {@link PipelineInUseException} is raised. Callers therefore observe
 * either a fully reserved pipeline or an untouched one.
 *
 * <h2>Threading</h2>
 * Reservation and session registration are expected to run on the station
 * coordinator; the pipeline monitor only guards its own fields. Device data
 * ({@link #writeOutput(byte[])}, {@link #writeTelemetry(TelemetryDatum)}) may
 * arrive from any driver thread.
 */
public final class Pipeline
{
    private static final ObjectMapper JSON = new ObjectMapper();

    private final Object lock = new Object();

    private final String id;
    private final Map<String, Device> devices;
    private final Device inputDevice;
    private final Device outputDevice;
    private final List<SetupCommand> setupCommands;
    private final CommandParser commandParser;
    private final WallClock clock;
    private final StationObservabilitySink observabilitySink;

    private final Map<String, Map<String, Service>> services = new ConcurrentHashMap<>();
    private final Map<String, String> activeServices = new ConcurrentHashMap<>();

    private volatile Session currentSession;
    private volatile boolean inUse;

    /**
     * Builds the pipeline and registers it with each of its devices.
     *
     * @throws PipelineConfigInvalidException if the configuration repeats a
     *         device, references a device that is not loaded, or declares more
     *         than one input or output device
     */
    public Pipeline(PipelineConfig configuration,
                    DeviceRegistry deviceRegistry,
                    CommandParser commandParser,
                    WallClock clock,
                    StationObservabilitySink observabilitySink)
    {
        Objects.requireNonNull(configuration, "configuration");
        Objects.requireNonNull(deviceRegistry, "deviceRegistry");
        this.id = configuration.id();
        this.commandParser = Objects.requireNonNull(commandParser, "commandParser");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.setupCommands = configuration.setupCommands();

        Map<String, Device> members = new LinkedHashMap<>();
        Device input = null;
        Device output = null;
        for (PipelineConfig.Member member : configuration.devices()) {
            if (members.containsKey(member.deviceId())) {
                throw new PipelineConfigInvalidException("The '" + id + "' pipeline configuration contains a "
                    + "duplicate device: " + member.deviceId());
            }

            Device device;
            try {
                device = deviceRegistry.getDevice(member.deviceId());
            } catch (DeviceNotFoundException e) {
                throw new PipelineConfigInvalidException("The '" + id + "' pipeline configuration references a "
                    + "device that doesn't exist: " + member.deviceId(), e);
            }
            members.put(device.id(), device);

            if (member.pipelineOutput()) {
                if (output != null) {
                    throw new PipelineConfigInvalidException("The '" + id + "' pipeline configuration specifies "
                        + "more than one output device.");
                }
                output = device;
            }
            if (member.pipelineInput()) {
                if (input != null) {
                    throw new PipelineConfigInvalidException("The '" + id + "' pipeline configuration specifies "
                        + "more than one input device.");
                }
                input = device;
            }
        }

        this.devices = Collections.unmodifiableMap(members);
        this.inputDevice = input;
        this.outputDevice = output;

        // Last, so that service registration hooks see a fully built pipeline.
        for (Device device : members.values()) {
            device.registerPipeline(this);
        }
    }

    public String id() {
        return id;
    }

    /**
     * Member devices in configuration order.
     */
    public Map<String, Device> devices() {
        return devices;
    }

    public Optional<Device> inputDevice() {
        return Optional.ofNullable(inputDevice);
    }

    public Optional<Device> outputDevice() {
        return Optional.ofNullable(outputDevice);
    }

    public List<SetupCommand> setupCommands() {
        return setupCommands;
    }

    public boolean isInUse() {
        return inUse;
    }

    /**
     * A pipeline is active while it drives a session.
     */
    public boolean isActive() {
        return currentSession != null;
    }

    public Optional<Session> currentSession() {
        return Optional.ofNullable(currentSession);
    }

    // ---------------------------------------------------------------------
    // Reservation
    // ---------------------------------------------------------------------

    /**
     * Locks the pipeline and all of its devices, or nothing at all.
     *
     * @throws PipelineInUseException if the pipeline is already reserved or one
     *         of its devices is held by another pipeline
     */
    public void reservePipeline() {
        synchronized (lock) {
            if (inUse) {
                report(ReservationEvent.Kind.REJECTED, List.of(), "pipeline already in use");
                throw new PipelineInUseException("The '" + id + "' pipeline is already being used.");
            }
            inUse = true;

            List<Device> reserved = new ArrayList<>(devices.size());
            for (Device device : devices.values()) {
                try {
                    device.reserve();
                    reserved.add(device);
                } catch (DeviceInUseException e) {
                    for (Device acquired : reserved) {
                        acquired.free();
                    }
                    inUse = false;
                    report(ReservationEvent.Kind.REJECTED, List.of(device.id()), "device '" + device.id() + "' in use");
                    throw new PipelineInUseException("The '" + id + "' pipeline could not be reserved because its '"
                        + device.id() + "' device is in use.", e);
                }
            }
            report(ReservationEvent.Kind.RESERVED, List.copyOf(devices.keySet()), null);
        }
    }

    /**
     * Frees every device of the pipeline and then the pipeline itself.
     */
    public void freePipeline() {
        synchronized (lock) {
            for (Device device : devices.values()) {
                device.free();
            }
            inUse = false;
            report(ReservationEvent.Kind.FREED, List.copyOf(devices.keySet()), null);
        }
    }

    private void report(ReservationEvent.Kind kind, List<String> deviceIds, String reason) {
        observabilitySink.onReservation(new ReservationEvent(
            clock.now(), id, kind, deviceIds, reason));
    }

    // ---------------------------------------------------------------------
    // Services
    // ---------------------------------------------------------------------

    /**
     * @throws ServiceAlreadyRegisteredException if a service of the same type
     *         and id is already registered
     */
    public void registerService(Service service) {
        Objects.requireNonNull(service, "service");
        Map<String, Service> ofType = services.computeIfAbsent(service.type(), t -> new ConcurrentHashMap<>());
        if (ofType.putIfAbsent(service.id(), service) != null) {
            throw new ServiceAlreadyRegisteredException("A '" + service.type() + "' service with id '" + service.id()
                + "' has already been registered with the '" + id + "' pipeline.");
        }
    }

    /**
     * Returns the service selected for {@code type} by the current session.
     *
     * @throws ServiceTypeNotFoundException if no service of that type is active
     * @throws ServiceInvalidException if the selection is not registered
     */
    public Service loadService(String type) {
        String serviceId = activeServices.get(type);
        if (serviceId == null) {
            throw new ServiceTypeNotFoundException("The '" + id + "' pipeline has no active '" + type + "' service.");
        }
        Service service = services.getOrDefault(type, Map.of()).get(serviceId);
        if (service == null) {
            throw new ServiceInvalidException("The active '" + type + "' service '" + serviceId
                + "' is not registered with the '" + id + "' pipeline.");
        }
        return service;
    }

    public <S extends Service> S loadService(String type, Class<S> serviceClass) {
        Service service = loadService(type);
        if (!serviceClass.isInstance(service)) {
            throw new ServiceInvalidException("The active '" + type + "' service of the '" + id + "' pipeline is not a "
                + serviceClass.getSimpleName());
        }
        return serviceClass.cast(service);
    }

    public Map<String, Map<String, Service>> services() {
        return Collections.unmodifiableMap(services);
    }

    public Map<String, String> activeServices() {
        return Map.copyOf(activeServices);
    }

    // ---------------------------------------------------------------------
    // Sessions
    // ---------------------------------------------------------------------

    /**
     * Registers the session that will receive this pipeline's output and
     * telemetry, and activates the services its reservation selects.
     *
     * @throws SessionAlreadyRegisteredException if a session is already registered
     * @throws ServiceInvalidException if a selection names an unregistered
     *         service type or id; no session remains registered in that case
     */
    public void registerSession(Session session) {
        Objects.requireNonNull(session, "session");
        synchronized (lock) {
            if (currentSession != null) {
                throw new SessionAlreadyRegisteredException("The '" + id + "' pipeline already has a registered session.");
            }
            currentSession = session;

            Map<String, String> selections = session.configuration().activeServices();
            if (!selections.isEmpty()) {
                try {
                    setActiveServices(selections);
                } catch (ServiceInvalidException e) {
                    currentSession = null;
                    activeServices.clear();
                    throw e;
                }
            }
        }
    }

    /**
     * Detaches the current session and deactivates its services.
     */
    public void unregisterSession() {
        synchronized (lock) {
            currentSession = null;
            activeServices.clear();
        }
    }

    private void setActiveServices(Map<String, String> selections) {
        for (Map.Entry<String, String> selection : selections.entrySet()) {
            Map<String, Service> ofType = services.get(selection.getKey());
            if (ofType == null) {
                throw new ServiceInvalidException("The '" + id + "' pipeline has no services of type '"
                    + selection.getKey() + "'.");
            }
            if (!ofType.containsKey(selection.getValue())) {
                throw new ServiceInvalidException("The '" + id + "' pipeline has no '" + selection.getKey()
                    + "' service with id '" + selection.getValue() + "'.");
            }
        }
        activeServices.clear();
        activeServices.putAll(selections);
    }

    // ---------------------------------------------------------------------
    // Data paths
    // ---------------------------------------------------------------------

    /**
     * Passes output of the output device to the session. No-op without a
     * session or without an output device.
     */
    public void writeOutput(byte[] data) {
        Session session = currentSession;
        if (session == null || outputDevice == null) {
            return;
        }
        session.writeOutput(data);
    }

    /**
     * Passes a device telemetry datum to the session. No-op without a session.
     */
    public void writeTelemetry(TelemetryDatum datum) {
        Session session = currentSession;
        if (session == null) {
            return;
        }
        session.writeTelemetry(datum);
    }

    /**
     * Feeds session data to the input device. No-op without an input device.
     */
    public void writeToPipeline(byte[] data) {
        if (inputDevice == null) {
            return;
        }
        inputDevice.write(data);
    }

    // ---------------------------------------------------------------------
    // Setup commands
    // ---------------------------------------------------------------------

    /**
     * Runs the configured setup commands strictly in order.
     *
     * @return a future completed with one response per command (an empty list
     *         when none are configured), or exceptionally with
     *         {@link PipelineConfigInvalidException} for a command addressed to a
     *         device outside the pipeline, or {@link SetupCommandFailedException}
     *         for a command that failed. Commands after a failure never run.
     */
    public CompletableFuture<List<CommandResponse>> runSetupCommands() {
        return runCommands(setupCommands);
    }

    /**
     * Runs an ordered command list through the command parser with the same
     * rules as {@link #runSetupCommands()}.
     */
    public CompletableFuture<List<CommandResponse>> runCommands(List<SetupCommand> commands) {
        CompletableFuture<List<CommandResponse>> chain = CompletableFuture.completedFuture(new ArrayList<>());
        for (SetupCommand command : commands) {
            chain = chain.thenCompose(responses -> runCommand(command).thenApply(response -> {
                responses.add(response);
                return responses;
            }));
        }
        return chain.thenApply(List::copyOf);
    }

    private CompletableFuture<CommandResponse> runCommand(SetupCommand command) {
        if (command.deviceId() != null && !devices.containsKey(command.deviceId())) {
            return CompletableFuture.failedFuture(new PipelineConfigInvalidException("A setup command of the '" + id
                + "' pipeline addresses the '" + command.deviceId() + "' device, which is not part of the pipeline."));
        }

        String raw;
        try {
            raw = JSON.writeValueAsString(command.toRequest());
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(new PipelineConfigInvalidException("The '" + command.command()
                + "' setup command of the '" + id + "' pipeline could not be encoded.", e));
        }

        return commandParser.parseCommand(raw).thenApply(response -> {
            if (!response.isSuccess()) {
                throw new SetupCommandFailedException("The '" + command.command() + "' setup command of the '" + id
                    + "' pipeline failed: " + response.errorMessage().orElse("unknown error"), command, response);
            }
            return response;
        });
    }

    @Override
    public String toString() {
        return "Pipeline[" + id + "]";
    }
}
