package com.questrail.hwm.device;

import com.questrail.hwm.command.CommandHandler;
import com.questrail.hwm.command.CommandParser;
import com.questrail.hwm.config.DeviceConfig;
import com.questrail.hwm.pipeline.Pipeline;
import com.questrail.hwm.pipeline.TelemetryDatum;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Device
 * -----------------------------------------------------------------------------
 * Base class of every device driver: the software-owned handle to one
 * physical or virtual ground station resource.
 *
 * <h2>Reservation</h2>
 * A device is reserved by the pipelines that use it. Two modes exist:
 * <ul>
 *   <li><b>Exclusive</b> (default): {@link #reserve()} locks the device and a
 *       second reservation fails with {@link DeviceInUseException} until
 *       {@link #free()} is called. {@code locked} holds iff {@code useCount > 0}.</li>
 *   <li><b>Concurrent</b> ({@code allow_concurrent_use}): the device can never be
 *       locked; {@code useCount} simply tallies the current holders.</li>
 * </ul>
 *
 * <h2>Pipelines</h2>
 * A device does not own its pipelines. It records the ids of the pipelines
 * that registered with it and resolves them through the
 * {@link com.questrail.hwm.pipeline.PipelineDirectory} in its
 * {@link DeviceContext} whenever it has data to deliver.
 *
 * <h2>Threading</h2>
 * Reservation state is guarded by a private monitor; state transitions are
 * expected to be driven from the station coordinator. Drivers may emit output
 * and telemetry from their own threads.
 */
public abstract class Device
{
    private final Object lock = new Object();

    private final DeviceConfig configuration;
    private final DeviceContext context;
    private final Set<String> associatedPipelines = new CopyOnWriteArraySet<>();

    private volatile CommandHandler commandHandler;

    private int useCount;
    private boolean locked;

    protected Device(DeviceConfig configuration, DeviceContext context) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.context = Objects.requireNonNull(context, "context");
    }

    public final String id() {
        return configuration.id();
    }

    public final DeviceConfig configuration() {
        return configuration;
    }

    public final Map<String, Object> settings() {
        return configuration.settings();
    }

    public final boolean allowsConcurrentUse() {
        return configuration.allowConcurrentUse();
    }

    protected final DeviceContext context() {
        return context;
    }

    /**
     * Returns the command parser, for drivers that issue commands of their own.
     */
    protected final CommandParser commandParser() {
        return context.commandParser();
    }

    // ---------------------------------------------------------------------
    // Reservation
    // ---------------------------------------------------------------------

    /**
     * Reserves the device for a pipeline.
     *
     * @throws DeviceInUseException if the device is exclusive and already locked;
     *         no state changes in that case
     */
    public final void reserve() {
        synchronized (lock) {
            if (!allowsConcurrentUse()) {
                if (locked) {
                    throw new DeviceInUseException("The '" + id() + "' device has already been reserved and can't "
                        + "be used again until it has been freed.");
                }
                locked = true;
            }
            useCount++;
        }
    }

    /**
     * Releases one reservation. Freeing an unreserved device is not an error.
     */
    public final void free() {
        synchronized (lock) {
            if (!allowsConcurrentUse()) {
                locked = false;
            }
            useCount = Math.max(0, useCount - 1);
        }
    }

    /**
     * A device is active while at least one pipeline holds it.
     */
    public final boolean isActive() {
        synchronized (lock) {
            return useCount != 0;
        }
    }

    /**
     * Concurrent-capable devices are never locked; use {@link #isActive()} to
     * find out whether they are in use.
     */
    public final boolean isLocked() {
        synchronized (lock) {
            return locked;
        }
    }

    public final int useCount() {
        synchronized (lock) {
            return useCount;
        }
    }

    // ---------------------------------------------------------------------
    // Pipelines
    // ---------------------------------------------------------------------

    /**
     * Associates a pipeline with this device and lets the driver register its
     * services with it. Happens once, while the pipeline is constructed. If
     * service registration fails the pipeline is not associated.
     *
     * @throws PipelineAlreadyRegisteredException if the pipeline id is already registered
     */
    public final void registerPipeline(Pipeline pipeline) {
        Objects.requireNonNull(pipeline, "pipeline");
        if (!associatedPipelines.add(pipeline.id())) {
            throw new PipelineAlreadyRegisteredException("The '" + pipeline.id()
                + "' pipeline has already been registered with the '" + id() + "' device.");
        }
        try {
            registerServices(pipeline);
        } catch (RuntimeException e) {
            associatedPipelines.remove(pipeline.id());
            throw e;
        }
    }

    public final Set<String> associatedPipelineIds() {
        return Set.copyOf(associatedPipelines);
    }

    /**
     * Writes a telemetry datum to every associated pipeline that is currently
     * driving a session.
     */
    public final void writeTelemetry(String stream, Object datum, boolean binary, Map<String, Object> headers) {
        TelemetryDatum telemetry = new TelemetryDatum(
            id(), stream, context.clock().now(), datum, binary, headers);
        for (Pipeline pipeline : activePipelines()) {
            pipeline.writeTelemetry(telemetry);
        }
    }

    public final void writeTelemetry(String stream, Object datum) {
        writeTelemetry(stream, datum, false, Map.of());
    }

    /**
     * Writes device output to the active pipelines that use this device as
     * their output device. Every other pipeline ignores it.
     */
    public final void writeOutput(byte[] data) {
        Objects.requireNonNull(data, "data");
        for (Pipeline pipeline : activePipelines()) {
            Optional<Device> output = pipeline.outputDevice();
            if (output.isPresent() && output.get() == this) {
                pipeline.writeOutput(data);
            }
        }
    }

    private List<Pipeline> activePipelines() {
        List<Pipeline> active = new ArrayList<>();
        for (String pipelineId : associatedPipelines) {
            context.pipelines().findPipeline(pipelineId)
                .filter(Pipeline::isActive)
                .ifPresent(active::add);
        }
        return active;
    }

    // ---------------------------------------------------------------------
    // Driver hooks
    // ---------------------------------------------------------------------

    /**
     * Receives pipeline input. The default implementation discards it.
     */
    public void write(byte[] data) {
    }

    /**
     * Returns the device's command handler.
     *
     * @throws CommandHandlerNotDefinedException if the driver offers none
     */
    public final CommandHandler getCommandHandler() {
        CommandHandler handler = commandHandler;
        if (handler == null) {
            throw new CommandHandlerNotDefinedException("The '" + id() + "' device does not specify a command handler.");
        }
        return handler;
    }

    protected final void setCommandHandler(CommandHandler handler) {
        this.commandHandler = Objects.requireNonNull(handler, "handler");
    }

    /**
     * Returns the current device state, collected into pipeline telemetry.
     *
     * @throws StateNotDefinedException if the driver exposes no state
     */
    public Map<String, Object> getState() {
        throw new StateNotDefinedException("The '" + id() + "' device did not specify any device state.");
    }

    /**
     * Called after the pipeline has selected its active services for a new
     * session and before any setup command runs. Failures abort the session.
     */
    public void prepareForSession(Pipeline sessionPipeline) {
    }

    /**
     * Called when a session using this device has ended. Concurrent-capable
     * drivers should check {@link #useCount()} before stopping shared services.
     */
    public void cleanupAfterSession(Pipeline sessionPipeline) {
    }

    /**
     * Called once for every pipeline that registers with this device.
     */
    protected void registerServices(Pipeline pipeline) {
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + id() + "]";
    }
}
