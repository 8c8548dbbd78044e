package com.questrail.hwm.runtime;

import com.questrail.hwm.command.CommandParser;
import com.questrail.hwm.command.SystemCommandHandler;
import com.questrail.hwm.config.StationConfig;
import com.questrail.hwm.device.DeviceContext;
import com.questrail.hwm.device.DeviceRegistry;
import com.questrail.hwm.device.DriverCatalog;
import com.questrail.hwm.internal.exec.StationCoordinator;
import com.questrail.hwm.internal.time.SystemWallClock;
import com.questrail.hwm.internal.time.WallClock;
import com.questrail.hwm.observability.NullObservabilitySink;
import com.questrail.hwm.observability.StationObservabilitySink;
import com.questrail.hwm.pipeline.PipelineRegistry;
import com.questrail.hwm.security.FilePermissionSource;
import com.questrail.hwm.security.PermissionManager;
import com.questrail.hwm.security.PermissionSource;
import com.questrail.hwm.session.SessionCoordinator;
import com.questrail.hwm.transport.CommandDatagramAdapter;
import com.questrail.hwm.transport.DatagramEndpoint;
import com.questrail.hwm.transport.udp.netty.NettyUdpDatagramEndpoint;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * HardwareManager
 * =============================================================================
 * Composition root and lifecycle owner for the ground station hardware manager.
 *
 * <h2>Wiring order</h2>
 * <ol>
 *   <li>station coordinator and command worker pool</li>
 *   <li>empty pipeline registry (handed to drivers as their pipeline directory)</li>
 *   <li>device registry; drivers reach the command parser through a supplier</li>
 *   <li>permission manager, when a permission source is configured</li>
 *   <li>system command handler and command parser</li>
 *   <li>pipelines, now that devices and the parser exist</li>
 *   <li>session coordinator and, optionally, the UDP command transport</li>
 * </ol>
 */
public final class HardwareManager
{
    private final StationCoordinator coordinator;
    private final ExecutorService workers;
    private final DeviceRegistry devices;
    private final PipelineRegistry pipelines;
    private final PermissionManager permissions;
    private final CommandParser commandParser;
    private final SessionCoordinator sessions;
    private final CommandDatagramAdapter commandTransport;

    private HardwareManager(StationCoordinator coordinator,
                            ExecutorService workers,
                            DeviceRegistry devices,
                            PipelineRegistry pipelines,
                            PermissionManager permissions,
                            CommandParser commandParser,
                            SessionCoordinator sessions,
                            CommandDatagramAdapter commandTransport)
    {
        this.coordinator = coordinator;
        this.workers = workers;
        this.devices = devices;
        this.pipelines = pipelines;
        this.permissions = permissions;
        this.commandParser = commandParser;
        this.sessions = sessions;
        this.commandTransport = commandTransport;
    }

    public void start() {
        coordinator.start();
        if (commandTransport != null) {
            commandTransport.start();
        }
    }

    public void stop() {
        if (commandTransport != null) {
            commandTransport.stop();
        }
        coordinator.stop();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public DeviceRegistry devices() {
        return devices;
    }

    public PipelineRegistry pipelines() {
        return pipelines;
    }

    public Optional<PermissionManager> permissions() {
        return Optional.ofNullable(permissions);
    }

    public CommandParser commandParser() {
        return commandParser;
    }

    public SessionCoordinator sessions() {
        return sessions;
    }

    public StationCoordinator coordinator() {
        return coordinator;
    }

    public Optional<CommandDatagramAdapter> commandTransport() {
        return Optional.ofNullable(commandTransport);
    }

    public static Builder builder(StationConfig config) {
        return new Builder(config);
    }

    public static final class Builder {
        private final StationConfig config;
        private DriverCatalog drivers = DriverCatalog.defaults();
        private StationObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private WallClock clock = SystemWallClock.INSTANCE;
        private PermissionSource permissionSource;
        private DatagramEndpoint commandEndpoint;
        private Function<SocketAddress, Optional<String>> userResolver = remote -> Optional.empty();

        private Builder(StationConfig config) {
            this.config = Objects.requireNonNull(config, "config");
        }

        public Builder withDrivers(DriverCatalog drivers) {
            this.drivers = drivers;
            return this;
        }

        public Builder withObservabilitySink(StationObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withClock(WallClock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Overrides the permissions file named by the station configuration.
         */
        public Builder withPermissionSource(PermissionSource source) {
            this.permissionSource = source;
            return this;
        }

        /**
         * Accept commands over UDP on the given local address.
         */
        public Builder withBindAddress(InetSocketAddress address) {
            this.commandEndpoint = new NettyUdpDatagramEndpoint(address);
            return this;
        }

        public Builder withCommandEndpoint(DatagramEndpoint endpoint) {
            this.commandEndpoint = endpoint;
            return this;
        }

        /**
         * Maps a datagram sender to the user it acts for. Unmapped senders are refused.
         */
        public Builder withUserResolver(Function<SocketAddress, Optional<String>> resolver) {
            this.userResolver = resolver;
            return this;
        }

        public HardwareManager build() {
            Objects.requireNonNull(drivers, "drivers");
            Objects.requireNonNull(clock, "clock");
            Objects.requireNonNull(userResolver, "userResolver");
            StationObservabilitySink sink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);

            // 1. Execution
            StationCoordinator coordinator = new StationCoordinator(sink);
            ExecutorService workers = Executors.newFixedThreadPool(config.workerThreads(), new WorkerThreadFactory());

            try {
                // 2-3. Devices (the parser is bound once it exists)
                PipelineRegistry pipelines = new PipelineRegistry();
                AtomicReference<CommandParser> parserRef = new AtomicReference<>();
                DeviceContext context = new DeviceContext(pipelines, parserRef::get, clock);
                DeviceRegistry devices = new DeviceRegistry(config.devices(), drivers, context);

                // 4. Permissions
                PermissionSource source = permissionSource;
                if (source == null && config.permissions().isPresent()) {
                    source = new FilePermissionSource(config.permissions().get());
                }
                PermissionManager permissions = source == null
                    ? null
                    : new PermissionManager(source, workers, clock, config.permissionMaxAge());

                // 5. Commands
                SystemCommandHandler systemHandler = new SystemCommandHandler(devices, pipelines, clock);
                CommandParser parser = new CommandParser(
                    systemHandler, devices, permissions, coordinator, workers, clock, sink);
                parserRef.set(parser);

                // 6. Pipelines
                pipelines.loadPipelines(config.pipelines(), devices, parser, clock, sink);

                // 7. Sessions and transport
                SessionCoordinator sessions = new SessionCoordinator(pipelines, coordinator, clock, sink);
                CommandDatagramAdapter transport = commandEndpoint == null
                    ? null
                    : new CommandDatagramAdapter(commandEndpoint, parser, userResolver, clock, sink);

                return new HardwareManager(
                    coordinator, workers, devices, pipelines, permissions, parser, sessions, transport);
            } catch (RuntimeException e) {
                workers.shutdownNow();
                throw e;
            }
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "hwm-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
