package dev.plotkeeper.daemon;

import dev.plotkeeper.config.HostConfig;
import dev.plotkeeper.daemon.broker.CorrelationBroker;
import dev.plotkeeper.daemon.channel.ChannelConnector;
import dev.plotkeeper.daemon.channel.PeerVerification;
import dev.plotkeeper.daemon.channel.WebSocketChannelConnector;
import dev.plotkeeper.daemon.connection.ConnectionState;
import dev.plotkeeper.daemon.connection.ConnectionStateListener;
import dev.plotkeeper.daemon.connection.ConnectionSupervisor;
import dev.plotkeeper.daemon.process.DaemonProcessControl;
import dev.plotkeeper.daemon.process.DaemonProcessHandle;
import dev.plotkeeper.daemon.process.HostOs;
import dev.plotkeeper.daemon.process.ProcessSupervisor;
import dev.plotkeeper.daemon.shutdown.HostWindow;
import dev.plotkeeper.daemon.shutdown.ShutdownCoordinator;
import dev.plotkeeper.daemon.shutdown.ShutdownState;
import dev.plotkeeper.daemon.wire.EnvelopeCodec;
import dev.plotkeeper.util.Json;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jspecify.annotations.NullMarked;

/**
 * Everything the host needs to talk to one daemon: the event loop, the broker, the connection and
 * process supervisors and the shutdown coordinator. Created once by the application root and passed
 * to whoever needs it.
 */
@NullMarked
public final class DaemonSession implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(DaemonSession.class);

    private final EventLoop loop;
    private final CorrelationBroker broker;
    private final ConnectionSupervisor connection;
    private final DaemonProcessControl processControl;
    private final ShutdownCoordinator shutdown;
    private final boolean manageDaemonLifetime;
    private final HostConfig config;
    private final CompletableFuture<Void> firstConnected = new CompletableFuture<>();

    public static DaemonSession create(HostConfig config, HostWindow window) {
        var loop = new EventLoop("DaemonControl");
        var verification =
                config.manageDaemonLifetime() ? PeerVerification.LOCAL_SELF_ISSUED : PeerVerification.STRICT;
        var connector = new WebSocketChannelConnector(loop, new EnvelopeCodec(), verification);
        var os = HostOs.current();
        var processes = new ProcessSupervisor(
                config.daemonLocator(os), os, config.bootstrapTimeout(), config.terminationGrace());
        return new DaemonSession(config, window, loop, connector, processes);
    }

    public DaemonSession(
            HostConfig config,
            HostWindow window,
            EventLoop loop,
            ChannelConnector connector,
            DaemonProcessControl processControl) {
        this.config = config;
        this.loop = loop;
        this.processControl = processControl;
        this.manageDaemonLifetime = config.manageDaemonLifetime();
        this.broker = new CorrelationBroker(loop, config.serviceName(), config.requestTimeout());
        this.connection = new ConnectionSupervisor(
                loop, connector, broker, config.daemonUri(), config.retryDelay(), config.troubleThreshold());
        this.shutdown = new ShutdownCoordinator(
                loop, window, broker, connection, processControl, manageDaemonLifetime, config.exitAckTimeout());
        connection.addListener(new ConnectionStateListener() {
            @Override
            public void onStateChanged(ConnectionState previous, ConnectionState current) {
                if (current == ConnectionState.CONNECTED) {
                    registerService();
                }
            }
        });
    }

    /**
     * Spawns the daemon when this host manages it (otherwise uses the configured credential) and
     * starts connecting. Completes once the daemon is running; fails with
     * {@link dev.plotkeeper.daemon.process.BootstrapFailedException} if it could not be started.
     */
    public CompletableFuture<Void> start() {
        if (!manageDaemonLifetime) {
            logger.info("Connecting to externally managed daemon at {}", connection.endpoint());
            connection.connect(config.configuredCredential());
            return CompletableFuture.completedFuture(null);
        }
        var spawn = processControl.spawn();
        shutdown.daemonStarting(spawn);
        return spawn.thenAccept(this::daemonReady);
    }

    private void daemonReady(DaemonProcessHandle handle) {
        var shutdownState = shutdown.state();
        if (shutdownState == ShutdownState.SHUTTING_DOWN || shutdownState == ShutdownState.TERMINATED) {
            logger.info("Daemon (pid {}) came up during shutdown; not connecting", handle.pid());
            return;
        }
        logger.info("Daemon running (pid {}); connecting to {}", handle.pid(), connection.endpoint());
        connection.connect(handle.credential());
    }

    private void registerService() {
        var payload = Json.object().put("service", broker.origin());
        broker.send("register_service", payload).whenComplete((reply, err) -> {
            if (err != null) {
                logger.warn("Could not register as {}: {}", broker.origin(), err.getMessage());
                return;
            }
            logger.info("Registered with the daemon as {}", broker.origin());
            firstConnected.complete(null);
        });
    }

    /** Completes the first time the session is connected and registered with the daemon. */
    public CompletableFuture<Void> awaitRegistered() {
        return firstConnected;
    }

    public CorrelationBroker broker() {
        return broker;
    }

    public ConnectionSupervisor connection() {
        return connection;
    }

    public ShutdownCoordinator shutdown() {
        return shutdown;
    }

    public EventLoop loop() {
        return loop;
    }

    /** Runs the shutdown sequence without confirmation, waits up to {@code timeout}, then stops the loop. */
    public void close(Duration timeout) {
        try {
            shutdown.shutdownNow().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while shutting down");
        } catch (Exception e) {
            logger.warn("Shutdown did not finish cleanly", e);
        } finally {
            loop.close();
        }
    }

    @Override
    public void close() {
        close(config.exitAckTimeout().plus(config.terminationGrace()).plusSeconds(10));
    }
}
