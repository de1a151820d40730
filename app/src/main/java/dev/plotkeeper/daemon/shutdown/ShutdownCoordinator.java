package dev.plotkeeper.daemon.shutdown;

import dev.plotkeeper.daemon.EventLoop;
import dev.plotkeeper.daemon.broker.CorrelationBroker;
import dev.plotkeeper.daemon.connection.ConnectionSupervisor;
import dev.plotkeeper.daemon.process.DaemonProcessControl;
import dev.plotkeeper.daemon.process.DaemonProcessHandle;
import dev.plotkeeper.util.Json;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.jspecify.annotations.NullMarked;

/**
 * Runs the close sequence of the host window so that it never disappears while the daemon may
 * still be writing to disk.
 *
 * <p>A close request asks the user for confirmation. Once confirmed: the window switches to its
 * closing presentation, {@code exit} is sent to the daemon and its acknowledgement awaited for at
 * most {@code exitAckTimeout}, the control connection is closed, the daemon process is terminated
 * (forcibly if it lingers), and only then is the window closed. A daemon that is still starting
 * when shutdown begins is waited for and then terminated. When the host does not manage the
 * daemon's lifetime the window closes right away.
 */
@NullMarked
public final class ShutdownCoordinator {
    private static final Logger logger = LogManager.getLogger(ShutdownCoordinator.class);

    public static final Duration DEFAULT_EXIT_ACK_TIMEOUT = Duration.ofMillis(15_000);

    /** Upper bound for the connection close handshake during shutdown. */
    static final Duration CONNECTION_CLOSE_WAIT = Duration.ofSeconds(2);

    private final EventLoop loop;
    private final HostWindow window;
    private final CorrelationBroker broker;
    private final ConnectionSupervisor connection;
    private final DaemonProcessControl processControl;
    private final boolean manageDaemonLifetime;
    private final Duration exitAckTimeout;
    private final CompletableFuture<Void> terminated = new CompletableFuture<>();

    private ShutdownState state = ShutdownState.RUNNING;
    private volatile ShutdownState publishedState = ShutdownState.RUNNING;
    private volatile @Nullable CompletableFuture<DaemonProcessHandle> daemon;

    public ShutdownCoordinator(
            EventLoop loop,
            HostWindow window,
            CorrelationBroker broker,
            ConnectionSupervisor connection,
            DaemonProcessControl processControl,
            boolean manageDaemonLifetime,
            Duration exitAckTimeout) {
        this.loop = loop;
        this.window = window;
        this.broker = broker;
        this.connection = connection;
        this.processControl = processControl;
        this.manageDaemonLifetime = manageDaemonLifetime;
        this.exitAckTimeout = exitAckTimeout;
    }

    public ShutdownState state() {
        return publishedState;
    }

    /**
     * Records a daemon that is being spawned. Shutdown waits for {@code spawn} to settle and then
     * terminates the process it produced; the spawn itself is bounded by the bootstrap timeout.
     */
    public void daemonStarting(CompletableFuture<DaemonProcessHandle> spawn) {
        daemon = spawn;
    }

    /** Records an already running daemon so shutdown can terminate it. */
    public void daemonStarted(DaemonProcessHandle handle) {
        daemon = CompletableFuture.completedFuture(handle);
    }

    /** The user asked to close the window. Ignored while a confirmation or shutdown is already underway. */
    public void requestClose() {
        loop.run(() -> {
            if (state != ShutdownState.RUNNING) {
                logger.debug("Close requested while {}; ignoring", state);
                return;
            }
            if (!manageDaemonLifetime) {
                closeWithoutDaemon();
                return;
            }
            transition(ShutdownState.CONFIRM_PENDING);
            CompletableFuture<Boolean> answer;
            try {
                answer = window.confirmExit();
            } catch (RuntimeException e) {
                answer = CompletableFuture.failedFuture(e);
            }
            answer.whenComplete((confirmed, err) -> loop.run(() -> onConfirmation(confirmed, err)));
        });
    }

    /** Shuts down without asking, e.g. when a headless run is done. */
    public CompletableFuture<Void> shutdownNow() {
        loop.run(() -> {
            if (state == ShutdownState.RUNNING || state == ShutdownState.CONFIRM_PENDING) {
                if (manageDaemonLifetime) {
                    beginShutdown();
                } else {
                    closeWithoutDaemon();
                }
            }
        });
        return terminated;
    }

    /** Completes once the window has been closed at the end of the sequence. */
    public CompletableFuture<Void> awaitTermination() {
        return terminated;
    }

    private void onConfirmation(@Nullable Boolean confirmed, @Nullable Throwable err) {
        if (state != ShutdownState.CONFIRM_PENDING) {
            return;
        }
        if (err != null) {
            logger.warn("Exit confirmation failed; staying open", err);
        }
        if (err != null || !Boolean.TRUE.equals(confirmed)) {
            transition(ShutdownState.RUNNING);
            return;
        }
        beginShutdown();
    }

    private void closeWithoutDaemon() {
        transition(ShutdownState.SHUTTING_DOWN);
        logger.info("Daemon is not managed by this host; closing without stopping it");
        window.close();
        connection.beginClose();
        finish();
    }

    private void beginShutdown() {
        transition(ShutdownState.SHUTTING_DOWN);
        window.showClosingPresentation();

        sendExit()
                .thenCompose(v -> connection
                        .beginClose()
                        .copy()
                        .completeOnTimeout(null, CONNECTION_CLOSE_WAIT.toMillis(), TimeUnit.MILLISECONDS))
                .thenCompose(v -> terminateDaemon())
                .whenComplete((v, err) -> loop.run(() -> {
                    if (err != null) {
                        logger.warn("Shutdown step failed; closing anyway", err);
                    }
                    window.close();
                    finish();
                }));
    }

    private CompletableFuture<Void> sendExit() {
        logger.info("Asking the daemon to exit");
        return broker.send(CorrelationBroker.DAEMON_DESTINATION, "exit", Json.object(), exitAckTimeout)
                .handle((reply, err) -> {
                    if (err != null) {
                        logger.warn("Daemon did not acknowledge exit: {}", unwrap(err).getMessage());
                    } else {
                        logger.info("Daemon acknowledged exit: {}", reply);
                    }
                    return null;
                });
    }

    private CompletableFuture<Void> terminateDaemon() {
        var spawn = daemon;
        if (spawn == null) {
            logger.info("No daemon process to stop");
            return CompletableFuture.completedFuture(null);
        }
        if (!spawn.isDone()) {
            logger.info("Daemon is still starting; waiting for it before stopping it");
        }
        return spawn.handle((handle, err) -> err == null ? handle : null).thenCompose(handle -> {
            if (handle == null) {
                logger.info("Daemon never finished starting; nothing to stop");
                return CompletableFuture.<Void>completedFuture(null);
            }
            return processControl.terminate(handle).exceptionally(err -> {
                logger.warn("Daemon termination failed", err);
                return null;
            });
        });
    }

    private void finish() {
        transition(ShutdownState.TERMINATED);
        terminated.complete(null);
    }

    private void transition(ShutdownState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal shutdown transition " + state + " -> " + next);
        }
        logger.info("Shutdown {} -> {}", state, next);
        state = next;
        publishedState = next;
    }

    private static Throwable unwrap(Throwable err) {
        return err instanceof CompletionException && err.getCause() != null ? err.getCause() : err;
    }
}
