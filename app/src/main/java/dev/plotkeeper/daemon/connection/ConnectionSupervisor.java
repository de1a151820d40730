package dev.plotkeeper.daemon.connection;

import dev.plotkeeper.daemon.EventLoop;
import dev.plotkeeper.daemon.broker.CorrelationBroker;
import dev.plotkeeper.daemon.channel.ChannelConnector;
import dev.plotkeeper.daemon.channel.ChannelListener;
import dev.plotkeeper.daemon.channel.CloseReason;
import dev.plotkeeper.daemon.channel.ControlChannel;
import dev.plotkeeper.daemon.process.BootstrapCredential;
import dev.plotkeeper.daemon.wire.DecodeResult;
import dev.plotkeeper.daemon.wire.Envelope;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledFuture;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.jspecify.annotations.NullMarked;

/**
 * Keeps one control channel to the daemon alive and owns its {@link ConnectionState}.
 *
 * <pre>
 * DISCONNECTED --connect--> CONNECTING --opened--> CONNECTED --dropped--> DISCONNECTED
 * CONNECTING --failed--> DISCONNECTED
 * CONNECTED --beginClose--> CLOSING --closed--> DISCONNECTED (terminal)
 * </pre>
 *
 * After a failure or drop the next attempt runs after a fixed delay; there is no backoff and no
 * attempt cap. At most one attempt is scheduled or in flight at a time. While CONNECTED the channel
 * is attached to the {@link CorrelationBroker}; leaving CONNECTED detaches it, which fails every
 * outstanding request.
 */
@NullMarked
public final class ConnectionSupervisor {
    private static final Logger logger = LogManager.getLogger(ConnectionSupervisor.class);

    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofMillis(300);
    public static final int DEFAULT_TROUBLE_THRESHOLD = 10;

    private final EventLoop loop;
    private final ChannelConnector connector;
    private final CorrelationBroker broker;
    private final URI endpoint;
    private final Duration retryDelay;
    private final int troubleThreshold;
    private final List<ConnectionStateListener> listeners = new CopyOnWriteArrayList<>();
    private final CompletableFuture<Void> closed = new CompletableFuture<>();

    // event-loop confined
    private ConnectionState state = ConnectionState.DISCONNECTED;
    private @Nullable BootstrapCredential credential;
    private boolean attemptPending;
    private @Nullable ScheduledFuture<?> retry;
    private @Nullable Attempt current;
    private boolean terminal;
    private int consecutiveFailures;
    private boolean troubleReported;

    private volatile ConnectionState publishedState = ConnectionState.DISCONNECTED;

    public ConnectionSupervisor(
            EventLoop loop,
            ChannelConnector connector,
            CorrelationBroker broker,
            URI endpoint,
            Duration retryDelay,
            int troubleThreshold) {
        if (troubleThreshold < 1) {
            throw new IllegalArgumentException("troubleThreshold must be at least 1");
        }
        this.loop = loop;
        this.connector = connector;
        this.broker = broker;
        this.endpoint = endpoint;
        this.retryDelay = retryDelay;
        this.troubleThreshold = troubleThreshold;
    }

    public ConnectionState state() {
        return publishedState;
    }

    public URI endpoint() {
        return endpoint;
    }

    public void addListener(ConnectionStateListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ConnectionStateListener listener) {
        listeners.remove(listener);
    }

    /**
     * Starts connecting with {@code newCredential} (null for a plain endpoint). A no-op while an
     * attempt is already pending or the channel is up.
     */
    public void connect(@Nullable BootstrapCredential newCredential) {
        loop.run(() -> {
            if (terminal) {
                logger.warn("connect() after close; ignoring");
                return;
            }
            credential = newCredential;
            if (state != ConnectionState.DISCONNECTED || attemptPending) {
                logger.debug("connect() while {} (attempt pending: {}); ignoring", state, attemptPending);
                return;
            }
            attempt();
        });
    }

    /**
     * Closes the channel for good. The returned future completes once the supervisor is
     * DISCONNECTED and will not reconnect.
     */
    public CompletableFuture<Void> beginClose() {
        loop.run(() -> {
            if (terminal) {
                return;
            }
            terminal = true;
            if (retry != null) {
                retry.cancel(false);
                retry = null;
                attemptPending = false;
            }
            switch (state) {
                case CONNECTED -> {
                    var attempt = current;
                    transition(ConnectionState.CLOSING, "closing");
                    if (attempt != null && attempt.channel != null) {
                        attempt.channel.close("host shutting down");
                    } else {
                        transition(ConnectionState.DISCONNECTED, "closed");
                        markClosed();
                    }
                }
                // the in-flight attempt sees the terminal flag when it finishes
                case CONNECTING -> logger.debug("Close requested while connecting");
                default -> markClosed();
            }
        });
        return closed;
    }

    private void attempt() {
        retry = null;
        attemptPending = true;
        var attempt = new Attempt();
        current = attempt;
        transition(ConnectionState.CONNECTING, "connect");

        CompletableFuture<ControlChannel> opening;
        try {
            opening = connector.open(endpoint, credential, attempt);
        } catch (RuntimeException e) {
            opening = CompletableFuture.failedFuture(e);
        }
        opening.whenComplete((channel, err) -> loop.run(() -> attempt.finished(channel, err)));
    }

    private void scheduleRetry() {
        if (terminal || attemptPending) {
            return;
        }
        attemptPending = true;
        retry = loop.schedule(
                () -> {
                    if (!terminal) {
                        attempt();
                    }
                },
                retryDelay);
        if (retry == null) {
            attemptPending = false;
        }
    }

    private void transition(ConnectionState next, String reason) {
        var previous = state;
        if (!previous.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal connection transition " + previous + " -> " + next);
        }
        state = next;
        publishedState = next;
        if (previous == ConnectionState.CONNECTED) {
            broker.detach(reason);
        }
        if (next == ConnectionState.CONNECTED) {
            var attempt = current;
            if (attempt != null && attempt.channel != null) {
                broker.attach(attempt.channel);
            }
        }
        logger.info("Daemon connection {} -> {} ({})", previous, next, reason);
        for (var listener : listeners) {
            try {
                listener.onStateChanged(previous, next);
            } catch (RuntimeException e) {
                logger.error("Connection listener failed on {} -> {}", previous, next, e);
            }
        }
    }

    private void markClosed() {
        logger.info("Daemon connection closed for good");
        closed.complete(null);
    }

    private void reportFailure(Throwable cause) {
        consecutiveFailures++;
        if (consecutiveFailures < troubleThreshold || troubleReported) {
            logger.debug("Connection attempt {} failed: {}", consecutiveFailures, cause.getMessage());
            return;
        }
        troubleReported = true;
        logger.warn("Still cannot reach the daemon at {} after {} attempts", endpoint, consecutiveFailures, cause);
        for (var listener : listeners) {
            try {
                listener.onConnectionTrouble(consecutiveFailures, cause);
            } catch (RuntimeException e) {
                logger.error("Connection listener failed on trouble report", e);
            }
        }
    }

    /** One connection attempt and, if it succeeds, the lifetime of its channel. */
    private final class Attempt implements ChannelListener {
        private @Nullable ControlChannel channel;

        void finished(@Nullable ControlChannel opened, @Nullable Throwable err) {
            if (current != this) {
                if (opened != null) {
                    opened.close("superseded");
                }
                return;
            }
            attemptPending = false;
            if (err != null || opened == null) {
                Throwable cause = err != null ? unwrap(err) : new IllegalStateException("connector returned no channel");
                transition(ConnectionState.DISCONNECTED, "attempt failed");
                if (terminal) {
                    markClosed();
                    return;
                }
                reportFailure(cause);
                scheduleRetry();
                return;
            }
            if (terminal) {
                opened.close("host shutting down");
                transition(ConnectionState.DISCONNECTED, "closed while connecting");
                markClosed();
                return;
            }
            channel = opened;
            consecutiveFailures = 0;
            troubleReported = false;
            transition(ConnectionState.CONNECTED, "opened");
        }

        @Override
        public void onMessage(Envelope envelope) {
            if (current == this) {
                broker.onEnvelope(envelope);
            }
        }

        @Override
        public void onMalformed(DecodeResult.Malformed malformed) {
            if (current == this) {
                broker.onMalformed(malformed);
            }
        }

        @Override
        public void onClose(CloseReason reason) {
            if (current != this || channel == null) {
                return;
            }
            channel = null;
            if (state == ConnectionState.CLOSING) {
                transition(ConnectionState.DISCONNECTED, "closed");
                markClosed();
                return;
            }
            if (state != ConnectionState.CONNECTED) {
                return;
            }
            if (reason.isFailure()) {
                logger.warn("Lost the daemon connection: {}", reason.reason());
            }
            transition(ConnectionState.DISCONNECTED, "channel closed: " + reason);
            if (terminal) {
                markClosed();
                return;
            }
            scheduleRetry();
        }
    }

    private static Throwable unwrap(Throwable err) {
        return err instanceof CompletionException && err.getCause() != null
                ? err.getCause()
                : err;
    }
}
