package dev.plotkeeper.daemon.broker;

import com.fasterxml.jackson.databind.JsonNode;
import dev.plotkeeper.daemon.ChannelClosedException;
import dev.plotkeeper.daemon.DaemonCommandException;
import dev.plotkeeper.daemon.EventLoop;
import dev.plotkeeper.daemon.MalformedEnvelopeException;
import dev.plotkeeper.daemon.RequestTimeoutException;
import dev.plotkeeper.daemon.channel.ControlChannel;
import dev.plotkeeper.daemon.wire.DecodeResult;
import dev.plotkeeper.daemon.wire.Envelope;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.jspecify.annotations.NullMarked;

/**
 * Turns the message-oriented control channel into request/response calls.
 *
 * <p>Every outgoing request gets a fresh random {@code request_id} and a future that completes
 * exactly once: with the daemon's reply payload, with {@link RequestTimeoutException}, or with
 * {@link ChannelClosedException} when the channel goes away first. Replies are matched by id, so
 * their arrival order does not matter. Non-ack envelopes from the daemon are handed to the
 * registered {@link DaemonEventListener}s.
 *
 * <p>All bookkeeping happens on the {@link EventLoop}; the public methods may be called from any
 * thread.
 */
@NullMarked
public final class CorrelationBroker {
    private static final Logger logger = LogManager.getLogger(CorrelationBroker.class);

    public static final String DAEMON_DESTINATION = "daemon";

    private final EventLoop loop;
    private final String origin;
    private final Duration defaultTimeout;
    private final CorrelationIds ids;
    private final Map<String, PendingRequest> pending = new HashMap<>();
    private final List<DaemonEventListener> listeners = new CopyOnWriteArrayList<>();
    private volatile @Nullable ControlChannel channel;

    public CorrelationBroker(EventLoop loop, String origin, Duration defaultTimeout) {
        this(loop, origin, defaultTimeout, new CorrelationIds());
    }

    CorrelationBroker(EventLoop loop, String origin, Duration defaultTimeout, CorrelationIds ids) {
        if (defaultTimeout.isNegative() || defaultTimeout.isZero()) {
            throw new IllegalArgumentException("defaultTimeout must be positive");
        }
        this.loop = loop;
        this.origin = origin;
        this.defaultTimeout = defaultTimeout;
        this.ids = ids;
    }

    public String origin() {
        return origin;
    }

    public CompletableFuture<JsonNode> send(String command, JsonNode payload) {
        return send(DAEMON_DESTINATION, command, payload, defaultTimeout);
    }

    public CompletableFuture<JsonNode> send(String destination, String command, JsonNode payload) {
        return send(destination, command, payload, defaultTimeout);
    }

    /**
     * Sends one request. While no channel is attached the returned future is already failed with
     * {@link ChannelClosedException} and nothing is written.
     */
    public CompletableFuture<JsonNode> send(String destination, String command, JsonNode payload, Duration timeout) {
        var result = new CompletableFuture<JsonNode>();
        if (channel == null) {
            result.completeExceptionally(
                    new ChannelClosedException("Not connected to the daemon; '" + command + "' was not sent"));
            return result;
        }
        loop.run(() -> dispatch(destination, command, payload, timeout, result));
        return result;
    }

    /**
     * Like {@link #send(String, JsonNode)}, but a reply carrying {@code success: false} fails the
     * future with {@link DaemonCommandException}.
     */
    public CompletableFuture<JsonNode> sendChecked(String command, JsonNode payload) {
        return sendChecked(DAEMON_DESTINATION, command, payload, defaultTimeout);
    }

    public CompletableFuture<JsonNode> sendChecked(
            String destination, String command, JsonNode payload, Duration timeout) {
        return send(destination, command, payload, timeout).thenApply(reply -> {
            JsonNode success = reply.get("success");
            if (success != null && success.isBoolean() && !success.booleanValue()) {
                throw new DaemonCommandException(command, reply.path("error").asText("unknown error"));
            }
            return reply;
        });
    }

    private void dispatch(
            String destination,
            String command,
            JsonNode payload,
            Duration timeout,
            CompletableFuture<JsonNode> result) {
        var current = channel;
        if (current == null) {
            result.completeExceptionally(
                    new ChannelClosedException("Not connected to the daemon; '" + command + "' was not sent"));
            return;
        }

        String requestId = ids.next(pending::containsKey);
        var request = new PendingRequest(requestId, command, Instant.now(), result);
        pending.put(requestId, request);
        request.setTimeoutHandle(loop.schedule(() -> expire(requestId, timeout), timeout));

        try {
            current.send(Envelope.request(command, origin, destination, requestId, payload));
            logger.debug("-> {} {} ({})", destination, command, requestId);
        } catch (ChannelClosedException e) {
            pending.remove(requestId);
            request.reject(e);
        }
    }

    private void expire(String requestId, Duration timeout) {
        var request = pending.remove(requestId);
        if (request == null) {
            return;
        }
        logger.warn("Request '{}' ({}) timed out after {} ms", request.command(), requestId, timeout.toMillis());
        request.reject(new RequestTimeoutException(request.command(), requestId, timeout));
    }

    /** Routes one decoded inbound envelope. Must be called on the event loop. */
    public void onEnvelope(Envelope envelope) {
        if (!envelope.ack()) {
            publish(envelope);
            return;
        }
        var request = pending.remove(envelope.requestId());
        if (request == null) {
            logger.warn(
                    "Dropping reply to '{}' with unknown request_id '{}'", envelope.command(), envelope.requestId());
            return;
        }
        logger.debug(
                "<- {} {} ({}) after {} ms",
                envelope.origin(),
                envelope.command(),
                envelope.requestId(),
                Duration.between(request.createdAt(), Instant.now()).toMillis());
        if (!request.resolve(envelope.data())) {
            logger.debug("Reply to abandoned request {} dropped", envelope.requestId());
        }
    }

    /** Handles a frame that failed to decode. Must be called on the event loop. */
    public void onMalformed(DecodeResult.Malformed malformed) {
        String requestId = malformed.requestId();
        var request = requestId == null ? null : pending.remove(requestId);
        if (request == null) {
            logger.warn("Dropping malformed frame: {}", malformed.reason());
            return;
        }
        logger.warn("Malformed reply to '{}' ({}): {}", request.command(), requestId, malformed.reason());
        request.reject(new MalformedEnvelopeException(
                "Malformed reply to '" + request.command() + "': " + malformed.reason()));
    }

    private void publish(Envelope envelope) {
        if (listeners.isEmpty()) {
            logger.debug("No listener for daemon event '{}' from {}", envelope.command(), envelope.origin());
            return;
        }
        for (var listener : listeners) {
            try {
                listener.onEvent(envelope);
            } catch (RuntimeException e) {
                logger.error("Event listener failed on '{}'", envelope.command(), e);
            }
        }
    }

    /** Starts routing requests through {@code newChannel}. Must be called on the event loop. */
    public void attach(ControlChannel newChannel) {
        channel = newChannel;
        logger.debug("Attached to {}", newChannel.endpoint());
    }

    /** Stops using the channel and fails every outstanding request. Must be called on the event loop. */
    public void detach(String reason) {
        channel = null;
        if (pending.isEmpty()) {
            return;
        }
        var outstanding = new ArrayList<>(pending.values());
        pending.clear();
        logger.info("Channel detached ({}); failing {} outstanding request(s)", reason, outstanding.size());
        for (var request : outstanding) {
            request.reject(new ChannelClosedException(
                    "Channel closed before '" + request.command() + "' was answered: " + reason));
        }
    }

    public boolean isAttached() {
        return channel != null;
    }

    /** Number of requests still waiting; only meaningful on the event loop. */
    public int pendingCount() {
        return pending.size();
    }

    public void addEventListener(DaemonEventListener listener) {
        listeners.add(listener);
    }

    public void removeEventListener(DaemonEventListener listener) {
        listeners.remove(listener);
    }
}
