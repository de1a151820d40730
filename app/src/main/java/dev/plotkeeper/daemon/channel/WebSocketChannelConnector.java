package dev.plotkeeper.daemon.channel;

import dev.plotkeeper.daemon.ChannelClosedException;
import dev.plotkeeper.daemon.ConnectionFailedException;
import dev.plotkeeper.daemon.EventLoop;
import dev.plotkeeper.daemon.process.BootstrapCredential;
import dev.plotkeeper.daemon.wire.DecodeResult;
import dev.plotkeeper.daemon.wire.Envelope;
import dev.plotkeeper.daemon.wire.EnvelopeCodec;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import okio.ByteString;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.jspecify.annotations.NullMarked;

/**
 * Control channels over OkHttp WebSockets. {@code wss://} endpoints require a credential and use
 * mutual TLS; plain {@code ws://} is accepted only without one.
 */
@NullMarked
public final class WebSocketChannelConnector implements ChannelConnector {
    private static final Logger logger = LogManager.getLogger(WebSocketChannelConnector.class);

    /** The daemon pings at the same cadence. */
    public static final Duration PING_INTERVAL = Duration.ofSeconds(30);

    public static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

    /** Upper bound for connecting plus the HTTP upgrade; reads on an open channel are unbounded. */
    public static final Duration HANDSHAKE_TIMEOUT = Duration.ofSeconds(20);

    /** How long an orderly close may take before the socket is cancelled. */
    static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(1);

    // OkHttp rejects close reasons longer than 123 UTF-8 bytes
    private static final int MAX_CLOSE_REASON = 120;

    private final EventLoop loop;
    private final EnvelopeCodec codec;
    private final PeerVerification verification;
    private final OkHttpClient baseClient;
    private final Duration handshakeTimeout;

    public WebSocketChannelConnector(EventLoop loop, EnvelopeCodec codec, PeerVerification verification) {
        this(loop, codec, verification, defaultClient(), HANDSHAKE_TIMEOUT);
    }

    public WebSocketChannelConnector(
            EventLoop loop, EnvelopeCodec codec, PeerVerification verification, Duration handshakeTimeout) {
        this(loop, codec, verification, defaultClient(), handshakeTimeout);
    }

    public WebSocketChannelConnector(
            EventLoop loop,
            EnvelopeCodec codec,
            PeerVerification verification,
            OkHttpClient baseClient,
            Duration handshakeTimeout) {
        this.loop = loop;
        this.codec = codec;
        this.verification = verification;
        this.baseClient = baseClient;
        this.handshakeTimeout = handshakeTimeout;
    }

    private static OkHttpClient defaultClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(CONNECT_TIMEOUT)
                .readTimeout(Duration.ZERO)
                .pingInterval(PING_INTERVAL)
                .build();
    }

    @Override
    public CompletableFuture<ControlChannel> open(
            URI uri, @Nullable BootstrapCredential credential, ChannelListener listener) {
        var opened = new CompletableFuture<ControlChannel>();
        OkHttpClient client;
        try {
            client = clientFor(uri, credential);
        } catch (IOException | GeneralSecurityException e) {
            opened.completeExceptionally(new ConnectionFailedException(
                    ConnectionFailedException.Kind.REFUSED, "Cannot load TLS material for " + uri + ": " + e, e));
            return opened;
        }

        var channel = new WebSocketControlChannel(uri, listener, opened);
        var request = new Request.Builder().url(uri.toString()).build();
        logger.debug("Opening control channel to {}", uri);
        var socket = client.newWebSocket(request, channel);
        channel.socket = socket;
        var deadline = loop.schedule(
                () -> {
                    if (opened.completeExceptionally(new ConnectionFailedException(
                            ConnectionFailedException.Kind.REFUSED,
                            "No WebSocket handshake from " + uri + " within " + handshakeTimeout.toMillis() + " ms"))) {
                        logger.debug("Handshake with {} timed out; cancelling", uri);
                        socket.cancel();
                    }
                },
                handshakeTimeout);
        if (deadline != null) {
            opened.whenComplete((c, err) -> deadline.cancel(false));
        }
        return opened;
    }

    private OkHttpClient clientFor(URI uri, @Nullable BootstrapCredential credential)
            throws IOException, GeneralSecurityException {
        String scheme = uri.getScheme();
        String host = uri.getHost();
        if (host == null) {
            throw new IllegalArgumentException("Control endpoint has no host: " + uri);
        }
        if ("ws".equalsIgnoreCase(scheme)) {
            if (credential != null) {
                throw new IllegalArgumentException("Refusing to send client credentials over plain ws:// to " + uri);
            }
            return baseClient;
        }
        if (!"wss".equalsIgnoreCase(scheme)) {
            throw new IllegalArgumentException("Unsupported control endpoint scheme: " + uri);
        }
        if (credential == null) {
            throw new IllegalArgumentException("A client certificate is required for " + uri);
        }
        return ChannelTls.configure(baseClient, credential, host, verification);
    }

    private final class WebSocketControlChannel extends WebSocketListener implements ControlChannel {
        private final URI endpoint;
        private final ChannelListener listener;
        private final CompletableFuture<ControlChannel> opened;
        private final AtomicBoolean closed = new AtomicBoolean();
        private volatile boolean handshakeDone;
        private volatile boolean open;
        private volatile @Nullable WebSocket socket;

        WebSocketControlChannel(URI endpoint, ChannelListener listener, CompletableFuture<ControlChannel> opened) {
            this.endpoint = endpoint;
            this.listener = listener;
            this.opened = opened;
        }

        @Override
        public URI endpoint() {
            return endpoint;
        }

        @Override
        public boolean isOpen() {
            return open;
        }

        @Override
        public void send(Envelope envelope) {
            var ws = socket;
            if (!open || ws == null) {
                throw new ChannelClosedException("Control channel to " + endpoint + " is closed");
            }
            if (!ws.send(codec.encode(envelope))) {
                open = false;
                throw new ChannelClosedException("Control channel to " + endpoint + " is closing");
            }
        }

        @Override
        public void close(String reason) {
            open = false;
            var ws = socket;
            if (ws == null || closed.get()) {
                return;
            }
            logger.debug("Closing control channel to {}: {}", endpoint, reason);
            ws.close(CloseReason.NORMAL_CLOSURE, truncate(reason));
            loop.schedule(
                    () -> {
                        if (!closed.get()) {
                            logger.debug("Close handshake with {} timed out; cancelling", endpoint);
                            ws.cancel();
                        }
                    },
                    CLOSE_TIMEOUT);
        }

        @Override
        public void onOpen(WebSocket webSocket, Response response) {
            socket = webSocket;
            handshakeDone = true;
            open = true;
            loop.execute(() -> {
                logger.info("Control channel open to {}", endpoint);
                if (!opened.complete(this)) {
                    webSocket.cancel();
                }
            });
        }

        @Override
        public void onMessage(WebSocket webSocket, String text) {
            loop.execute(() -> deliver(text));
        }

        @Override
        public void onMessage(WebSocket webSocket, ByteString bytes) {
            String text = bytes.string(StandardCharsets.UTF_8);
            loop.execute(() -> deliver(text));
        }

        private void deliver(String text) {
            if (closed.get()) {
                logger.debug("Frame from {} arrived after close; dropping", endpoint);
                return;
            }
            var result = codec.decode(text);
            if (result instanceof DecodeResult.Decoded decoded) {
                listener.onMessage(decoded.envelope());
            } else {
                var malformed = (DecodeResult.Malformed) result;
                logger.warn("Malformed frame from {}: {}", endpoint, malformed.reason());
                listener.onMalformed(malformed);
            }
        }

        @Override
        public void onClosing(WebSocket webSocket, int code, String reason) {
            open = false;
            webSocket.close(CloseReason.NORMAL_CLOSURE, null);
        }

        @Override
        public void onClosed(WebSocket webSocket, int code, String reason) {
            finish(CloseReason.closed(code, reason));
        }

        @Override
        public void onFailure(WebSocket webSocket, Throwable t, @Nullable Response response) {
            open = false;
            if (!handshakeDone) {
                String detail = response == null ? String.valueOf(t.getMessage()) : "HTTP " + response.code();
                var failure = new ConnectionFailedException(
                        ConnectionFailedException.Kind.REFUSED, "Cannot connect to " + endpoint + ": " + detail, t);
                loop.execute(() -> opened.completeExceptionally(failure));
                return;
            }
            finish(CloseReason.failed(new ConnectionFailedException(
                    ConnectionFailedException.Kind.RESET, "Control channel to " + endpoint + " failed", t)));
        }

        private void finish(CloseReason reason) {
            open = false;
            if (closed.compareAndSet(false, true)) {
                loop.execute(() -> {
                    logger.info("Control channel to {} closed ({})", endpoint, reason);
                    listener.onClose(reason);
                });
            }
        }
    }

    private static String truncate(String reason) {
        if (reason.getBytes(StandardCharsets.UTF_8).length <= MAX_CLOSE_REASON) {
            return reason;
        }
        return reason.substring(0, Math.min(reason.length(), MAX_CLOSE_REASON / 4));
    }
}
