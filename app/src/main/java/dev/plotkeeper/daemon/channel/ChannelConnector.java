package dev.plotkeeper.daemon.channel;

import dev.plotkeeper.daemon.process.BootstrapCredential;
import java.net.URI;
import java.util.concurrent.CompletableFuture;
import org.jetbrains.annotations.Nullable;

/** Opens control channels. One call per connection attempt. */
public interface ChannelConnector {
    /**
     * Connects to {@code uri}. The future completes on the event loop once the handshake is done,
     * or fails with {@link dev.plotkeeper.daemon.ConnectionFailedException}. {@code listener} only
     * hears from the channel after the future has completed successfully.
     */
    CompletableFuture<ControlChannel> open(URI uri, @Nullable BootstrapCredential credential, ChannelListener listener);
}
