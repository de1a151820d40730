package dev.plotkeeper.daemon.channel;

import dev.plotkeeper.daemon.ChannelClosedException;
import dev.plotkeeper.daemon.wire.Envelope;
import java.net.URI;

/** An open connection to the daemon's control endpoint. */
public interface ControlChannel {
    URI endpoint();

    boolean isOpen();

    /**
     * Writes one envelope.
     *
     * @throws ChannelClosedException if the channel is closing or closed; nothing is queued
     */
    void send(Envelope envelope);

    /** Starts an orderly close; {@link ChannelListener#onClose} follows once it completes. */
    void close(String reason);
}
