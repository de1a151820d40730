package dev.plotkeeper.daemon.channel;

import dev.plotkeeper.daemon.wire.DecodeResult;
import dev.plotkeeper.daemon.wire.Envelope;

/** Callbacks from a {@link ControlChannel}, always delivered on the event loop in arrival order. */
public interface ChannelListener {
    void onMessage(Envelope envelope);

    void onMalformed(DecodeResult.Malformed malformed);

    /** Called exactly once per opened channel. */
    void onClose(CloseReason reason);
}
