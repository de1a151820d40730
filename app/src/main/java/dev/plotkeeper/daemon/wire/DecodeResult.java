package dev.plotkeeper.daemon.wire;

import org.jetbrains.annotations.Nullable;

/** Outcome of decoding one inbound frame. Decoding never throws. */
public sealed interface DecodeResult {

    record Decoded(Envelope envelope) implements DecodeResult {}

    /**
     * @param requestId the frame's {@code request_id} when it could still be read, so the
     *     matching request can be failed instead of waiting for its timeout
     */
    record Malformed(String reason, @Nullable String requestId) implements DecodeResult {}
}
