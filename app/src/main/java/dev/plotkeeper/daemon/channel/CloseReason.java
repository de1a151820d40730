package dev.plotkeeper.daemon.channel;

import org.jetbrains.annotations.Nullable;

/** Why a channel closed: a close handshake ({@code cause == null}) or a transport failure. */
public record CloseReason(int code, String reason, @Nullable Throwable cause) {
    public static final int NORMAL_CLOSURE = 1000;
    public static final int ABNORMAL_CLOSURE = 1006;

    public static CloseReason closed(int code, String reason) {
        return new CloseReason(code, reason, null);
    }

    public static CloseReason failed(Throwable cause) {
        return new CloseReason(ABNORMAL_CLOSURE, String.valueOf(cause.getMessage()), cause);
    }

    public boolean isFailure() {
        return cause != null;
    }

    @Override
    public String toString() {
        return cause == null ? code + " " + reason : "failure: " + reason;
    }
}
