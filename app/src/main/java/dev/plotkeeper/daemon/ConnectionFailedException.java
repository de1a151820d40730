package dev.plotkeeper.daemon;

/** Transport-level failure of the control channel. */
public class ConnectionFailedException extends DaemonChannelException {
    public enum Kind {
        /** The connection could not be established. */
        REFUSED,
        /** An established connection failed. */
        RESET
    }

    private final Kind kind;

    public ConnectionFailedException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ConnectionFailedException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
