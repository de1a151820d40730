package dev.plotkeeper.daemon;

/** The control channel is not open, or closed while the request was outstanding. */
public class ChannelClosedException extends DaemonChannelException {
    public ChannelClosedException(String message) {
        super(message);
    }

    public ChannelClosedException(String message, Throwable cause) {
        super(message, cause);
    }
}
