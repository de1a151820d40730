package dev.plotkeeper.daemon;

/**
 * Base type for failures on the daemon control channel. These are delivered asynchronously
 * through request futures and connection callbacks, so they are unchecked.
 */
public class DaemonChannelException extends RuntimeException {
    public DaemonChannelException(String message) {
        super(message);
    }

    public DaemonChannelException(String message, Throwable cause) {
        super(message, cause);
    }
}
