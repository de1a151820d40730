package dev.plotkeeper.daemon.process;

/** The daemon could not be started or never reported a usable credential. */
public class BootstrapFailedException extends Exception {
    public BootstrapFailedException(String message) {
        super(message);
    }

    public BootstrapFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
