package dev.plotkeeper.daemon;

/** The daemon acknowledged a command but reported {@code success: false}. */
public class DaemonCommandException extends DaemonChannelException {
    private final String command;
    private final String error;

    public DaemonCommandException(String command, String error) {
        super("Daemon command '" + command + "' failed: " + error);
        this.command = command;
        this.error = error;
    }

    public String getCommand() {
        return command;
    }

    public String getError() {
        return error;
    }
}
