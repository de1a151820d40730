package dev.plotkeeper.daemon;

import java.time.Duration;

/** No reply arrived for one request before its deadline. */
public class RequestTimeoutException extends DaemonChannelException {
    private final String command;
    private final Duration timeout;

    public RequestTimeoutException(String command, String requestId, Duration timeout) {
        super("No reply to '" + command + "' (request_id " + requestId + ") within " + timeout.toMillis() + " ms");
        this.command = command;
        this.timeout = timeout;
    }

    public String getCommand() {
        return command;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
