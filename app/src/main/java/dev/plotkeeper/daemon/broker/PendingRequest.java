package dev.plotkeeper.daemon.broker;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import org.jetbrains.annotations.Nullable;

/** A request waiting for its acknowledgement. Only touched on the event loop. */
final class PendingRequest {
    private final String requestId;
    private final String command;
    private final Instant createdAt;
    private final CompletableFuture<JsonNode> result;
    private @Nullable ScheduledFuture<?> timeoutHandle;

    PendingRequest(String requestId, String command, Instant createdAt, CompletableFuture<JsonNode> result) {
        this.requestId = requestId;
        this.command = command;
        this.createdAt = createdAt;
        this.result = result;
    }

    String requestId() {
        return requestId;
    }

    String command() {
        return command;
    }

    Instant createdAt() {
        return createdAt;
    }

    void setTimeoutHandle(@Nullable ScheduledFuture<?> timeoutHandle) {
        this.timeoutHandle = timeoutHandle;
    }

    /** @return false when the caller had already abandoned the future */
    boolean resolve(JsonNode payload) {
        cancelTimeout();
        return result.complete(payload);
    }

    boolean reject(Throwable cause) {
        cancelTimeout();
        return result.completeExceptionally(cause);
    }

    private void cancelTimeout() {
        if (timeoutHandle != null) {
            timeoutHandle.cancel(false);
            timeoutHandle = null;
        }
    }
}
