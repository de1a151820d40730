package dev.plotkeeper.daemon.wire;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.jetbrains.annotations.Nullable;

/**
 * One control-channel message. Requests carry {@code ack=false} and a caller-generated
 * {@code request_id}; the daemon answers with the same id, {@code ack=true} and origin and
 * destination swapped.
 */
@JsonPropertyOrder({"command", "ack", "origin", "destination", "request_id", "data"})
public record Envelope(
        @JsonProperty("command") String command,
        @JsonProperty("ack") boolean ack,
        @JsonProperty("origin") String origin,
        @JsonProperty("destination") String destination,
        @JsonProperty("request_id") String requestId,
        @JsonProperty("data") JsonNode data) {

    public Envelope {
        if (data == null || data.isNull() || data.isMissingNode()) {
            data = JsonNodeFactory.instance.objectNode();
        }
    }

    public static Envelope request(
            String command, String origin, String destination, String requestId, @Nullable JsonNode data) {
        return new Envelope(command, false, origin, destination, requestId, data);
    }

    /** The acknowledgement the daemon would send for this envelope. */
    public Envelope reply(@Nullable JsonNode replyData) {
        return new Envelope(command, true, destination, origin, requestId, replyData);
    }
}
