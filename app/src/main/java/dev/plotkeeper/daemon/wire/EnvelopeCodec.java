package dev.plotkeeper.daemon.wire;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import dev.plotkeeper.util.Json;
import org.jetbrains.annotations.Nullable;

/** Translates envelopes to and from the JSON text frames the daemon speaks. */
public final class EnvelopeCodec {
    public static final String FIELD_COMMAND = "command";
    public static final String FIELD_ACK = "ack";
    public static final String FIELD_ORIGIN = "origin";
    public static final String FIELD_DESTINATION = "destination";
    public static final String FIELD_REQUEST_ID = "request_id";
    public static final String FIELD_DATA = "data";

    public String encode(Envelope envelope) {
        return Json.toJson(envelope);
    }

    public DecodeResult decode(String frame) {
        JsonNode root;
        try {
            root = Json.readTree(frame);
        } catch (JsonProcessingException e) {
            return new DecodeResult.Malformed("invalid JSON: " + e.getOriginalMessage(), null);
        }
        if (root == null || !root.isObject()) {
            return new DecodeResult.Malformed("frame is not a JSON object", null);
        }

        JsonNode idNode = root.get(FIELD_REQUEST_ID);
        if (idNode != null && !idNode.isNull() && !idNode.isTextual()) {
            return new DecodeResult.Malformed("field 'request_id' is not a string", null);
        }
        String requestId = idNode == null || idNode.isNull() ? "" : idNode.asText();
        @Nullable String recoverableId = requestId.isEmpty() ? null : requestId;

        String command = requiredText(root, FIELD_COMMAND);
        String origin = requiredText(root, FIELD_ORIGIN);
        String destination = requiredText(root, FIELD_DESTINATION);
        if (command == null || origin == null || destination == null) {
            String missing = command == null ? FIELD_COMMAND : origin == null ? FIELD_ORIGIN : FIELD_DESTINATION;
            return new DecodeResult.Malformed("missing or non-string field '" + missing + "'", recoverableId);
        }

        JsonNode ackNode = root.get(FIELD_ACK);
        if (ackNode != null && !ackNode.isNull() && !ackNode.isBoolean()) {
            return new DecodeResult.Malformed("field 'ack' is not a boolean", recoverableId);
        }
        boolean ack = ackNode != null && ackNode.asBoolean(false);

        JsonNode data = root.get(FIELD_DATA);
        if (data != null && !data.isNull() && !data.isObject()) {
            return new DecodeResult.Malformed("field 'data' is not an object", recoverableId);
        }

        return new DecodeResult.Decoded(new Envelope(command, ack, origin, destination, requestId, data));
    }

    private static @Nullable String requiredText(JsonNode root, String field) {
        JsonNode node = root.get(field);
        return node != null && node.isTextual() ? node.asText() : null;
    }
}
