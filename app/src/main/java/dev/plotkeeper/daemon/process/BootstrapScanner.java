package dev.plotkeeper.daemon.process;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import dev.plotkeeper.util.Json;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Optional;
import java.util.function.Consumer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Finds the credential record in the daemon's startup output. The daemon prints free-form log
 * lines and, once its certificates are in place, one JSON line such as
 * {@code {"message": "cert_path", "success": true, "cert": "...", "key": "...", "ca_crt": "..."}}.
 */
public final class BootstrapScanner {
    private static final Logger logger = LogManager.getLogger(BootstrapScanner.class);

    private BootstrapScanner() {}

    /** Parses one output line; anything that is not a JSON object with string {@code cert} and {@code key} is ignored. */
    public static Optional<BootstrapCredential> parseLine(String line) {
        String trimmed = line.strip();
        if (!trimmed.startsWith("{")) {
            return Optional.empty();
        }
        JsonNode node;
        try {
            node = Json.readTree(trimmed);
        } catch (JsonProcessingException e) {
            logger.trace("Output line is not JSON: {}", trimmed);
            return Optional.empty();
        }
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        String cert = text(node, "cert");
        String key = text(node, "key");
        if (cert == null || key == null) {
            return Optional.empty();
        }
        String ca = text(node, "ca_crt");
        try {
            return Optional.of(new BootstrapCredential(Path.of(cert), Path.of(key), ca == null ? null : Path.of(ca)));
        } catch (InvalidPathException e) {
            logger.debug("Ignoring credential record with an unusable path: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Reads lines until the credential record shows up, passing each line read to {@code lineSink}.
     * Stops right after that line, leaving the rest of the stream unread.
     *
     * @return empty when the stream ends first
     */
    public static Optional<BootstrapCredential> scan(BufferedReader reader, Consumer<String> lineSink)
            throws IOException {
        String line;
        while ((line = reader.readLine()) != null) {
            lineSink.accept(line);
            var credential = parseLine(line);
            if (credential.isPresent()) {
                return credential;
            }
        }
        return Optional.empty();
    }

    private static @Nullable String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() && !value.asText().isBlank() ? value.asText() : null;
    }
}
