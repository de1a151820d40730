package dev.plotkeeper.config;

import dev.plotkeeper.daemon.process.BootstrapCredential;
import dev.plotkeeper.daemon.process.DeploymentLocator;
import dev.plotkeeper.daemon.process.HostOs;
import dev.plotkeeper.daemon.process.PackagingMode;
import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.jspecify.annotations.NullMarked;

/**
 * Host settings. Each key is looked up, in order, as the system property {@code plotkeeper.<key>},
 * the environment variable {@code PLOTKEEPER_<KEY>} (upper case, dots as underscores), the entry in
 * {@code plotkeeper.properties}, and finally the built-in default.
 */
@NullMarked
public final class HostConfig {
    private static final Logger logger = LogManager.getLogger(HostConfig.class);

    public static final String DAEMON_HOST = "daemon.host";
    public static final String DAEMON_PORT = "daemon.port";
    public static final String DAEMON_SCHEME = "daemon.scheme";
    public static final String DAEMON_MANAGE_LIFETIME = "daemon.manageLifetime";
    public static final String DAEMON_PACKAGING = "daemon.packaging";
    public static final String DAEMON_INSTALL_DIR = "daemon.installDir";
    public static final String DAEMON_SOURCE_ROOT = "daemon.sourceRoot";
    public static final String DAEMON_ENTRY_SCRIPT = "daemon.entryScript";
    public static final String DAEMON_INTERPRETER = "daemon.interpreter";
    public static final String DAEMON_EXECUTABLE_NAME = "daemon.executableName";
    public static final String DAEMON_CERT_PATH = "daemon.certPath";
    public static final String DAEMON_KEY_PATH = "daemon.keyPath";
    public static final String DAEMON_CA_CERT_PATH = "daemon.caCertPath";
    public static final String SERVICE_NAME = "service.name";
    public static final String CONNECTION_RETRY_DELAY_MS = "connection.retryDelayMs";
    public static final String CONNECTION_TROUBLE_THRESHOLD = "connection.troubleThreshold";
    public static final String REQUEST_TIMEOUT_MS = "request.timeoutMs";
    public static final String SHUTDOWN_EXIT_ACK_TIMEOUT_MS = "shutdown.exitAckTimeoutMs";
    public static final String BOOTSTRAP_TIMEOUT_MS = "bootstrap.timeoutMs";
    public static final String TERMINATION_GRACE_MS = "termination.graceMs";

    public static final int DEFAULT_PORT = 55400;
    public static final String DEFAULT_SERVICE_NAME = "wallet_ui";
    public static final String DEFAULT_ENTRY_SCRIPT = "chia/daemon/server.py";
    public static final String DEFAULT_EXECUTABLE_NAME = "daemon";

    static final long MIN_EXIT_ACK_TIMEOUT_MS = 15_000;
    static final long MAX_EXIT_ACK_TIMEOUT_MS = 20_000;

    private static final String SYSTEM_PROPERTY_PREFIX = "plotkeeper.";
    private static final String ENV_PREFIX = "PLOTKEEPER_";

    private final Properties file;
    private final Map<String, String> env;
    private final Properties system;

    HostConfig(Properties file, Map<String, String> env, Properties system) {
        this.file = file;
        this.env = Map.copyOf(env);
        this.system = system;
    }

    /** Reads {@code plotkeeper.properties} from {@code paths}; a missing file means all defaults. */
    public static HostConfig load(HostConfigPaths paths) throws IOException {
        var props = new Properties();
        Path path = paths.getConfigFile();
        if (Files.exists(path)) {
            try (var reader = Files.newBufferedReader(path)) {
                props.load(reader);
            }
            logger.info("Loaded settings from {}", path);
        } else {
            logger.debug("No settings file at {}; using defaults", path);
        }
        return new HostConfig(props, System.getenv(), System.getProperties());
    }

    public static HostConfig of(Properties file, Map<String, String> env, Properties system) {
        return new HostConfig(file, env, system);
    }

    static String envName(String key) {
        return ENV_PREFIX + key.replace('.', '_').toUpperCase(Locale.ROOT);
    }

    public @Nullable String get(String key) {
        String value = system.getProperty(SYSTEM_PROPERTY_PREFIX + key);
        if (value != null && !value.isBlank()) {
            return value.trim();
        }
        value = env.get(envName(key));
        if (value != null && !value.isBlank()) {
            return value.trim();
        }
        value = file.getProperty(key);
        if (value != null && !value.isBlank()) {
            return value.trim();
        }
        return null;
    }

    public String get(String key, String defaultValue) {
        var value = get(key);
        return value == null ? defaultValue : value;
    }

    private long getLong(String key, long defaultValue) {
        var value = get(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Setting " + key + " must be a number, got '" + value + "'", e);
        }
    }

    private Duration getMillis(String key, long defaultMillis) {
        long millis = getLong(key, defaultMillis);
        if (millis <= 0) {
            throw new IllegalArgumentException("Setting " + key + " must be positive, got " + millis);
        }
        return Duration.ofMillis(millis);
    }

    private @Nullable Path getPath(String key) {
        var value = get(key);
        return value == null ? null : Path.of(value);
    }

    public String daemonHost() {
        return get(DAEMON_HOST, "localhost");
    }

    public int daemonPort() {
        long port = getLong(DAEMON_PORT, DEFAULT_PORT);
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("Setting " + DAEMON_PORT + " is out of range: " + port);
        }
        return (int) port;
    }

    public URI daemonUri() {
        String scheme = get(DAEMON_SCHEME, "wss").toLowerCase(Locale.ROOT);
        String host = daemonHost();
        if (host.contains(":") && !host.startsWith("[")) {
            host = "[" + host + "]";
        }
        return URI.create(scheme + "://" + host + ":" + daemonPort());
    }

    public boolean manageDaemonLifetime() {
        return Boolean.parseBoolean(get(DAEMON_MANAGE_LIFETIME, "true"));
    }

    public PackagingMode packagingMode() {
        return PackagingMode.parse(get(DAEMON_PACKAGING, "auto"));
    }

    public Path installDir() {
        var configured = getPath(DAEMON_INSTALL_DIR);
        return configured != null ? configured : Path.of(System.getProperty("user.dir"));
    }

    public Path sourceRoot() {
        var configured = getPath(DAEMON_SOURCE_ROOT);
        return configured != null ? configured : Path.of(System.getProperty("user.dir"));
    }

    public String serviceName() {
        return get(SERVICE_NAME, DEFAULT_SERVICE_NAME);
    }

    public Duration retryDelay() {
        return getMillis(CONNECTION_RETRY_DELAY_MS, 300);
    }

    public int troubleThreshold() {
        return (int) Math.max(1, getLong(CONNECTION_TROUBLE_THRESHOLD, 10));
    }

    public Duration requestTimeout() {
        return getMillis(REQUEST_TIMEOUT_MS, 30_000);
    }

    /** Clamped into 15–20 seconds. */
    public Duration exitAckTimeout() {
        long millis = getLong(SHUTDOWN_EXIT_ACK_TIMEOUT_MS, MIN_EXIT_ACK_TIMEOUT_MS);
        long clamped = Math.max(MIN_EXIT_ACK_TIMEOUT_MS, Math.min(MAX_EXIT_ACK_TIMEOUT_MS, millis));
        if (clamped != millis) {
            logger.warn("{}={} is outside {}..{}; using {}", SHUTDOWN_EXIT_ACK_TIMEOUT_MS, millis,
                    MIN_EXIT_ACK_TIMEOUT_MS, MAX_EXIT_ACK_TIMEOUT_MS, clamped);
        }
        return Duration.ofMillis(clamped);
    }

    public Duration bootstrapTimeout() {
        return getMillis(BOOTSTRAP_TIMEOUT_MS, 60_000);
    }

    public Duration terminationGrace() {
        return getMillis(TERMINATION_GRACE_MS, 5_000);
    }

    /** Credential for a daemon this host does not spawn; null unless both cert and key are configured. */
    public @Nullable BootstrapCredential configuredCredential() {
        var cert = getPath(DAEMON_CERT_PATH);
        var key = getPath(DAEMON_KEY_PATH);
        if (cert == null || key == null) {
            return null;
        }
        return new BootstrapCredential(cert, key, getPath(DAEMON_CA_CERT_PATH));
    }

    public DeploymentLocator daemonLocator(HostOs os) {
        return new DeploymentLocator(
                os,
                packagingMode(),
                installDir(),
                sourceRoot(),
                get(DAEMON_ENTRY_SCRIPT, DEFAULT_ENTRY_SCRIPT),
                get(DAEMON_INTERPRETER),
                get(DAEMON_EXECUTABLE_NAME, DEFAULT_EXECUTABLE_NAME),
                env);
    }
}
