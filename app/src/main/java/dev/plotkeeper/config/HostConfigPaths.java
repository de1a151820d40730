package dev.plotkeeper.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Resolves per-user Plotkeeper config locations:
 * - the {@code plotkeeper.properties} settings file
 * - the log directory
 *
 * Default resolution is platform-aware:
 * - Linux: $XDG_CONFIG_HOME/plotkeeper or $HOME/.config/plotkeeper
 * - macOS: $HOME/Library/Application Support/Plotkeeper
 * - Windows: %APPDATA%\\Plotkeeper
 *
 * For tests and overrides use {@link #forBaseConfigDir(Path)}.
 */
public final class HostConfigPaths {
    public static final String CONFIG_FILE_NAME = "plotkeeper.properties";

    private final Path baseConfigDir;

    private HostConfigPaths(Path baseConfigDir) {
        this.baseConfigDir = Objects.requireNonNull(baseConfigDir);
    }

    public static HostConfigPaths defaults() {
        return defaults(System.getProperty("os.name", ""), System.getenv(), System.getProperty("user.home"));
    }

    static HostConfigPaths defaults(String osName, Map<String, String> env, String userHome) {
        String os = osName.toLowerCase(Locale.ROOT);
        Path home = Path.of(userHome);

        if (os.contains("mac") || os.contains("darwin")) {
            return new HostConfigPaths(home.resolve("Library").resolve("Application Support").resolve("Plotkeeper"));
        }

        if (os.contains("win")) {
            String appData = env.get("APPDATA");
            if (appData != null && !appData.isBlank()) {
                return new HostConfigPaths(Path.of(appData).resolve("Plotkeeper"));
            }
            return new HostConfigPaths(home.resolve("AppData").resolve("Roaming").resolve("Plotkeeper"));
        }

        String xdg = env.get("XDG_CONFIG_HOME");
        if (xdg != null && !xdg.isBlank()) {
            return new HostConfigPaths(Path.of(xdg).resolve("plotkeeper"));
        }
        return new HostConfigPaths(home.resolve(".config").resolve("plotkeeper"));
    }

    public static HostConfigPaths forBaseConfigDir(Path baseConfigDir) {
        return new HostConfigPaths(baseConfigDir);
    }

    public Path getBaseConfigDir() {
        return baseConfigDir;
    }

    public Path getConfigFile() {
        return baseConfigDir.resolve(CONFIG_FILE_NAME);
    }

    public Path getLogDir() {
        return baseConfigDir.resolve("logs");
    }

    public void ensureLogDirExists() throws IOException {
        Files.createDirectories(getLogDir());
    }
}
