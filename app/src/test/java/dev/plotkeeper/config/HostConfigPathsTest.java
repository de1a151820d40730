package dev.plotkeeper.config;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class HostConfigPathsTest {
    @Test
    void testLinuxUsesXdgConfigHome() {
        var paths = HostConfigPaths.defaults("Linux", Map.of("XDG_CONFIG_HOME", "/xdg"), "/home/farmer");

        assertEquals(Path.of("/xdg", "plotkeeper"), paths.getBaseConfigDir());
    }

    @Test
    void testLinuxFallsBackToDotConfig() {
        var paths = HostConfigPaths.defaults("Linux", Map.of(), "/home/farmer");

        assertEquals(Path.of("/home/farmer", ".config", "plotkeeper"), paths.getBaseConfigDir());
        assertEquals(Path.of("/home/farmer", ".config", "plotkeeper", "plotkeeper.properties"), paths.getConfigFile());
    }

    @Test
    void testMacUsesApplicationSupport() {
        var paths = HostConfigPaths.defaults("Mac OS X", Map.of(), "/Users/farmer");

        assertEquals(Path.of("/Users/farmer", "Library", "Application Support", "Plotkeeper"), paths.getBaseConfigDir());
    }

    @Test
    void testWindowsUsesAppData() {
        var paths = HostConfigPaths.defaults("Windows 10", Map.of("APPDATA", "/appdata"), "/home/farmer");

        assertEquals(Path.of("/appdata", "Plotkeeper"), paths.getBaseConfigDir());
    }

    @Test
    void testEnsureLogDirExists(@TempDir Path dir) throws Exception {
        var paths = HostConfigPaths.forBaseConfigDir(dir);

        paths.ensureLogDirExists();

        assertTrue(Files.isDirectory(paths.getLogDir()));
    }
}
