package dev.plotkeeper.daemon.process;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class DeploymentLocatorTest {
    @TempDir
    Path dir;

    private DeploymentLocator locator(HostOs os, PackagingMode mode, Map<String, String> env) {
        return new DeploymentLocator(
                os, mode, dir.resolve("install"), dir.resolve("src"), "chia/cmds/daemon.py", null, "daemon", env);
    }

    private static Path touch(Path file) throws Exception {
        Files.createDirectories(file.getParent());
        return Files.createFile(file);
    }

    @Test
    void testPackagedExecutablePerPlatform() {
        var install = dir.resolve("install");

        assertEquals(
                install.resolve("daemon").resolve("daemon"),
                locator(HostOs.LINUX, PackagingMode.PACKAGED, Map.of()).packagedExecutable());
        assertEquals(
                install.resolve("daemon").resolve("daemon.exe"),
                locator(HostOs.WINDOWS, PackagingMode.PACKAGED, Map.of()).packagedExecutable());
        assertEquals(
                install.resolve("Contents").resolve("Resources").resolve("daemon").resolve("daemon"),
                locator(HostOs.MAC, PackagingMode.PACKAGED, Map.of()).packagedExecutable());
    }

    @Test
    void testPackagedLaunchCommandWaitsForUnlock() throws Exception {
        var executable = touch(dir.resolve("install").resolve("daemon").resolve("daemon"));
        var locator = locator(HostOs.LINUX, PackagingMode.PACKAGED, Map.of());

        var launch = locator.launchCommand();

        assertEquals(List.of(executable.toString(), DeploymentLocator.WAIT_FOR_UNLOCK), launch.command());
        assertEquals(executable.getParent(), launch.workingDirectory());
    }

    @Test
    void testMissingPackagedExecutableFailsBootstrap() {
        var locator = locator(HostOs.LINUX, PackagingMode.PACKAGED, Map.of());

        var e = assertThrows(BootstrapFailedException.class, locator::locateExecutable);
        assertTrue(e.getMessage().contains("daemon"));
    }

    @Test
    void testAutoModePrefersPackagedExecutable() throws Exception {
        var locator = locator(HostOs.WINDOWS, PackagingMode.AUTO, Map.of());
        assertEquals(PackagingMode.DEVELOPMENT, locator.resolveMode());

        touch(dir.resolve("install").resolve("daemon").resolve("daemon.exe"));
        assertEquals(PackagingMode.PACKAGED, locator.resolveMode());
    }

    @Test
    void testDevelopmentUsesActiveVirtualenv() throws Exception {
        var venv = dir.resolve("venv");
        var python = touch(venv.resolve("bin").resolve("python"));
        var entry = touch(dir.resolve("src").resolve("chia/cmds/daemon.py"));
        var locator = locator(HostOs.LINUX, PackagingMode.DEVELOPMENT, Map.of("VIRTUAL_ENV", venv.toString()));

        var launch = locator.launchCommand();

        assertEquals(
                List.of(python.toString(), entry.toString(), DeploymentLocator.WAIT_FOR_UNLOCK), launch.command());
        assertEquals(dir.resolve("src"), launch.workingDirectory());
    }

    @Test
    void testWindowsVirtualenvLayout() {
        var locator = locator(HostOs.WINDOWS, PackagingMode.DEVELOPMENT, Map.of("VIRTUAL_ENV", "C:/venv"));

        assertEquals(Path.of("C:/venv").resolve("Scripts").resolve("python.exe"), locator.interpreterPath());
    }

    @Test
    void testBareInterpreterNameIsLeftToPath() throws Exception {
        var locator = locator(HostOs.LINUX, PackagingMode.DEVELOPMENT, Map.of());

        assertEquals(Path.of("python3"), locator.locateExecutable());
    }

    @Test
    void testMissingEntryScriptFailsBootstrap() {
        var locator = locator(HostOs.LINUX, PackagingMode.DEVELOPMENT, Map.of());

        assertThrows(BootstrapFailedException.class, locator::launchCommand);
    }

    @Test
    void testHostOsDetection() {
        assertEquals(HostOs.WINDOWS, HostOs.fromOsName("Windows 11"));
        assertEquals(HostOs.MAC, HostOs.fromOsName("Mac OS X"));
        assertEquals(HostOs.LINUX, HostOs.fromOsName("Linux"));
        assertEquals(HostOs.LINUX, HostOs.fromOsName("FreeBSD"));
        assertEquals(HostOs.MAC, HostOs.fromOsName("Darwin"));
    }

    @Test
    void testPackagingModeParse() {
        assertEquals(PackagingMode.DEVELOPMENT, PackagingMode.parse(" Development "));
        assertThrows(IllegalArgumentException.class, () -> PackagingMode.parse("portable"));
    }
}
