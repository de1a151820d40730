package dev.plotkeeper.testutil;

import dev.plotkeeper.daemon.process.DaemonLocator;
import dev.plotkeeper.daemon.process.LaunchCommand;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/** Launches {@link FakeDaemonMain} in a child JVM of the running JDK. */
public final class FakeDaemonProcesses {
    private FakeDaemonProcesses() {}

    public static Path javaBin() {
        return Path.of(System.getProperty("java.home"), "bin", "java");
    }

    public static DaemonLocator locator(String... args) {
        var command = new ArrayList<>(List.of(
                javaBin().toString(),
                "-cp",
                System.getProperty("java.class.path"),
                FakeDaemonMain.class.getName()));
        command.addAll(List.of(args));
        var launch = new LaunchCommand(command, null);
        return new DaemonLocator() {
            @Override
            public Path locateExecutable() {
                return javaBin();
            }

            @Override
            public LaunchCommand launchCommand() {
                return launch;
            }
        };
    }
}
