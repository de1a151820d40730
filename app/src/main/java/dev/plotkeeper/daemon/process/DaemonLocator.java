package dev.plotkeeper.daemon.process;

import java.nio.file.Path;

/** Knows where the daemon lives and how to start it. */
public interface DaemonLocator {
    Path locateExecutable() throws BootstrapFailedException;

    LaunchCommand launchCommand() throws BootstrapFailedException;
}
