package dev.plotkeeper.daemon.process;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Locates the daemon for an installed or a source checkout build.
 *
 * <ul>
 *   <li>Packaged: {@code <installDir>/daemon/<name>} on Linux, {@code <installDir>/daemon/<name>.exe}
 *       on Windows, {@code <installDir>/Contents/Resources/daemon/<name>} inside a macOS app bundle.
 *   <li>Development: the active virtualenv's interpreter ({@code $VIRTUAL_ENV}), or the configured
 *       one found on {@code PATH}, run against {@code <sourceRoot>/<entryScript>}.
 * </ul>
 */
public final class DeploymentLocator implements DaemonLocator {
    private static final Logger logger = LogManager.getLogger(DeploymentLocator.class);

    public static final String WAIT_FOR_UNLOCK = "--wait-for-unlock";

    private final HostOs os;
    private final PackagingMode mode;
    private final Path installDir;
    private final Path sourceRoot;
    private final String entryScript;
    private final @Nullable String interpreter;
    private final String executableName;
    private final Map<String, String> env;

    public DeploymentLocator(
            HostOs os,
            PackagingMode mode,
            Path installDir,
            Path sourceRoot,
            String entryScript,
            @Nullable String interpreter,
            String executableName,
            Map<String, String> env) {
        this.os = os;
        this.mode = mode;
        this.installDir = installDir;
        this.sourceRoot = sourceRoot;
        this.entryScript = entryScript;
        this.interpreter = interpreter;
        this.executableName = executableName;
        this.env = Map.copyOf(env);
    }

    public PackagingMode resolveMode() {
        if (mode != PackagingMode.AUTO) {
            return mode;
        }
        return Files.isRegularFile(packagedExecutable()) ? PackagingMode.PACKAGED : PackagingMode.DEVELOPMENT;
    }

    Path packagedExecutable() {
        switch (os) {
            case WINDOWS:
                return installDir.resolve("daemon").resolve(executableName + ".exe");
            case MAC:
                return installDir.resolve("Contents").resolve("Resources").resolve("daemon").resolve(executableName);
            default:
                return installDir.resolve("daemon").resolve(executableName);
        }
    }

    Path interpreterPath() {
        String venv = env.get("VIRTUAL_ENV");
        if (venv != null && !venv.isBlank()) {
            var venvDir = Path.of(venv);
            return os == HostOs.WINDOWS
                    ? venvDir.resolve("Scripts").resolve("python.exe")
                    : venvDir.resolve("bin").resolve("python");
        }
        if (interpreter != null && !interpreter.isBlank()) {
            return Path.of(interpreter);
        }
        return Path.of(os == HostOs.WINDOWS ? "python" : "python3");
    }

    Path entryPoint() {
        return sourceRoot.resolve(entryScript);
    }

    @Override
    public Path locateExecutable() throws BootstrapFailedException {
        var resolved = resolveMode();
        if (resolved == PackagingMode.PACKAGED) {
            var executable = packagedExecutable();
            if (!Files.isRegularFile(executable)) {
                throw new BootstrapFailedException("Daemon executable not found at " + executable);
            }
            return executable;
        }
        var python = interpreterPath();
        // a bare name is resolved against PATH when the process starts
        if (python.getParent() != null && !Files.isRegularFile(python)) {
            throw new BootstrapFailedException("Python interpreter not found at " + python);
        }
        return python;
    }

    @Override
    public LaunchCommand launchCommand() throws BootstrapFailedException {
        var executable = locateExecutable();
        if (resolveMode() == PackagingMode.PACKAGED) {
            logger.debug("Using packaged daemon {}", executable);
            return new LaunchCommand(List.of(executable.toString(), WAIT_FOR_UNLOCK), executable.getParent());
        }
        var entry = entryPoint();
        if (!Files.isRegularFile(entry)) {
            throw new BootstrapFailedException("Daemon entry point not found at " + entry);
        }
        logger.debug("Running daemon from source: {} {}", executable, entry);
        return new LaunchCommand(List.of(executable.toString(), entry.toString(), WAIT_FOR_UNLOCK), sourceRoot);
    }
}
