package dev.plotkeeper.daemon.process;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jspecify.annotations.NullMarked;

/**
 * Spawns the daemon, waits for it to report its credential, and stops it again.
 *
 * <p>The daemon's combined stdout/stderr is read on a dedicated daemon thread for its whole life:
 * until the credential record appears the lines are scanned, afterwards they are only logged so
 * the pipe never fills up.
 */
@NullMarked
public final class ProcessSupervisor implements DaemonProcessControl {
    private static final Logger logger = LogManager.getLogger(ProcessSupervisor.class);

    public static final Duration DEFAULT_BOOTSTRAP_TIMEOUT = Duration.ofSeconds(60);
    public static final Duration DEFAULT_TERMINATION_GRACE = Duration.ofSeconds(5);

    /** How long to wait after a forced kill before giving up on observing the exit. */
    private static final Duration FORCED_KILL_WAIT = Duration.ofSeconds(5);

    private final DaemonLocator locator;
    private final HostOs os;
    private final Duration bootstrapTimeout;
    private final Duration terminationGrace;

    public ProcessSupervisor(DaemonLocator locator, HostOs os, Duration bootstrapTimeout, Duration terminationGrace) {
        this.locator = locator;
        this.os = os;
        this.bootstrapTimeout = bootstrapTimeout;
        this.terminationGrace = terminationGrace;
    }

    public Path locateExecutable() throws BootstrapFailedException {
        return locator.locateExecutable();
    }

    @Override
    public CompletableFuture<DaemonProcessHandle> spawn() {
        var result = new CompletableFuture<DaemonProcessHandle>();
        Process process;
        try {
            var launch = locator.launchCommand();
            var processBuilder = new ProcessBuilder(launch.command());
            if (launch.workingDirectory() != null) {
                processBuilder.directory(launch.workingDirectory().toFile());
            }
            processBuilder.redirectErrorStream(true);
            logger.info("Starting daemon: {}", String.join(" ", launch.command()));
            process = processBuilder.start();
        } catch (BootstrapFailedException e) {
            result.completeExceptionally(e);
            return result;
        } catch (IOException e) {
            result.completeExceptionally(new BootstrapFailedException("Failed to start daemon process", e));
            return result;
        }

        var startedAt = Instant.now();
        var credential = new CompletableFuture<BootstrapCredential>();
        consumeProcessOutput(process, credential);

        credential
                .orTimeout(bootstrapTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((cred, err) -> {
                    if (err == null) {
                        logger.info("Daemon (pid {}) reported certificate {}", process.pid(), cred.certificatePath());
                        result.complete(new DaemonProcessHandle(process, cred, startedAt));
                        return;
                    }
                    var failure = err instanceof TimeoutException
                            ? new BootstrapFailedException("Daemon did not report its certificate within "
                                    + bootstrapTimeout.toSeconds() + " s")
                            : err;
                    logger.error("Daemon startup failed: {}", failure.getMessage());
                    forceKill(process);
                    result.completeExceptionally(failure);
                });
        return result;
    }

    private void consumeProcessOutput(Process process, CompletableFuture<BootstrapCredential> credential) {
        long pid = process.pid();
        var outputReader = new Thread(
                () -> {
                    try (var reader = process.inputReader()) {
                        var found = BootstrapScanner.scan(reader, line -> logger.info("[daemon:{}] {}", pid, line));
                        if (found.isPresent()) {
                            credential.complete(found.get());
                            reader.lines().forEach(line -> logger.info("[daemon:{}] {}", pid, line));
                        } else {
                            credential.completeExceptionally(new BootstrapFailedException(
                                    "Daemon output ended before it reported its certificate" + exitDescription(process)));
                        }
                    } catch (IOException | RuntimeException e) {
                        if (!credential.completeExceptionally(
                                new BootstrapFailedException("Failed to read daemon output", e))) {
                            logger.debug("Daemon {} output closed: {}", pid, e.getMessage());
                        }
                    }
                },
                "DaemonOutput-" + pid);
        outputReader.setDaemon(true);
        outputReader.start();
    }

    private static String exitDescription(Process process) {
        try {
            if (process.waitFor(1, TimeUnit.SECONDS)) {
                return " (exit code " + process.exitValue() + ")";
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return "";
    }

    /**
     * Stops the daemon. On POSIX the process gets SIGTERM and {@code terminationGrace} to exit before
     * it and its descendants are killed; on Windows, where there is no graceful signal for a console
     * process tree, the tree is killed by PID with {@code taskkill}.
     */
    @Override
    public CompletableFuture<Void> terminate(DaemonProcessHandle handle) {
        var process = handle.process();
        if (!process.isAlive()) {
            logger.info("Daemon (pid {}) already exited", handle.pid());
            return CompletableFuture.completedFuture(null);
        }

        logger.info("Stopping daemon (pid {})", handle.pid());
        CompletableFuture<Void> signalled;
        if (os == HostOs.WINDOWS) {
            signalled = CompletableFuture.runAsync(() -> killTreeByPid(handle.pid()));
        } else {
            process.destroy();
            signalled = CompletableFuture.completedFuture(null);
        }

        return signalled
                .thenCompose(v -> process.onExit())
                .thenApply(p -> true)
                .completeOnTimeout(false, terminationGrace.toMillis(), TimeUnit.MILLISECONDS)
                .thenCompose(exited -> {
                    if (exited) {
                        logger.info("Daemon (pid {}) exited with code {}", handle.pid(), process.exitValue());
                        return CompletableFuture.<Void>completedFuture(null);
                    }
                    logger.warn(
                            "Daemon (pid {}) did not exit within {} ms, forcing kill",
                            handle.pid(),
                            terminationGrace.toMillis());
                    return forceKill(process);
                });
    }

    private CompletableFuture<Void> forceKill(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        return process.onExit()
                .thenApply(p -> true)
                .completeOnTimeout(false, FORCED_KILL_WAIT.toMillis(), TimeUnit.MILLISECONDS)
                .thenAccept(exited -> {
                    if (!exited) {
                        logger.error("Daemon (pid {}) survived a forced kill", process.pid());
                    }
                });
    }

    private static void killTreeByPid(long pid) {
        var command = List.of("taskkill", "/PID", Long.toString(pid), "/T", "/F");
        try {
            var taskkill = new ProcessBuilder(command).redirectErrorStream(true).start();
            if (!taskkill.waitFor(10, TimeUnit.SECONDS)) {
                taskkill.destroyForcibly();
                logger.warn("taskkill for pid {} did not finish", pid);
            } else if (taskkill.exitValue() != 0) {
                logger.warn("taskkill for pid {} exited with code {}", pid, taskkill.exitValue());
            }
        } catch (IOException e) {
            logger.warn("Could not run taskkill for pid {}", pid, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while running taskkill for pid {}", pid);
        }
    }
}
