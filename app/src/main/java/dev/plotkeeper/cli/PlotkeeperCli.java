package dev.plotkeeper.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import dev.plotkeeper.config.HostConfig;
import dev.plotkeeper.config.HostConfigPaths;
import dev.plotkeeper.daemon.DaemonSession;
import dev.plotkeeper.daemon.process.BootstrapFailedException;
import dev.plotkeeper.daemon.shutdown.HostWindow;
import dev.plotkeeper.gui.SwingHostWindow;
import dev.plotkeeper.util.Json;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import javax.swing.SwingUtilities;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.config.Configurator;
import org.jetbrains.annotations.Blocking;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;

@SuppressWarnings("NullAway.Init") // picocli fills the option fields before call()
@CommandLine.Command(
        name = "plotkeeper-host",
        mixinStandardHelpOptions = true,
        description = "Starts the farming daemon, connects to it and keeps it supervised.")
public final class PlotkeeperCli implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(PlotkeeperCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_BOOTSTRAP_FAILED = 1;
    static final int EXIT_NOT_CONNECTED = 2;
    static final int EXIT_COMMAND_FAILED = 3;
    static final int EXIT_USAGE = 4;

    /** How long a headless run waits for the first connection after the daemon started. */
    private static final Duration CONNECT_WAIT = Duration.ofSeconds(30);

    @CommandLine.Option(names = "--config-dir", description = "Directory holding plotkeeper.properties and logs.")
    @Nullable
    private Path configDir;

    @CommandLine.Option(names = "--headless", description = "Run without a window: send one command and exit.")
    private boolean headless;

    @CommandLine.Option(
            names = "--command",
            defaultValue = "get_status",
            description = "Command to send in headless mode (default: ${DEFAULT-VALUE}).")
    private String command = "get_status";

    @CommandLine.Option(
            names = "--data",
            defaultValue = "{}",
            description = "JSON object sent as the command's data (default: ${DEFAULT-VALUE}).")
    private String data = "{}";

    @CommandLine.Option(
            names = "--destination",
            defaultValue = "daemon",
            description = "Service the command is addressed to (default: ${DEFAULT-VALUE}).")
    private String destination = "daemon";

    public static void main(String[] args) {
        int exitCode = new CommandLine(new PlotkeeperCli()).execute(args);
        System.exit(exitCode);
    }

    @Override
    @Blocking
    public Integer call() throws Exception {
        var paths = configDir != null ? HostConfigPaths.forBaseConfigDir(configDir) : HostConfigPaths.defaults();
        useLogDir(paths);
        var config = HostConfig.load(paths);

        if (headless) {
            System.setProperty("java.awt.headless", "true");
            return runHeadless(config);
        }
        return runDesktop(config);
    }

    private static void useLogDir(HostConfigPaths paths) {
        try {
            paths.ensureLogDirExists();
            System.setProperty("plotkeeper.logDir", paths.getLogDir().toString());
            Configurator.reconfigure();
        } catch (IOException e) {
            logger.warn("Cannot create log directory {}; logging to console only", paths.getLogDir(), e);
        }
    }

    @Blocking
    int runHeadless(HostConfig config) throws InterruptedException {
        JsonNode payload;
        try {
            payload = Json.readTree(data);
        } catch (JsonProcessingException e) {
            System.err.println("--data is not valid JSON: " + e.getOriginalMessage());
            return EXIT_USAGE;
        }
        if (!payload.isObject()) {
            System.err.println("--data must be a JSON object");
            return EXIT_USAGE;
        }

        try (var session = DaemonSession.create(config, new HostWindow.Headless())) {
            try {
                session.start().get();
            } catch (ExecutionException e) {
                var cause = unwrap(e);
                logger.error("Could not start the daemon", cause);
                System.err.println("Could not start the daemon: " + cause.getMessage());
                return cause instanceof BootstrapFailedException ? EXIT_BOOTSTRAP_FAILED : EXIT_NOT_CONNECTED;
            }

            try {
                session.awaitRegistered().get(CONNECT_WAIT.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException | ExecutionException e) {
                System.err.println("Could not connect to the daemon at " + config.daemonUri());
                return EXIT_NOT_CONNECTED;
            }

            try {
                var reply = session.broker()
                        .send(destination, command, payload, config.requestTimeout())
                        .get();
                System.out.println(Json.toPrettyJson(reply));
                return reply.path("success").asBoolean(true) ? EXIT_OK : EXIT_COMMAND_FAILED;
            } catch (ExecutionException e) {
                System.err.println("'" + command + "' failed: " + unwrap(e).getMessage());
                return EXIT_COMMAND_FAILED;
            }
        }
    }

    @Blocking
    int runDesktop(HostConfig config) throws Exception {
        var windowRef = new AtomicReference<SwingHostWindow>();
        SwingUtilities.invokeAndWait(() -> windowRef.set(new SwingHostWindow("Plotkeeper")));
        var window = windowRef.get();

        var session = DaemonSession.create(config, window);
        window.setCloseHandler(session.shutdown()::requestClose);
        session.connection().addListener(window);
        window.show();

        var bootstrapFailed = new AtomicReference<Throwable>();
        session.start().whenComplete((v, err) -> {
            if (err == null) {
                return;
            }
            var cause = err instanceof CompletionException && err.getCause() != null ? err.getCause() : err;
            bootstrapFailed.set(cause);
            window.showStartupFailure(String.valueOf(cause.getMessage()))
                    .thenRun(() -> session.shutdown().shutdownNow());
        });

        session.shutdown().awaitTermination().join();
        session.loop().close();
        logger.info("Plotkeeper host exited");
        return bootstrapFailed.get() == null ? EXIT_OK : EXIT_BOOTSTRAP_FAILED;
    }

    private static Throwable unwrap(ExecutionException e) {
        var cause = e.getCause();
        return cause != null ? cause : e;
    }
}
