package dev.plotkeeper.daemon;

import static org.junit.jupiter.api.Assertions.*;

import dev.plotkeeper.config.HostConfig;
import dev.plotkeeper.daemon.process.BootstrapCredential;
import dev.plotkeeper.daemon.process.DaemonProcessControl;
import dev.plotkeeper.daemon.process.DaemonProcessHandle;
import dev.plotkeeper.daemon.process.HostOs;
import dev.plotkeeper.daemon.process.ProcessSupervisor;
import dev.plotkeeper.daemon.shutdown.HostWindow;
import dev.plotkeeper.daemon.shutdown.ShutdownState;
import dev.plotkeeper.testutil.FakeConnector;
import dev.plotkeeper.testutil.FakeDaemonProcesses;
import dev.plotkeeper.testutil.FakeDaemonServer;
import dev.plotkeeper.testutil.IdleProcess;
import dev.plotkeeper.util.Json;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class DaemonSessionTest {
    private static final Duration WAIT = Duration.ofSeconds(30);

    @TempDir
    Path dir;

    private static HostConfig config(String... keyValues) {
        var props = new Properties();
        for (int i = 0; i < keyValues.length; i += 2) {
            props.setProperty(keyValues[i], keyValues[i + 1]);
        }
        return HostConfig.of(props, Map.of(), new Properties());
    }

    @Test
    void testExternalDaemonRegistersQueriesAndClosesWithoutExit() throws Exception {
        try (var server = new FakeDaemonServer()) {
            server.reply("register_service", Json.object().put("success", true));
            server.reply("get_status", Json.object().put("success", true).put("genesis_initialized", true));
            server.start(1);
            var config = config(
                    HostConfig.DAEMON_MANAGE_LIFETIME, "false",
                    HostConfig.DAEMON_SCHEME, "ws",
                    HostConfig.DAEMON_HOST, "127.0.0.1",
                    HostConfig.DAEMON_PORT, Integer.toString(server.port()));
            var window = new HostWindow.Headless();
            var session = DaemonSession.create(config, window);

            session.start().get(WAIT.toSeconds(), TimeUnit.SECONDS);
            session.awaitRegistered().get(WAIT.toSeconds(), TimeUnit.SECONDS);

            var register = server.awaitCommand("register_service", WAIT);
            assertEquals("wallet_ui", register.data().get("service").asText());
            assertEquals("wallet_ui", register.origin());

            var status = session.broker().sendChecked("get_status", Json.object()).get(WAIT.toSeconds(), TimeUnit.SECONDS);
            assertTrue(status.get("genesis_initialized").asBoolean());
            server.awaitCommand("get_status", WAIT);

            session.close(WAIT);

            assertTrue(window.closed().isDone());
            assertEquals(ShutdownState.TERMINATED, session.shutdown().state());
            assertTrue(session.loop().isClosed());
        }
    }

    @Test
    void testManagedDaemonIsSpawnedConnectedAndStopped() throws Exception {
        var cert = dir.resolve("private_daemon.crt");
        var key = dir.resolve("private_daemon.key");
        var config = config();
        var loop = new EventLoop("SessionTest");
        var connector = new FakeConnector(loop);
        var processes = new ProcessSupervisor(
                FakeDaemonProcesses.locator("bootstrap", cert.toString(), key.toString()),
                HostOs.current(),
                WAIT,
                Duration.ofSeconds(5));
        var session = new DaemonSession(config, new HostWindow.Headless(), loop, connector, processes);

        session.start().get(WAIT.toSeconds(), TimeUnit.SECONDS);

        var channel = connector.awaitChannel(WAIT);
        assertNotNull(connector.lastCredential());
        assertEquals(cert, connector.lastCredential().certificatePath());

        var register = channel.awaitSent(WAIT);
        assertEquals("register_service", register.command());
        channel.deliver(register.reply(Json.object().put("success", true)));
        session.awaitRegistered().get(WAIT.toSeconds(), TimeUnit.SECONDS);

        var closing = CompletableFuture.runAsync(() -> session.close(WAIT));
        var exit = channel.awaitSent(WAIT);
        assertEquals("exit", exit.command());
        channel.deliver(exit.reply(Json.object().put("success", true)));
        closing.get(WAIT.toSeconds(), TimeUnit.SECONDS);

        assertEquals(ShutdownState.TERMINATED, session.shutdown().state());
    }

    @Test
    void testClosingWhileDaemonIsStartingStopsItOnceItIsUp() throws Exception {
        var loop = new EventLoop("SessionTest");
        var connector = new FakeConnector(loop);
        var spawn = new CompletableFuture<DaemonProcessHandle>();
        var terminations = new AtomicInteger();
        var processes = new DaemonProcessControl() {
            @Override
            public CompletableFuture<DaemonProcessHandle> spawn() {
                return spawn;
            }

            @Override
            public CompletableFuture<Void> terminate(DaemonProcessHandle handle) {
                terminations.incrementAndGet();
                return CompletableFuture.completedFuture(null);
            }
        };
        var window = new HostWindow.Headless();
        var session = new DaemonSession(config(), window, loop, connector, processes);

        var started = session.start();
        var shutdown = session.shutdown().shutdownNow();
        Thread.sleep(300);
        assertFalse(window.closed().isDone(), "window stays open until the starting daemon is stopped");

        spawn.complete(new DaemonProcessHandle(
                new IdleProcess(), new BootstrapCredential(dir.resolve("d.crt"), dir.resolve("d.key")), Instant.now()));

        shutdown.get(WAIT.toSeconds(), TimeUnit.SECONDS);
        started.get(WAIT.toSeconds(), TimeUnit.SECONDS);
        assertEquals(1, terminations.get());
        assertTrue(window.closed().isDone());
        assertEquals(0, connector.attempts(), "no connection to a daemon that is being stopped");
        loop.close();
    }
}
