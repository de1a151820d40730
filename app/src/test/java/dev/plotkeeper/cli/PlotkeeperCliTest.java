package dev.plotkeeper.cli;

import static org.junit.jupiter.api.Assertions.*;

import dev.plotkeeper.config.HostConfig;
import dev.plotkeeper.testutil.FakeDaemonServer;
import dev.plotkeeper.util.Json;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

public class PlotkeeperCliTest {
    private static final Duration WAIT = Duration.ofSeconds(10);

    private static PlotkeeperCli parse(String... args) {
        var cli = new PlotkeeperCli();
        new CommandLine(cli).parseArgs(args);
        return cli;
    }

    private static HostConfig externalDaemon(int port) {
        var props = new Properties();
        props.setProperty(HostConfig.DAEMON_MANAGE_LIFETIME, "false");
        props.setProperty(HostConfig.DAEMON_SCHEME, "ws");
        props.setProperty(HostConfig.DAEMON_HOST, "127.0.0.1");
        props.setProperty(HostConfig.DAEMON_PORT, Integer.toString(port));
        return HostConfig.of(props, Map.of(), new Properties());
    }

    @Test
    void testHeadlessCommandAgainstRunningDaemon() throws Exception {
        try (var server = new FakeDaemonServer()) {
            server.reply("register_service", Json.object().put("success", true));
            server.reply("get_public_keys", Json.object().put("success", true));
            server.start(1);

            var cli = parse("--headless", "--command", "get_public_keys", "--destination", "chia_wallet");
            int exitCode = cli.runHeadless(externalDaemon(server.port()));

            assertEquals(PlotkeeperCli.EXIT_OK, exitCode);
            var sent = server.awaitCommand("get_public_keys", WAIT);
            assertEquals("chia_wallet", sent.destination());
        }
    }

    @Test
    void testUnsuccessfulReplyGivesCommandFailedExitCode() throws Exception {
        try (var server = new FakeDaemonServer()) {
            server.reply("register_service", Json.object().put("success", true));
            server.reply("start_service", Json.object().put("success", false).put("error", "unknown service"));
            server.start(1);

            var cli = parse("--headless", "--command", "start_service", "--data", "{\"service\": \"nope\"}");

            assertEquals(PlotkeeperCli.EXIT_COMMAND_FAILED, cli.runHeadless(externalDaemon(server.port())));
            assertEquals("nope", server.awaitCommand("start_service", WAIT).data().get("service").asText());
        }
    }

    @Test
    void testDataMustBeJsonObject() throws Exception {
        assertEquals(PlotkeeperCli.EXIT_USAGE, parse("--headless", "--data", "[1]").runHeadless(externalDaemon(1)));
        assertEquals(PlotkeeperCli.EXIT_USAGE, parse("--headless", "--data", "{oops").runHeadless(externalDaemon(1)));
    }

    @Test
    void testDefaults() {
        var cli = parse();
        var spec = new CommandLine(cli).getCommandSpec();

        assertEquals("get_status", spec.findOption("--command").defaultValue());
        assertEquals("daemon", spec.findOption("--destination").defaultValue());
    }
}
