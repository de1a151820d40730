package dev.plotkeeper.testutil;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Stand-in daemon launched as a child JVM by process tests.
 *
 * <p>Modes:
 * <ul>
 *   <li>{@code bootstrap <cert> <key>}: logs a line, prints the credential record, keeps logging until killed
 *   <li>{@code stubborn <cert> <key>}: like {@code bootstrap}, but SIGTERM does not make it exit
 *   <li>{@code crash}: logs a line and exits with code 3
 *   <li>{@code silent}: prints nothing and sleeps
 *   <li>{@code launcher <pidFile>}: starts a {@code silent} child, writes its pid to {@code pidFile}, then sleeps
 * </ul>
 */
public final class FakeDaemonMain {
    private FakeDaemonMain() {}

    public static void main(String[] args) throws Exception {
        String mode = args.length > 0 ? args[0] : "bootstrap";
        switch (mode) {
            case "crash" -> {
                System.out.println("starting...");
                System.out.println("fatal: keyring locked");
                System.out.flush();
                System.exit(3);
            }
            case "silent" -> Thread.sleep(Long.MAX_VALUE);
            case "launcher" -> {
                var child = new ProcessBuilder(List.of(
                                FakeDaemonProcesses.javaBin().toString(),
                                "-cp",
                                System.getProperty("java.class.path"),
                                FakeDaemonMain.class.getName(),
                                "silent"))
                        .start();
                var pidFile = Path.of(args[1]);
                var tmp = pidFile.resolveSibling(pidFile.getFileName() + ".tmp");
                Files.writeString(tmp, Long.toString(child.pid()));
                Files.move(tmp, pidFile, StandardCopyOption.ATOMIC_MOVE);
                Thread.sleep(Long.MAX_VALUE);
            }
            case "stubborn" -> {
                Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                    try {
                        Thread.sleep(Long.MAX_VALUE);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }));
                announce(args);
            }
            default -> announce(args);
        }
    }

    private static void announce(String[] args) throws InterruptedException {
        String cert = args.length > 1 ? args[1] : "daemon.crt";
        String key = args.length > 2 ? args[2] : "daemon.key";
        System.out.println("starting...");
        System.out.println("{\"message\": \"cert_path\", \"success\": true, \"cert\": \"" + escape(cert)
                + "\", \"key\": \"" + escape(key) + "\"}");
        System.out.flush();
        for (int i = 0; ; i++) {
            System.out.println("heartbeat " + i);
            System.out.flush();
            Thread.sleep(200);
        }
    }

    private static String escape(String path) {
        return path.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
