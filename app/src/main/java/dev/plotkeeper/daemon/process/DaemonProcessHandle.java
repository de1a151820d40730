package dev.plotkeeper.daemon.process;

import java.time.Instant;

/** A daemon process this host spawned, with the credential it reported. */
public record DaemonProcessHandle(Process process, BootstrapCredential credential, Instant startedAt) {
    public long pid() {
        return process.pid();
    }

    public boolean isAlive() {
        return process.isAlive();
    }
}
