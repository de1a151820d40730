package dev.plotkeeper.daemon.process;

import java.util.concurrent.CompletableFuture;

/** Starting and stopping the daemon process. */
public interface DaemonProcessControl {
    /** Completes once the daemon has reported its credential, or fails with {@link BootstrapFailedException}. */
    CompletableFuture<DaemonProcessHandle> spawn();

    /** Completes once the process has exited. Never fails because the process resisted. */
    CompletableFuture<Void> terminate(DaemonProcessHandle handle);
}
