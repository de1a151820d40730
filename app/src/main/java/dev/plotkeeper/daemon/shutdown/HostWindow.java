package dev.plotkeeper.daemon.shutdown;

import java.util.concurrent.CompletableFuture;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * The host's main window, as far as shutting down is concerned. Implementations do their own
 * thread hopping; callers may invoke these from any thread.
 */
public interface HostWindow {
    /** Asks the user whether to quit; completes with their answer. */
    CompletableFuture<Boolean> confirmExit();

    /** Switches to the small "closing" presentation shown while the daemon stops. */
    void showClosingPresentation();

    /** Actually closes the window. */
    void close();

    /** A window-less host (CLI, tests): every close is confirmed. */
    final class Headless implements HostWindow {
        private static final Logger logger = LogManager.getLogger(Headless.class);

        private final CompletableFuture<Void> closed = new CompletableFuture<>();

        @Override
        public CompletableFuture<Boolean> confirmExit() {
            return CompletableFuture.completedFuture(true);
        }

        @Override
        public void showClosingPresentation() {
            logger.info("Shutting down; waiting for the daemon to stop");
        }

        @Override
        public void close() {
            closed.complete(null);
        }

        public CompletableFuture<Void> closed() {
            return closed;
        }
    }
}
