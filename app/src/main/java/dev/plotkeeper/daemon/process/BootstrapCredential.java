package dev.plotkeeper.daemon.process;

import java.nio.file.Path;
import org.jetbrains.annotations.Nullable;

/**
 * Client certificate and key the daemon reported at startup, plus its private CA when named.
 * Valid for the lifetime of that daemon process.
 */
public record BootstrapCredential(Path certificatePath, Path keyPath, @Nullable Path caCertificatePath) {
    public BootstrapCredential(Path certificatePath, Path keyPath) {
        this(certificatePath, keyPath, null);
    }
}
