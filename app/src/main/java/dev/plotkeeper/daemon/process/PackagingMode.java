package dev.plotkeeper.daemon.process;

import java.util.Locale;

/** Whether the daemon ships as a prebuilt executable or runs from source. */
public enum PackagingMode {
    /** Packaged when the prebuilt executable exists, development otherwise. */
    AUTO,
    PACKAGED,
    DEVELOPMENT;

    public static PackagingMode parse(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Unknown packaging mode '" + value + "' (expected auto, packaged or development)", e);
        }
    }
}
