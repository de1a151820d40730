package dev.plotkeeper.daemon.process;

import java.util.Locale;

public enum HostOs {
    WINDOWS,
    MAC,
    LINUX;

    public static HostOs current() {
        return fromOsName(System.getProperty("os.name", ""));
    }

    static HostOs fromOsName(String osName) {
        String os = osName.toLowerCase(Locale.ROOT);
        // "darwin" contains "win"
        if (os.contains("mac") || os.contains("darwin")) {
            return MAC;
        }
        if (os.contains("win")) {
            return WINDOWS;
        }
        return LINUX;
    }
}
