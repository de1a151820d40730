package dev.plotkeeper.daemon.process;

import java.nio.file.Path;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/** The argv that starts the daemon, and the directory to start it in. */
public record LaunchCommand(List<String> command, @Nullable Path workingDirectory) {
    public LaunchCommand {
        if (command.isEmpty()) {
            throw new IllegalArgumentException("command must not be empty");
        }
        command = List.copyOf(command);
    }

    public String executable() {
        return command.get(0);
    }
}
