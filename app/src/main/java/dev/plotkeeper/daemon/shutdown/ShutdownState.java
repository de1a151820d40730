package dev.plotkeeper.daemon.shutdown;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

public enum ShutdownState {
    RUNNING,
    CONFIRM_PENDING,
    SHUTTING_DOWN,
    TERMINATED;

    private static final Map<ShutdownState, Set<ShutdownState>> TRANSITIONS = new EnumMap<>(ShutdownState.class);

    static {
        TRANSITIONS.put(RUNNING, EnumSet.of(CONFIRM_PENDING, SHUTTING_DOWN));
        TRANSITIONS.put(CONFIRM_PENDING, EnumSet.of(RUNNING, SHUTTING_DOWN));
        TRANSITIONS.put(SHUTTING_DOWN, EnumSet.of(TERMINATED));
        TRANSITIONS.put(TERMINATED, EnumSet.noneOf(ShutdownState.class));
    }

    public boolean canTransitionTo(ShutdownState next) {
        return TRANSITIONS.get(this).contains(next);
    }
}
