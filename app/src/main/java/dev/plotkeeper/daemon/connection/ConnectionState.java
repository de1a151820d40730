package dev.plotkeeper.daemon.connection;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    CLOSING;

    private static final Map<ConnectionState, Set<ConnectionState>> TRANSITIONS = new EnumMap<>(ConnectionState.class);

    static {
        TRANSITIONS.put(DISCONNECTED, EnumSet.of(CONNECTING));
        TRANSITIONS.put(CONNECTING, EnumSet.of(CONNECTED, DISCONNECTED));
        TRANSITIONS.put(CONNECTED, EnumSet.of(DISCONNECTED, CLOSING));
        TRANSITIONS.put(CLOSING, EnumSet.of(DISCONNECTED));
    }

    public boolean canTransitionTo(ConnectionState next) {
        return TRANSITIONS.get(this).contains(next);
    }
}
