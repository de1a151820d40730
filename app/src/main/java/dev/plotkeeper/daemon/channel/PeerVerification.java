package dev.plotkeeper.daemon.channel;

/** How strictly the daemon's server certificate is checked. */
public enum PeerVerification {
    /** Normal chain and hostname verification. */
    STRICT,
    /**
     * Accept the self-issued certificate of a daemon this host spawned itself. Only ever applied
     * to loopback endpoints.
     */
    LOCAL_SELF_ISSUED
}
