package dev.plotkeeper.daemon.broker;

import dev.plotkeeper.daemon.wire.Envelope;

/** Receives envelopes the daemon sent on its own initiative, in wire-arrival order. */
@FunctionalInterface
public interface DaemonEventListener {
    void onEvent(Envelope envelope);
}
