package dev.plotkeeper.daemon;

/** A frame that claimed to answer a request could not be decoded into an envelope. */
public class MalformedEnvelopeException extends DaemonChannelException {
    public MalformedEnvelopeException(String message) {
        super(message);
    }
}
