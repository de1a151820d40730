package dev.plotkeeper.daemon.channel;

import dev.plotkeeper.daemon.process.BootstrapCredential;
import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.util.Locale;
import okhttp3.OkHttpClient;
import okhttp3.tls.HandshakeCertificates;
import okhttp3.tls.HeldCertificate;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Mutual-TLS setup for the control channel. */
public final class ChannelTls {
    private static final Logger logger = LogManager.getLogger(ChannelTls.class);

    private ChannelTls() {}

    /**
     * Client certificate from the credential, the daemon's CA when the credential names one (the
     * platform trust store otherwise), and, for {@link PeerVerification#LOCAL_SELF_ISSUED}, no
     * server verification for {@code host}.
     *
     * @throws IllegalArgumentException if relaxed verification is requested for a non-loopback host
     */
    public static HandshakeCertificates handshakeCertificates(
            BootstrapCredential credential, String host, PeerVerification verification)
            throws IOException, GeneralSecurityException {
        if (verification == PeerVerification.LOCAL_SELF_ISSUED) {
            requireLoopback(host);
        }
        var certificate = PemFiles.readCertificate(credential.certificatePath());
        var privateKey = PemFiles.readPrivateKey(credential.keyPath());
        var held = new HeldCertificate(new KeyPair(certificate.getPublicKey(), privateKey), certificate);

        var builder = new HandshakeCertificates.Builder().heldCertificate(held);
        var caPath = credential.caCertificatePath();
        if (caPath != null) {
            builder.addTrustedCertificate(PemFiles.readCertificate(caPath));
        } else {
            builder.addPlatformTrustedCertificates();
        }
        if (verification == PeerVerification.LOCAL_SELF_ISSUED) {
            builder.addInsecureHost(host);
        }
        return builder.build();
    }

    /** Applies the handshake certificates (and, when relaxed, a hostname verifier pinned to {@code host}). */
    public static OkHttpClient configure(
            OkHttpClient client, BootstrapCredential credential, String host, PeerVerification verification)
            throws IOException, GeneralSecurityException {
        var certificates = handshakeCertificates(credential, host, verification);
        var builder = client.newBuilder().sslSocketFactory(certificates.sslSocketFactory(), certificates.trustManager());
        if (verification == PeerVerification.LOCAL_SELF_ISSUED) {
            logger.debug("Accepting the self-issued certificate of the local daemon at {}", host);
            builder.hostnameVerifier((hostname, session) -> hostname.equalsIgnoreCase(host));
        }
        return builder.build();
    }

    static void requireLoopback(String host) {
        if (!isLoopback(host)) {
            throw new IllegalArgumentException(
                    "Relaxed certificate verification is only allowed for loopback hosts, not " + host);
        }
    }

    public static boolean isLoopback(String host) {
        String h = host.toLowerCase(Locale.ROOT);
        if (h.startsWith("[") && h.endsWith("]")) {
            h = h.substring(1, h.length() - 1);
        }
        if (h.equals("localhost")) {
            return true;
        }
        // only literal addresses; never resolve names here
        if (!h.matches("[0-9.]+") && !h.contains(":")) {
            return false;
        }
        try {
            return InetAddress.getByName(h).isLoopbackAddress();
        } catch (UnknownHostException e) {
            logger.debug("Not a literal address: {}", host, e);
            return false;
        }
    }
}
