package dev.plotkeeper.daemon.channel;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.security.interfaces.ECPrivateKey;
import java.security.interfaces.RSAPrivateKey;
import java.security.spec.InvalidKeySpecException;
import okhttp3.tls.HeldCertificate;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class PemFilesTest {
    @TempDir
    Path dir;

    private static final HeldCertificate RSA = new HeldCertificate.Builder()
            .rsa2048()
            .commonName("wallet_ui")
            .build();

    @Test
    void testReadsPkcs1RsaKeyAsWrittenByTheDaemon() throws Exception {
        var file = dir.resolve("private_daemon.key");
        Files.writeString(file, RSA.privateKeyPkcs1Pem());

        var key = assertInstanceOf(RSAPrivateKey.class, PemFiles.readPrivateKey(file));

        var expected = (RSAPrivateKey) RSA.keyPair().getPrivate();
        assertEquals(expected.getModulus(), key.getModulus());
        assertEquals(expected.getPrivateExponent(), key.getPrivateExponent());
    }

    @Test
    void testReadsPkcs8RsaKey() throws Exception {
        var file = dir.resolve("pkcs8.key");
        Files.writeString(file, RSA.privateKeyPkcs8Pem());

        var key = assertInstanceOf(RSAPrivateKey.class, PemFiles.readPrivateKey(file));
        assertEquals(((RSAPrivateKey) RSA.keyPair().getPrivate()).getModulus(), key.getModulus());
    }

    @Test
    void testReadsPkcs8EcKey() throws Exception {
        var ec = new HeldCertificate.Builder().ecdsa256().build();
        var file = dir.resolve("ec.key");
        Files.writeString(file, ec.privateKeyPkcs8Pem());

        assertInstanceOf(ECPrivateKey.class, PemFiles.readPrivateKey(file));
    }

    @Test
    void testSkipsCertificateBundledBeforeKey() throws Exception {
        var file = dir.resolve("bundle.pem");
        Files.writeString(file, RSA.certificatePem() + RSA.privateKeyPkcs1Pem());

        assertInstanceOf(RSAPrivateKey.class, PemFiles.readPrivateKey(file));
    }

    @Test
    void testFileWithoutKeyIsRejected() throws Exception {
        var file = dir.resolve("cert-only.pem");
        Files.writeString(file, RSA.certificatePem());

        assertThrows(InvalidKeySpecException.class, () -> PemFiles.readPrivateKey(file));
    }

    @Test
    void testReadsCertificate() throws Exception {
        var file = dir.resolve("private_daemon.crt");
        Files.writeString(file, RSA.certificatePem());

        var certificate = PemFiles.readCertificate(file);

        assertEquals(RSA.certificate(), certificate);
    }

    @Test
    void testWrapPkcs1UsesLongFormLengths() {
        var body = new byte[300];
        var wrapped = PemFiles.wrapPkcs1(body);

        assertEquals(0x30, wrapped[0]);
        // 300 + 3 + 15 + 4 octet string header = 322 content bytes, two length octets
        assertEquals((byte) 0x82, wrapped[1]);
        assertEquals(322, ((wrapped[2] & 0xff) << 8) | (wrapped[3] & 0xff));
        assertEquals(wrapped.length, 4 + 322);
    }
}
