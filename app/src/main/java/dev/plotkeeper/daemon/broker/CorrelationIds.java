package dev.plotkeeper.daemon.broker;

import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.Random;
import java.util.function.Predicate;

/** 128-bit random request ids, rendered as 32 lowercase hex digits. */
final class CorrelationIds {
    private static final int ID_BYTES = 16;

    private final Random random;

    CorrelationIds() {
        this(new SecureRandom());
    }

    CorrelationIds(Random random) {
        this.random = random;
    }

    /** Returns an id for which {@code inUse} is false. */
    String next(Predicate<String> inUse) {
        var bytes = new byte[ID_BYTES];
        String id;
        do {
            random.nextBytes(bytes);
            id = HexFormat.of().formatHex(bytes);
        } while (inUse.test(id));
        return id;
    }
}
