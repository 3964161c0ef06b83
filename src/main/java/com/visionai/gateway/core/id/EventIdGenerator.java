package com.visionai.gateway.core.id;

import java.security.SecureRandom;
import java.util.Random;
import java.util.function.LongSupplier;

/**
 * Generates event ids of the form {@code event_<epochMillis>_<9 base-36 chars>}.
 *
 * <p>Uniqueness comes from the time component combined with roughly 46 bits of randomness; collisions are
 * negligible, not impossible.</p>
 */
public final class EventIdGenerator {

    private static final String PREFIX = "event_";
    private static final int RANDOM_LENGTH = 9;
    private static final char[] BASE36 = "0123456789abcdefghijklmnopqrstuvwxyz".toCharArray();

    private final LongSupplier millis;
    private final Random random;

    public EventIdGenerator() {
        this(System::currentTimeMillis, new SecureRandom());
    }

    public EventIdGenerator(LongSupplier millis, Random random) {
        this.millis = millis;
        this.random = random;
    }

    public String next() {
        StringBuilder sb = new StringBuilder(PREFIX.length() + 14 + 1 + RANDOM_LENGTH);
        sb.append(PREFIX).append(millis.getAsLong()).append('_');
        synchronized (random) {
            for (int i = 0; i < RANDOM_LENGTH; i++) {
                sb.append(BASE36[random.nextInt(BASE36.length)]);
            }
        }
        return sb.toString();
    }
}
