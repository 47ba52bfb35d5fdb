package com.jarvis.core.events;

import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Generates time-ordered identifiers: {@code <prefix>_<base36 millis>_<16 hex>}.
 */
public final class EventIds {

    private static final SecureRandom RANDOM = new SecureRandom();

    private EventIds() {}

    public static String newEventId() {
        return next("evt");
    }

    public static String newTraceId() {
        return next("tr");
    }

    private static String next(String prefix) {
        byte[] suffix = new byte[8];
        RANDOM.nextBytes(suffix);
        return prefix + "_" + Long.toString(System.currentTimeMillis(), 36) + "_" + HexFormat.of().formatHex(suffix);
    }
}
