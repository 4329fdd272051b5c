package com.zzf.localagent.util;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Id generator for snapshots and tasks.
 */
public final class Identifier {

    private static final AtomicLong LAST_MILLIS = new AtomicLong(0L);

    private Identifier() {}

    /**
     * Id derived from the current epoch millis. Strictly increasing within the process:
     * two calls in the same millisecond get consecutive values.
     */
    public static String timeOrdered(String prefix) {
        long now = System.currentTimeMillis();
        long value = LAST_MILLIS.updateAndGet(prev -> Math.max(prev + 1, now));
        return prefix + "_" + value;
    }

    public static String random(String prefix) {
        return prefix + "_" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }
}
