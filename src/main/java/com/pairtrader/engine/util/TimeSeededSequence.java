package com.pairtrader.engine.util;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Strictly increasing ids derived from the wall clock in microseconds. Two calls in the
 * same microsecond still get distinct values.
 */
public class TimeSeededSequence {

    private final AtomicLong last = new AtomicLong();

    public long next() {
        long nowMicros = System.currentTimeMillis() * 1000;
        return last.updateAndGet(previous -> Math.max(previous + 1, nowMicros));
    }
}
