package com.nori.tc.deeplink.time;

import java.util.concurrent.TimeUnit;

/**
 * System.nanoTime / Thread.sleep 기반 운영 구현.
 */
public enum SystemTime implements MonotonicClock, Sleeper {

    INSTANCE;

    @Override
    public long nowMs() {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime());
    }

    @Override
    public void sleep(long millis) throws InterruptedException {
        if (millis > 0) {
            Thread.sleep(millis);
        }
    }
}
