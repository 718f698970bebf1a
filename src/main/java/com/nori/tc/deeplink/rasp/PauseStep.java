package com.nori.tc.deeplink.rasp;

/**
 * pause: &lt;seconds&gt;
 * - 소수 허용, ms 단위로 보관
 */
public final class PauseStep implements RaspStep {

    private final long pauseMs;

    public PauseStep(long pauseMs) {
        if (pauseMs < 0) throw new IllegalArgumentException("pauseMs must be >= 0");
        this.pauseMs = pauseMs;
    }

    public long getPauseMs() {
        return pauseMs;
    }

    @Override
    public String kind() {
        return "pause";
    }

    @Override
    public String describe() {
        return "Wait " + (pauseMs % 1000 == 0 ? String.valueOf(pauseMs / 1000) : String.valueOf(pauseMs / 1000.0))
                + " seconds";
    }
}
