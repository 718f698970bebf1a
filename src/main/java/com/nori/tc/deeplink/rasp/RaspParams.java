package com.nori.tc.deeplink.rasp;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * params 섹션.
 *
 * - version: rasp_version (없으면 null)
 * - defaultStepDelayMs: default_keypress_wait(초) 환산, 미지정 시 1000ms
 * - channels: 이름 -> device app id
 */
public final class RaspParams {

    public static final long DEFAULT_STEP_DELAY_MS = 1000;

    public static final RaspParams DEFAULTS = new RaspParams(null, DEFAULT_STEP_DELAY_MS, Map.of());

    private final Double version;
    private final long defaultStepDelayMs;
    private final Map<String, String> channels;

    public RaspParams(Double version, long defaultStepDelayMs, Map<String, String> channels) {
        if (defaultStepDelayMs < 0) throw new IllegalArgumentException("defaultStepDelayMs must be >= 0");
        this.version = version;
        this.defaultStepDelayMs = defaultStepDelayMs;
        this.channels = Collections.unmodifiableMap(new LinkedHashMap<>(channels));
    }

    public Double getVersion() {
        return version;
    }

    public long getDefaultStepDelayMs() {
        return defaultStepDelayMs;
    }

    public Map<String, String> getChannels() {
        return channels;
    }

    /**
     * channel 이름을 app id로 해석한다. 매핑이 없으면 ref 자체가 app id다.
     */
    public String resolveChannel(String ref) {
        String mapped = channels.get(ref);
        return (mapped == null || mapped.isBlank()) ? ref : mapped;
    }
}
