package com.nori.tc.deeplink.rasp;

import java.util.Objects;

/**
 * launch: &lt;channelRef&gt;
 * - channelRef는 params.channels로 해석, 없으면 그대로 app id로 사용
 */
public final class LaunchStep implements RaspStep {

    private final String channelRef;

    public LaunchStep(String channelRef) {
        this.channelRef = Objects.requireNonNull(channelRef, "channelRef must not be null");
        if (channelRef.isBlank()) throw new IllegalArgumentException("channelRef is blank");
    }

    public String getChannelRef() {
        return channelRef;
    }

    @Override
    public String kind() {
        return "launch";
    }

    @Override
    public String describe() {
        return "Launch channel: " + channelRef;
    }
}
