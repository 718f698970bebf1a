package com.nori.tc.deeplink.rasp;

import java.util.Objects;

/**
 * press: &lt;keyToken&gt;
 */
public final class PressStep implements RaspStep {

    private final String keyToken;

    public PressStep(String keyToken) {
        this.keyToken = Objects.requireNonNull(keyToken, "keyToken must not be null");
        if (keyToken.isBlank()) throw new IllegalArgumentException("keyToken is blank");
    }

    public String getKeyToken() {
        return keyToken;
    }

    @Override
    public String kind() {
        return "press";
    }

    @Override
    public String describe() {
        return "Press key: " + keyToken;
    }
}
