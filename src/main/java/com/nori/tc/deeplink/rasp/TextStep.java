package com.nori.tc.deeplink.rasp;

import java.util.Objects;

/**
 * text: &lt;value&gt;
 * - "script-" 로 시작하면 secret placeholder
 */
public final class TextStep implements RaspStep {

    private final String value;

    public TextStep(String value) {
        this.value = Objects.requireNonNull(value, "value must not be null");
        if (value.isEmpty()) throw new IllegalArgumentException("text value is empty");
    }

    public String getValue() {
        return value;
    }

    public boolean isPlaceholder() {
        return SecretPlaceholders.isPlaceholder(value);
    }

    @Override
    public String kind() {
        return "text";
    }

    @Override
    public String describe() {
        return "Enter text: " + value;
    }
}
