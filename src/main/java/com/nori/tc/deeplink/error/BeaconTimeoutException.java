package com.nori.tc.deeplink.error;

import java.util.List;

/**
 * deadline 안에 필요한 beacon 조건이 모두 충족되지 않은 경우.
 */
public class BeaconTimeoutException extends DeepLinkCertException {

    private final long elapsedMs;
    private final List<String> missing;

    public BeaconTimeoutException(long elapsedMs, List<String> missing) {
        super(ErrorKind.BEACON_TIMEOUT, "Timeout after " + elapsedMs + "ms. Missing: " + String.join(", ", missing));
        this.elapsedMs = elapsedMs;
        this.missing = List.copyOf(missing);
    }

    public long getElapsedMs() {
        return elapsedMs;
    }

    public List<String> getMissing() {
        return missing;
    }
}
