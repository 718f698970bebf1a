package com.nori.tc.deeplink.beacon;

import java.util.Objects;

/**
 * 한 레코드에서 추출된 beacon 1건.
 *
 * @param category 매칭된 beacon
 * @param timingMs Duration/TimeBase 값(ms), 필드가 없으면 null
 */
public record BeaconSighting(BeaconCategory category, Long timingMs) {

    public BeaconSighting {
        Objects.requireNonNull(category, "category must not be null");
    }
}
