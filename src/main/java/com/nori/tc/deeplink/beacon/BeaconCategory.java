package com.nori.tc.deeplink.beacon;

import java.util.List;
import java.util.Objects;

/**
 * 인증 beacon 종류.
 *
 * - 고정 vocabulary 6종 + 사용자 지정(custom) 이름
 * - 이름 자체가 디바이스 로그에 등장하는 literal token이다.
 */
public record BeaconCategory(String name) {

    public static final BeaconCategory APP_LAUNCH_COMPLETE = new BeaconCategory("AppLaunchComplete");
    public static final BeaconCategory APP_DIALOG_INITIATE = new BeaconCategory("AppDialogInitiate");
    public static final BeaconCategory VOD_START_INITIATE = new BeaconCategory("VODStartInitiate");
    public static final BeaconCategory VOD_START_COMPLETE = new BeaconCategory("VODStartComplete");
    public static final BeaconCategory LIVE_START_INITIATE = new BeaconCategory("LiveStartInitiate");
    public static final BeaconCategory LIVE_START_COMPLETE = new BeaconCategory("LiveStartComplete");

    public static final List<BeaconCategory> STANDARD = List.of(
            APP_LAUNCH_COMPLETE,
            APP_DIALOG_INITIATE,
            VOD_START_INITIATE,
            VOD_START_COMPLETE,
            LIVE_START_INITIATE,
            LIVE_START_COMPLETE);

    public BeaconCategory {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("beacon category name is blank");
        }
    }

    public static BeaconCategory of(String name) {
        String v = Objects.requireNonNull(name, "name must not be null").trim();
        for (BeaconCategory c : STANDARD) {
            if (c.name.equals(v)) {
                return c;
            }
        }
        return new BeaconCategory(v);
    }

    public boolean isStandard() {
        return STANDARD.contains(this);
    }

    @Override
    public String toString() {
        return name;
    }
}
