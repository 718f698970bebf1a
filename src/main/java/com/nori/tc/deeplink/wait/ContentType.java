package com.nori.tc.deeplink.wait;

import com.nori.tc.deeplink.beacon.BeaconCategory;

import java.util.List;

/**
 * 영상 재생 beacon 쌍으로 판별한 컨텐츠 종류.
 *
 * - 확인 순서는 선언 순서(VOD -> LIVE)이다.
 */
public enum ContentType {

    VOD("VOD", BeaconCategory.VOD_START_INITIATE, BeaconCategory.VOD_START_COMPLETE),
    LIVE("Live", BeaconCategory.LIVE_START_INITIATE, BeaconCategory.LIVE_START_COMPLETE);

    private final String label;
    private final BeaconCategory initiate;
    private final BeaconCategory complete;

    ContentType(String label, BeaconCategory initiate, BeaconCategory complete) {
        this.label = label;
        this.initiate = initiate;
        this.complete = complete;
    }

    public String getLabel() {
        return label;
    }

    public BeaconCategory getInitiate() {
        return initiate;
    }

    public BeaconCategory getComplete() {
        return complete;
    }

    public List<BeaconCategory> pair() {
        return List.of(initiate, complete);
    }
}
