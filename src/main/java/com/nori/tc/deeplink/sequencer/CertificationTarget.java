package com.nori.tc.deeplink.sequencer;

import com.nori.tc.deeplink.beacon.BeaconCategory;
import com.nori.tc.deeplink.control.DeepLinkParams;

import java.util.Objects;

/**
 * run 1회의 테스트 대상/옵션(설정에서 변환된 불변 값).
 *
 * @param appId         대상 앱 id (예: dev)
 * @param content       deep link 파라미터
 * @param waitMs        phase별 beacon 대기 deadline
 * @param signedIn      sign-in 필요 여부(true면 scriptPath 필수)
 * @param scriptPath    sign-in RASP 스크립트 경로, 없으면 null
 * @param expectBeacon  모든 phase 대기에 AND 할 beacon, 없으면 null
 * @param failureLines  실패 phase에 붙일 최근 raw line 수
 */
public record CertificationTarget(String appId,
                                  DeepLinkParams content,
                                  long waitMs,
                                  boolean launchOnly,
                                  boolean inputOnly,
                                  boolean signedIn,
                                  String scriptPath,
                                  BeaconCategory expectBeacon,
                                  int failureLines) {

    public static final int DEFAULT_FAILURE_LINES = 10;

    public CertificationTarget {
        Objects.requireNonNull(appId, "appId must not be null");
        Objects.requireNonNull(content, "content must not be null");
        if (appId.isBlank()) throw new IllegalArgumentException("appId is blank");
        if (waitMs <= 0) throw new IllegalArgumentException("waitMs must be > 0");
        if (failureLines < 0) throw new IllegalArgumentException("failureLines must be >= 0");
        if (launchOnly && inputOnly) {
            throw new IllegalArgumentException("launchOnly and inputOnly are mutually exclusive");
        }
    }

    public boolean runsLaunchTest() {
        return !inputOnly;
    }

    public boolean runsInputTest() {
        return !launchOnly;
    }
}
