package com.nori.tc.deeplink.sequencer;

/**
 * 인증 테스트 phase.
 *
 * - displayName: 리포트/로그에 쓰는 이름
 */
public enum TestPhase {
    LAUNCH_TEST("Deep Link Launch Test"),
    INPUT_TEST("Deep Link Input Test");

    private final String displayName;

    TestPhase(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
