package com.nori.tc.deeplink.sequencer;

public enum PhaseStatus {
    PASSED,
    FAILED,
    /** 전제 조건(앱 정상 실행) 실패로 실행하지 않음. 테스트 수에 포함하지 않는다. */
    SKIPPED
}
