package com.nori.tc.deeplink.sequencer;

import com.nori.tc.deeplink.error.ErrorKind;

import java.util.List;

/**
 * sequencer 실행 결과.
 *
 * @param phases           실행(또는 SKIPPED 기록)된 phase 순서대로
 * @param signInDurationMs sign-in을 하지 않았으면 null
 * @param abortKind        run이 중단되었으면 원인 분류, 정상 종료면 null
 * @param abortMessage     중단 사유
 */
public record SequenceResult(List<PhaseResult> phases,
                             Long signInDurationMs,
                             ErrorKind abortKind,
                             String abortMessage) {

    public SequenceResult {
        phases = List.copyOf(phases);
    }

    public boolean aborted() {
        return abortKind != null;
    }
}
