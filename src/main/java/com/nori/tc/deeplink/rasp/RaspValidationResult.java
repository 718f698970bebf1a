package com.nori.tc.deeplink.rasp;

import java.util.List;

/**
 * 검증 결과.
 *
 * @param valid                    errors가 비어 있으면 true
 * @param errors                   발견된 모든 오류(발견 순서)
 * @param stepCount                steps 항목 수(구조 오류면 0)
 * @param estimatedDurationSeconds 예상 실행 시간(초, 올림)
 */
public record RaspValidationResult(boolean valid,
                                   List<String> errors,
                                   int stepCount,
                                   long estimatedDurationSeconds) {

    public RaspValidationResult {
        errors = List.copyOf(errors);
    }

    static RaspValidationResult of(List<String> errors, int stepCount, long estimatedDurationSeconds) {
        return new RaspValidationResult(errors.isEmpty(), errors, stepCount, estimatedDurationSeconds);
    }
}
