package com.nori.tc.deeplink.sequencer;

import com.nori.tc.deeplink.beacon.BeaconCategory;
import com.nori.tc.deeplink.error.ErrorKind;
import com.nori.tc.deeplink.wait.ContentType;
import com.nori.tc.deeplink.wait.WaitOutcome;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * phase 1회 실행 결과.
 *
 * - PASSED: timingAnalysis 포함
 * - FAILED: errorKind/errorMessage, missing, 최근 raw line(진단용) 포함
 * - SKIPPED: errorMessage에 사유
 */
public final class PhaseResult {

    public static final String SEND_FAILED_MESSAGE = "Failed to send ECP command";

    private final TestPhase phase;
    private final PhaseStatus status;
    private final long durationMs;
    private final List<String> expectedConditions;
    private final List<BeaconCategory> beaconsFound;
    private final List<String> missing;
    private final ContentType contentType;
    private final Map<BeaconCategory, Long> timings;
    private final TimingAnalysis timingAnalysis;
    private final List<String> recentLines;
    private final ErrorKind errorKind;
    private final String errorMessage;

    private PhaseResult(TestPhase phase,
                        PhaseStatus status,
                        long durationMs,
                        List<String> expectedConditions,
                        List<BeaconCategory> beaconsFound,
                        List<String> missing,
                        ContentType contentType,
                        Map<BeaconCategory, Long> timings,
                        TimingAnalysis timingAnalysis,
                        List<String> recentLines,
                        ErrorKind errorKind,
                        String errorMessage) {
        this.phase = Objects.requireNonNull(phase, "phase must not be null");
        this.status = Objects.requireNonNull(status, "status must not be null");
        this.durationMs = durationMs;
        this.expectedConditions = List.copyOf(expectedConditions);
        this.beaconsFound = List.copyOf(beaconsFound);
        this.missing = List.copyOf(missing);
        this.contentType = contentType;
        // timing 값은 null일 수 있어 Map.copyOf 대신 복사
        this.timings = Collections.unmodifiableMap(new LinkedHashMap<>(timings));
        this.timingAnalysis = timingAnalysis;
        this.recentLines = List.copyOf(recentLines);
        this.errorKind = errorKind;
        this.errorMessage = errorMessage;
    }

    /**
     * 대기 결과로 phase 결과를 만든다. 실패면 recentLines를 붙이고, 성공이면 timing 분석을 붙인다.
     */
    static PhaseResult fromWait(TestPhase phase,
                                List<String> expectedConditions,
                                WaitOutcome outcome,
                                Map<BeaconCategory, Long> timings,
                                List<String> recentLines) {
        if (outcome.passed()) {
            return new PhaseResult(phase, PhaseStatus.PASSED, outcome.durationMs(), expectedConditions,
                    outcome.beaconsFound(), List.of(), outcome.contentType(), timings,
                    TimingAnalysis.from(timings), List.of(), null, null);
        }
        return new PhaseResult(phase, PhaseStatus.FAILED, outcome.durationMs(), expectedConditions,
                outcome.beaconsFound(), outcome.missing(), outcome.contentType(), timings,
                null, recentLines, outcome.errorKind(), outcome.errorMessage());
    }

    static PhaseResult commandFailed(TestPhase phase,
                                     List<String> expectedConditions,
                                     String cause,
                                     List<String> recentLines) {
        String message = cause == null ? SEND_FAILED_MESSAGE : SEND_FAILED_MESSAGE + ": " + cause;
        return new PhaseResult(phase, PhaseStatus.FAILED, 0, expectedConditions, List.of(), List.of(), null,
                Map.of(), null, recentLines, ErrorKind.COMMAND, message);
    }

    static PhaseResult skipped(TestPhase phase, List<String> expectedConditions, String reason) {
        return new PhaseResult(phase, PhaseStatus.SKIPPED, 0, expectedConditions, List.of(), List.of(), null,
                Map.of(), null, List.of(), null, reason);
    }

    public TestPhase getPhase() {
        return phase;
    }

    public PhaseStatus getStatus() {
        return status;
    }

    public boolean isPassed() {
        return status == PhaseStatus.PASSED;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public List<String> getExpectedConditions() {
        return expectedConditions;
    }

    public List<BeaconCategory> getBeaconsFound() {
        return beaconsFound;
    }

    public List<String> getMissing() {
        return missing;
    }

    public ContentType getContentType() {
        return contentType;
    }

    public Map<BeaconCategory, Long> getTimings() {
        return timings;
    }

    /** PASSED가 아니면 null */
    public TimingAnalysis getTimingAnalysis() {
        return timingAnalysis;
    }

    public List<String> getRecentLines() {
        return recentLines;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    @Override
    public String toString() {
        return phase.getDisplayName() + "[" + status + (errorMessage != null ? ": " + errorMessage : "") + "]";
    }
}
