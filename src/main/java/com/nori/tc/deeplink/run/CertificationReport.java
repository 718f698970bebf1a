package com.nori.tc.deeplink.run;

import com.nori.tc.deeplink.error.ErrorKind;
import com.nori.tc.deeplink.sequencer.CertificationTarget;
import com.nori.tc.deeplink.sequencer.PhaseResult;
import com.nori.tc.deeplink.sequencer.PhaseStatus;
import com.nori.tc.deeplink.sequencer.SequenceResult;

import java.time.Instant;
import java.util.List;

/**
 * run 1회의 최종 결과.
 *
 * 집계 규칙:
 * - SKIPPED phase는 phases에는 남지만 total/passed/failed에는 세지 않는다.
 * - success = 중단 없음 && total > 0 && passed == total
 *
 * @param signInDurationMs sign-in을 하지 않았으면 null
 * @param abortKind        중단되지 않았으면 null
 */
public record CertificationReport(boolean success,
                                  int totalTests,
                                  int passedTests,
                                  int failedTests,
                                  List<PhaseResult> phases,
                                  Long signInDurationMs,
                                  String testId,
                                  Instant timestamp,
                                  Configuration configuration,
                                  ErrorKind abortKind,
                                  String abortMessage) {

    public CertificationReport {
        phases = List.copyOf(phases);
    }

    /**
     * 리포트에 그대로 싣는 설정 요약.
     */
    public record Configuration(String host,
                                String app,
                                String contentId,
                                String mediaType,
                                boolean signedIn,
                                long waitSec,
                                List<String> expectedBeacons) {

        public Configuration {
            expectedBeacons = List.copyOf(expectedBeacons);
        }

        public static Configuration of(String host, CertificationTarget target) {
            return new Configuration(host,
                    target.appId(),
                    target.content().contentId(),
                    target.content().mediaType(),
                    target.signedIn(),
                    target.waitMs() / 1000,
                    target.expectBeacon() != null ? List.of(target.expectBeacon().name()) : List.of());
        }
    }

    static CertificationReport completed(SequenceResult result, String testId, Instant timestamp,
                                         Configuration configuration) {
        List<PhaseResult> phases = result.phases();
        int total = (int) phases.stream().filter(p -> p.getStatus() != PhaseStatus.SKIPPED).count();
        int passed = (int) phases.stream().filter(PhaseResult::isPassed).count();
        boolean success = !result.aborted() && total > 0 && passed == total;
        return new CertificationReport(success, total, passed, total - passed, phases,
                result.signInDurationMs(), testId, timestamp, configuration,
                result.abortKind(), result.abortMessage());
    }

    static CertificationReport aborted(ErrorKind kind, String message, String testId, Instant timestamp,
                                       Configuration configuration) {
        return new CertificationReport(false, 0, 0, 0, List.of(), null, testId, timestamp, configuration,
                kind, message);
    }

    public boolean aborted() {
        return abortKind != null;
    }
}
