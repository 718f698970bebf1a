package com.nori.tc.deeplink.run;

import com.nori.tc.deeplink.beacon.BeaconStreamMonitor;
import com.nori.tc.deeplink.error.ConnectionException;
import com.nori.tc.deeplink.logging.StructuredLog;
import com.nori.tc.deeplink.netty.BeaconStreamClient;
import com.nori.tc.deeplink.runtime.HostPort;
import com.nori.tc.deeplink.sequencer.CertificationTarget;
import com.nori.tc.deeplink.sequencer.DeepLinkTestSequencer;
import com.nori.tc.deeplink.sequencer.SequenceResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * CertificationRunner
 *
 * 역할:
 * - 이벤트 스트림 연결을 열고 sequencer를 실행한 뒤 리포트를 만든다.
 *
 * 규칙:
 * - 연결은 try-with-resources로 모든 종료 경로에서 닫는다.
 * - 연결 실패는 phase 없이 CONNECTION 중단 리포트가 된다.
 */
public class CertificationRunner {

    private static final Logger log = LoggerFactory.getLogger(CertificationRunner.class);

    private final HostPort beaconEndpoint;
    private final long connectTimeoutMs;
    private final BeaconStreamMonitor monitor;
    private final DeepLinkTestSequencer sequencer;
    private final Clock wallClock;

    public CertificationRunner(HostPort beaconEndpoint,
                               long connectTimeoutMs,
                               BeaconStreamMonitor monitor,
                               DeepLinkTestSequencer sequencer,
                               Clock wallClock) {
        this.beaconEndpoint = Objects.requireNonNull(beaconEndpoint, "beaconEndpoint must not be null");
        this.connectTimeoutMs = connectTimeoutMs;
        this.monitor = Objects.requireNonNull(monitor, "monitor must not be null");
        this.sequencer = Objects.requireNonNull(sequencer, "sequencer must not be null");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock must not be null");
    }

    public CertificationReport run(CertificationTarget target, String testId) {
        CertificationReport.Configuration configuration =
                CertificationReport.Configuration.of(beaconEndpoint.host(), target);

        log.info(StructuredLog.event("certification_started",
                "target", beaconEndpoint.host(),
                "app", target.appId(),
                "contentId", target.content().contentId(),
                "mediaType", target.content().mediaType(),
                "testId", testId));

        try (BeaconStreamClient client = new BeaconStreamClient(beaconEndpoint, monitor, connectTimeoutMs)) {
            client.connect();
            SequenceResult result = sequencer.run(target);
            return CertificationReport.completed(result, testId, Instant.now(wallClock), configuration);
        } catch (ConnectionException e) {
            log.error(StructuredLog.event("certification_aborted", "kind", e.getKind(), "reason", e.getMessage()));
            return CertificationReport.aborted(e.getKind(), e.getMessage(), testId, Instant.now(wallClock),
                    configuration);
        }
    }
}
