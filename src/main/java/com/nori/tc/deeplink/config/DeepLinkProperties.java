package com.nori.tc.deeplink.config;

import com.nori.tc.deeplink.beacon.BeaconCategory;
import com.nori.tc.deeplink.beacon.BeaconStreamMonitor;
import com.nori.tc.deeplink.control.DeepLinkParams;
import com.nori.tc.deeplink.runtime.HostPort;
import com.nori.tc.deeplink.sequencer.CertificationTarget;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * tc.deeplink.*
 *
 * 목적:
 * - 인증 테스트 run 1회의 설정을 하나의 루트로 바인딩한다.
 * - application.yml 기본값 + 커맨드라인(--tc.deeplink.device.host=...) 덮어쓰기.
 *
 * 검증({@link #validate()}):
 * - signed-in이면 script 필수
 * - device.host는 a.b.c.d 형식
 * - launch-only / input-only 동시 지정 불가
 * - VALIDATE_SCRIPT 모드는 script 필수
 * 위반 시 디바이스 I/O 전에 IllegalArgumentException.
 */
@ConfigurationProperties(prefix = "tc.deeplink")
public class DeepLinkProperties {

    public enum Mode {
        /** 디바이스 대상 인증 테스트 */
        CERTIFY,
        /** RASP 스크립트 오프라인 검증 */
        VALIDATE_SCRIPT
    }

    private Mode mode = Mode.CERTIFY;

    private Device device = new Device();

    private Diagnostics diagnostics = new Diagnostics();

    /** 대상 앱 id (sideload 앱은 dev) */
    private String app = "dev";

    private String contentId = "1234";

    /** movie / episode면 영상 재생 beacon이 필요하다 */
    private String mediaType = "movie";

    /** phase별 beacon 대기 시간(초) */
    private long waitSec = 30;

    private boolean launchOnly = false;

    private boolean inputOnly = false;

    /** true면 테스트 전에 RASP 스크립트로 sign-in */
    private boolean signedIn = false;

    /** RASP 스크립트 경로 */
    private String script;

    /** 모든 phase에서 추가로 기다릴 beacon 이름 */
    private String expectBeacon;

    /** 리포트에 그대로 싣는 식별자 */
    private String testId;

    /** 디바이스 로그 중 관심 라인을 info로 남긴다 */
    private boolean verbose = false;

    public void validate() {
        if (mode == Mode.VALIDATE_SCRIPT) {
            if (isBlank(script)) {
                throw new IllegalArgumentException("tc.deeplink.script is required in VALIDATE_SCRIPT mode");
            }
            return;
        }
        if (signedIn && isBlank(script)) {
            throw new IllegalArgumentException(
                    "Signed-in mode requires a RASP script. Set tc.deeplink.script=path/to/signin.rasp");
        }
        if (!HostPort.isDottedIpv4(device.getHost())) {
            throw new IllegalArgumentException("Invalid device IP address format: " + device.getHost());
        }
        if (launchOnly && inputOnly) {
            throw new IllegalArgumentException("tc.deeplink.launch-only and tc.deeplink.input-only are mutually exclusive");
        }
        if (waitSec <= 0) {
            throw new IllegalArgumentException("tc.deeplink.wait-sec must be > 0");
        }
    }

    public HostPort controlEndpoint() {
        return new HostPort(device.getHost().trim(), device.getControlPort());
    }

    public HostPort beaconEndpoint() {
        return new HostPort(device.getHost().trim(), device.getBeaconPort());
    }

    public CertificationTarget toTarget() {
        return new CertificationTarget(
                app,
                new DeepLinkParams(contentId, mediaType),
                waitSec * 1000L,
                launchOnly,
                inputOnly,
                signedIn,
                isBlank(script) ? null : script,
                isBlank(expectBeacon) ? null : BeaconCategory.of(expectBeacon.trim()),
                diagnostics.getFailureLines());
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    // getters/setters

    public Mode getMode() {
        return mode;
    }

    public void setMode(Mode mode) {
        this.mode = mode;
    }

    public Device getDevice() {
        return device;
    }

    public void setDevice(Device device) {
        this.device = device;
    }

    public Diagnostics getDiagnostics() {
        return diagnostics;
    }

    public void setDiagnostics(Diagnostics diagnostics) {
        this.diagnostics = diagnostics;
    }

    public String getApp() {
        return app;
    }

    public void setApp(String app) {
        this.app = app;
    }

    public String getContentId() {
        return contentId;
    }

    public void setContentId(String contentId) {
        this.contentId = contentId;
    }

    public String getMediaType() {
        return mediaType;
    }

    public void setMediaType(String mediaType) {
        this.mediaType = mediaType;
    }

    public long getWaitSec() {
        return waitSec;
    }

    public void setWaitSec(long waitSec) {
        this.waitSec = waitSec;
    }

    public boolean isLaunchOnly() {
        return launchOnly;
    }

    public void setLaunchOnly(boolean launchOnly) {
        this.launchOnly = launchOnly;
    }

    public boolean isInputOnly() {
        return inputOnly;
    }

    public void setInputOnly(boolean inputOnly) {
        this.inputOnly = inputOnly;
    }

    public boolean isSignedIn() {
        return signedIn;
    }

    public void setSignedIn(boolean signedIn) {
        this.signedIn = signedIn;
    }

    public String getScript() {
        return script;
    }

    public void setScript(String script) {
        this.script = script;
    }

    public String getExpectBeacon() {
        return expectBeacon;
    }

    public void setExpectBeacon(String expectBeacon) {
        this.expectBeacon = expectBeacon;
    }

    public String getTestId() {
        return testId;
    }

    public void setTestId(String testId) {
        this.testId = testId;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public void setVerbose(boolean verbose) {
        this.verbose = verbose;
    }

    /**
     * 디바이스 주소 그룹
     */
    public static class Device {

        private String host = "192.168.1.114";

        /** ECP(HTTP) 포트 */
        private int controlPort = 8060;

        /** 이벤트 스트림(telnet) 포트 */
        private int beaconPort = 8085;

        private long connectTimeoutSec = 10;

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public int getControlPort() {
            return controlPort;
        }

        public void setControlPort(int controlPort) {
            this.controlPort = controlPort;
        }

        public int getBeaconPort() {
            return beaconPort;
        }

        public void setBeaconPort(int beaconPort) {
            this.beaconPort = beaconPort;
        }

        public long getConnectTimeoutSec() {
            return connectTimeoutSec;
        }

        public void setConnectTimeoutSec(long connectTimeoutSec) {
            this.connectTimeoutSec = connectTimeoutSec;
        }
    }

    /**
     * 실패 진단용 raw line 버퍼 설정
     */
    public static class Diagnostics {

        private int logBufferSize = BeaconStreamMonitor.DEFAULT_LOG_BUFFER_SIZE;

        private int failureLines = CertificationTarget.DEFAULT_FAILURE_LINES;

        public int getLogBufferSize() {
            return logBufferSize;
        }

        public void setLogBufferSize(int logBufferSize) {
            this.logBufferSize = logBufferSize;
        }

        public int getFailureLines() {
            return failureLines;
        }

        public void setFailureLines(int failureLines) {
            this.failureLines = failureLines;
        }
    }
}
