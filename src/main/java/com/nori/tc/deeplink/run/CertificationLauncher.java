package com.nori.tc.deeplink.run;

import com.nori.tc.deeplink.config.DeepLinkProperties;
import com.nori.tc.deeplink.logging.StructuredLog;
import com.nori.tc.deeplink.rasp.RaspScriptValidator;
import com.nori.tc.deeplink.rasp.RaspValidationResult;
import com.nori.tc.deeplink.sequencer.PhaseResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;

import java.util.Objects;

/**
 * CertificationLauncher
 *
 * 역할:
 * - 컨텍스트 기동 후 mode에 따라 인증 run 또는 스크립트 검증을 1회 수행한다.
 * - 결과를 요약 로그로 남기고 종료 코드를 정한다(성공/유효 0, 그 외 1).
 *
 * 주의:
 * - 설정 검증 실패(IllegalArgumentException)는 그대로 전파되어 기동 실패가 된다.
 */
public class CertificationLauncher implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CertificationLauncher.class);

    private final DeepLinkProperties props;
    private final CertificationRunner runner;
    private final RaspScriptValidator validator;

    private volatile int exitCode = 1;
    private volatile CertificationReport lastReport;

    public CertificationLauncher(DeepLinkProperties props,
                                 CertificationRunner runner,
                                 RaspScriptValidator validator) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.runner = Objects.requireNonNull(runner, "runner must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
    }

    @Override
    public void run(ApplicationArguments args) {
        props.validate();

        if (props.getMode() == DeepLinkProperties.Mode.VALIDATE_SCRIPT) {
            exitCode = validateScript() ? 0 : 1;
            return;
        }

        CertificationReport report = runner.run(props.toTarget(), props.getTestId());
        lastReport = report;
        logSummary(report);
        exitCode = report.success() ? 0 : 1;
    }

    private boolean validateScript() {
        RaspValidationResult result = validator.validate(props.getScript());
        if (result.valid()) {
            log.info(StructuredLog.event("rasp_script_valid",
                    "script", props.getScript(),
                    "steps", result.stepCount(),
                    "estimatedDurationSec", result.estimatedDurationSeconds()));
        } else {
            log.error(StructuredLog.event("rasp_script_invalid",
                    "script", props.getScript(),
                    "errorCount", result.errors().size()));
            for (String error : result.errors()) {
                log.error(StructuredLog.event("rasp_script_error", "error", error));
            }
        }
        return result.valid();
    }

    private static void logSummary(CertificationReport report) {
        for (PhaseResult phase : report.phases()) {
            log.info(StructuredLog.event("phase_summary",
                    "phase", phase.getPhase().getDisplayName(),
                    "status", phase.getStatus(),
                    "durationMs", phase.getDurationMs(),
                    "found", phase.getBeaconsFound(),
                    "missing", phase.getMissing(),
                    "error", phase.getErrorMessage()));
            for (String line : phase.getRecentLines()) {
                log.info(StructuredLog.event("phase_recent_line", "phase", phase.getPhase().getDisplayName(),
                        "line", line));
            }
        }
        String msg = StructuredLog.event("certification_summary",
                "success", report.success(),
                "total", report.totalTests(),
                "passed", report.passedTests(),
                "failed", report.failedTests(),
                "signInMs", report.signInDurationMs(),
                "testId", report.testId(),
                "abortKind", report.abortKind(),
                "abortMessage", report.abortMessage());
        if (report.success()) {
            log.info(msg);
        } else {
            log.error(msg);
        }
    }

    /** 마지막 run 리포트, CERTIFY 모드로 실행되지 않았으면 null */
    public CertificationReport getLastReport() {
        return lastReport;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
