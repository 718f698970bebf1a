package com.nori.tc.deeplink.sequencer;

import com.nori.tc.deeplink.beacon.BeaconCategory;
import com.nori.tc.deeplink.beacon.BeaconStreamMonitor;
import com.nori.tc.deeplink.control.CommandDispatcher;
import com.nori.tc.deeplink.control.DeepLinkParams;
import com.nori.tc.deeplink.error.CommandException;
import com.nori.tc.deeplink.error.ConnectionException;
import com.nori.tc.deeplink.error.ErrorKind;
import com.nori.tc.deeplink.error.ScriptException;
import com.nori.tc.deeplink.logging.StructuredLog;
import com.nori.tc.deeplink.rasp.RaspScript;
import com.nori.tc.deeplink.rasp.RaspScriptParser;
import com.nori.tc.deeplink.rasp.RaspScriptRunner;
import com.nori.tc.deeplink.time.MonotonicClock;
import com.nori.tc.deeplink.time.Sleeper;
import com.nori.tc.deeplink.wait.BeaconWaitCoordinator;
import com.nori.tc.deeplink.wait.WaitOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * DeepLinkTestSequencer
 *
 * 흐름:
 * <pre>
 * [sign-in?] -> settle 3s -> [LaunchTest?] -> settle 3s -> [InputTest?]
 * </pre>
 *
 * 규칙:
 * - 매 대기 전에 monitor.reset() 후 baseline snapshot을 잡는다.
 * - LaunchTest의 launch 명령 자체가 실패하면 run을 중단한다(InputTest 없음).
 * - InputTest 전제(앱 정상 실행) 실패는 InputTest를 SKIPPED로 기록한다.
 * - ConnectionException / ScriptException은 즉시 중단, 그때까지의 phase 결과를 돌려준다.
 *
 * 주의:
 * - beacon 스트림 연결은 호출자(CertificationRunner)가 소유한다.
 */
public class DeepLinkTestSequencer {

    private static final Logger log = LoggerFactory.getLogger(DeepLinkTestSequencer.class);

    public static final long SIGN_IN_SETTLE_MS = 3000;
    public static final long PRE_TEST_SETTLE_MS = 3000;
    public static final long POST_LAUNCH_SETTLE_MS = 3000;
    public static final long HOME_SETTLE_MS = 2000;
    public static final long INPUT_STABILITY_MS = 2000;
    public static final long WARM_UP_MAX_WAIT_MS = 30_000;

    public static final String HOME_KEY = "Home";

    private final CommandDispatcher dispatcher;
    private final BeaconStreamMonitor monitor;
    private final BeaconWaitCoordinator coordinator;
    private final RaspScriptRunner scriptRunner;
    private final MonotonicClock clock;
    private final Sleeper sleeper;

    public DeepLinkTestSequencer(CommandDispatcher dispatcher,
                                 BeaconStreamMonitor monitor,
                                 BeaconWaitCoordinator coordinator,
                                 RaspScriptRunner scriptRunner,
                                 MonotonicClock clock,
                                 Sleeper sleeper) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.monitor = Objects.requireNonNull(monitor, "monitor must not be null");
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator must not be null");
        this.scriptRunner = Objects.requireNonNull(scriptRunner, "scriptRunner must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    public SequenceResult run(CertificationTarget target) {
        List<PhaseResult> phases = new ArrayList<>();
        Long signInMs = null;

        if (target.expectBeacon() != null) {
            monitor.registerCustomCategory(target.expectBeacon());
        }

        log.info(StructuredLog.event("sequence_started",
                "app", target.appId(),
                "contentId", target.content().contentId(),
                "mediaType", target.content().mediaType(),
                "signedIn", target.signedIn(),
                "launchTest", target.runsLaunchTest(),
                "inputTest", target.runsInputTest()));

        try {
            if (target.signedIn()) {
                signInMs = signIn(target);
            }

            pause(PRE_TEST_SETTLE_MS);
            log.info(StructuredLog.event("sequence_ready"));

            if (target.runsLaunchTest()) {
                PhaseResult launch = launchTest(target);
                phases.add(launch);
                if (launch.getErrorKind() == ErrorKind.COMMAND) {
                    log.error(StructuredLog.event("sequence_aborted",
                            "reason", "Launch command failed - app may not be installed"));
                    return new SequenceResult(phases, signInMs, ErrorKind.COMMAND, launch.getErrorMessage());
                }
                pause(POST_LAUNCH_SETTLE_MS);
            }

            if (target.runsInputTest()) {
                phases.add(inputTest(target));
            }
        } catch (ConnectionException | ScriptException e) {
            log.error(StructuredLog.event("sequence_aborted", "kind", e.getKind(), "reason", e.getMessage()));
            return new SequenceResult(phases, signInMs, e.getKind(), e.getMessage());
        }

        log.info(StructuredLog.event("sequence_completed", "phases", phases));
        return new SequenceResult(phases, signInMs, null, null);
    }

    private long signIn(CertificationTarget target) {
        if (target.scriptPath() == null || target.scriptPath().isBlank()) {
            throw new ScriptException("Signed-in mode requires a RASP script (tc.deeplink.script)");
        }
        log.info(StructuredLog.event("sign_in_started", "script", target.scriptPath()));

        long start = clock.nowMs();
        RaspScript script = RaspScriptParser.parseFile(target.scriptPath());
        scriptRunner.execute(script);
        long duration = clock.nowMs() - start;

        log.info(StructuredLog.event("sign_in_completed", "durationMs", duration));
        pause(SIGN_IN_SETTLE_MS);
        return duration;
    }

    private PhaseResult launchTest(CertificationTarget target) {
        TestPhase phase = TestPhase.LAUNCH_TEST;
        List<String> expected = expectedConditions(true, target);
        log.info(StructuredLog.event("phase_started", "phase", phase.getDisplayName(), "expected", expected));

        Set<BeaconCategory> baseline = freshBaseline();
        try {
            dispatcher.launch(target.appId(), target.content());
        } catch (CommandException e) {
            return commandFailed(phase, expected, e, target);
        }

        WaitOutcome outcome = coordinator.waitSmart(true, target.content().requiresVideo(),
                target.expectBeacon(), baseline, target.waitMs());
        return finish(phase, expected, outcome, target);
    }

    private PhaseResult inputTest(CertificationTarget target) {
        TestPhase phase = TestPhase.INPUT_TEST;
        List<String> expected = expectedConditions(false, target);

        if (!target.signedIn()) {
            String skipReason = warmUp(target);
            if (skipReason != null) {
                log.error(StructuredLog.event("phase_skipped", "phase", phase.getDisplayName(), "reason", skipReason));
                return PhaseResult.skipped(phase, expected, skipReason);
            }
        } else {
            log.info(StructuredLog.event("input_precondition", "app", "already running after sign-in"));
        }

        pause(INPUT_STABILITY_MS);
        log.info(StructuredLog.event("phase_started", "phase", phase.getDisplayName(), "expected", expected));

        Set<BeaconCategory> baseline = freshBaseline();
        try {
            dispatcher.input(target.content());
        } catch (CommandException e) {
            return commandFailed(phase, expected, e, target);
        }

        WaitOutcome outcome = coordinator.waitSmart(false, target.content().requiresVideo(),
                target.expectBeacon(), baseline, target.waitMs());
        return finish(phase, expected, outcome, target);
    }

    /**
     * 앱을 Home으로 닫고 일반 launch로 다시 띄운다.
     *
     * @return 실패 사유, 성공이면 null
     */
    private String warmUp(CertificationTarget target) {
        log.info(StructuredLog.event("input_precondition", "step", "close app", "key", HOME_KEY));
        try {
            dispatcher.keypress(HOME_KEY);
        } catch (CommandException e) {
            // 앱이 이미 닫혀 있어도 이어서 진행
            log.warn(StructuredLog.event("home_keypress_failed", "error", e.getMessage()));
        }
        pause(HOME_SETTLE_MS);

        Set<BeaconCategory> baseline = freshBaseline();
        try {
            dispatcher.launch(target.appId(), DeepLinkParams.NONE);
        } catch (CommandException e) {
            return "Failed to launch app normally: " + e.getMessage();
        }

        long timeout = Math.min(target.waitMs(), WARM_UP_MAX_WAIT_MS);
        WaitOutcome launched = coordinator.waitExact(List.of(BeaconCategory.APP_LAUNCH_COMPLETE), baseline, timeout);
        if (!launched.passed()) {
            log.debug(StructuredLog.event("warm_up_recent_lines", "lines", monitor.recentLines(5)));
            return "App did not launch properly: " + launched.errorMessage();
        }
        log.info(StructuredLog.event("input_precondition", "app", "launched normally"));
        return null;
    }

    private PhaseResult finish(TestPhase phase, List<String> expected, WaitOutcome outcome, CertificationTarget target) {
        PhaseResult result = PhaseResult.fromWait(phase, expected, outcome, monitor.timings(),
                outcome.passed() ? List.of() : monitor.recentLines(target.failureLines()));
        if (result.isPassed()) {
            log.info(StructuredLog.event("phase_passed",
                    "phase", phase.getDisplayName(),
                    "durationMs", result.getDurationMs(),
                    "contentType", result.getContentType() != null ? result.getContentType().getLabel() : null));
            result.getTimingAnalysis().log(phase);
        } else {
            log.error(StructuredLog.event("phase_failed",
                    "phase", phase.getDisplayName(),
                    "error", result.getErrorMessage()));
            if (target.content().requiresVideo() && result.getContentType() == null) {
                log.error(StructuredLog.event("video_playback_failed",
                        "hint", "content may not exist or app error occurred"));
            }
        }
        return result;
    }

    private PhaseResult commandFailed(TestPhase phase, List<String> expected, CommandException e,
                                      CertificationTarget target) {
        log.error(StructuredLog.event("phase_failed",
                "phase", phase.getDisplayName(),
                "command", e.getCommand(),
                "httpStatus", e.getHttpStatus(),
                "error", e.getMessage()));
        return PhaseResult.commandFailed(phase, expected, e.getMessage(), monitor.recentLines(target.failureLines()));
    }

    private Set<BeaconCategory> freshBaseline() {
        monitor.reset();
        return monitor.snapshot();
    }

    private static List<String> expectedConditions(boolean requireLaunch, CertificationTarget target) {
        List<String> out = new ArrayList<>();
        if (requireLaunch) {
            out.add(BeaconCategory.APP_LAUNCH_COMPLETE.name());
        }
        if (target.content().requiresVideo()) {
            out.add(BeaconWaitCoordinator.VIDEO_CONDITION);
        }
        if (target.expectBeacon() != null) {
            out.add(target.expectBeacon().name());
        }
        return out;
    }

    private void pause(long ms) {
        try {
            sleeper.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("test sequence interrupted", e);
        }
    }
}
