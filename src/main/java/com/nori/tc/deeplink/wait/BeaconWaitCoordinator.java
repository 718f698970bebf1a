package com.nori.tc.deeplink.wait;

import com.nori.tc.deeplink.beacon.BeaconCategory;
import com.nori.tc.deeplink.beacon.BeaconStreamMonitor;
import com.nori.tc.deeplink.error.ConnectionException;
import com.nori.tc.deeplink.logging.StructuredLog;
import com.nori.tc.deeplink.time.MonotonicClock;
import com.nori.tc.deeplink.time.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * BeaconWaitCoordinator
 *
 * 역할:
 * - BeaconStreamMonitor를 고정 주기(500ms)로 poll 하여 필요한 beacon이 "새로" 들어왔는지 판정한다.
 *
 * freshness 규칙:
 * - 현재 received set에 있고 baseline에는 없는 category만 인정한다.
 *
 * 모드:
 * - exact: 필요한 category가 모두 fresh가 되면 2000ms grace 후 성공.
 *          grace 중 추가 beacon은 grace를 취소/연장하지 않는다.
 *          grace가 끝나기 전에 deadline이 지나면 실패한다.
 * - smart: AppLaunchComplete(선택) + 영상 쌍(VOD 우선, 다음 Live) + extra(선택)가
 *          같은 tick에 모두 만족되면 즉시 성공(grace 없음).
 *          처음 완성된 쌍이 contentType을 확정하고 이후 다시 판정하지 않는다.
 *
 * timeout:
 * - poll tick마다 1회 확인하는 협조적 방식이다.
 * - monitor에 연결 끊김이 기록되면 ConnectionException으로 즉시 중단한다.
 */
public class BeaconWaitCoordinator {

    private static final Logger log = LoggerFactory.getLogger(BeaconWaitCoordinator.class);

    public static final long POLL_INTERVAL_MS = 500;
    public static final long GRACE_PERIOD_MS = 2000;
    public static final long PROGRESS_LOG_INTERVAL_MS = 10_000;

    public static final String VIDEO_CONDITION = "Video playback beacons (VOD or Live)";

    private final BeaconStreamMonitor monitor;
    private final MonotonicClock clock;
    private final Sleeper sleeper;

    public BeaconWaitCoordinator(BeaconStreamMonitor monitor, MonotonicClock clock, Sleeper sleeper) {
        this.monitor = Objects.requireNonNull(monitor, "monitor must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    /**
     * 필요한 category가 모두 fresh가 된 뒤 grace 기간을 채우면 성공한다.
     */
    public WaitOutcome waitExact(Collection<BeaconCategory> required, Set<BeaconCategory> baseline, long timeoutMs) {
        List<BeaconCategory> expected = List.copyOf(new LinkedHashSet<>(required));
        Set<BeaconCategory> base = baseline != null ? baseline : Set.of();

        log.info(StructuredLog.event("wait_exact_started",
                "required", expected,
                "baselineSize", base.size(),
                "timeoutMs", timeoutMs));

        long start = clock.nowMs();
        long nextProgressAt = start + PROGRESS_LOG_INTERVAL_MS;
        Long allFoundAt = null;

        while (true) {
            ensureConnected();
            long now = clock.nowMs();
            long elapsed = now - start;

            Set<BeaconCategory> current = monitor.snapshot();
            List<BeaconCategory> fresh = new ArrayList<>();
            List<String> missing = new ArrayList<>();
            for (BeaconCategory c : expected) {
                if (isFresh(c, current, base)) {
                    fresh.add(c);
                } else {
                    missing.add(c.name());
                }
            }

            if (missing.isEmpty()) {
                if (allFoundAt == null) {
                    allFoundAt = now;
                    log.info(StructuredLog.event("wait_exact_all_found",
                            "elapsedMs", elapsed,
                            "graceMs", GRACE_PERIOD_MS));
                }
                if (now - allFoundAt >= GRACE_PERIOD_MS) {
                    log.info(StructuredLog.event("wait_exact_passed", "durationMs", elapsed, "found", fresh));
                    return WaitOutcome.passed(elapsed, fresh, null);
                }
            }
            // grace 진행 중이라도 deadline이 지나면 실패
            if (elapsed >= timeoutMs) {
                log.warn(StructuredLog.event("wait_exact_timeout",
                        "durationMs", elapsed,
                        "found", fresh,
                        "missing", missing));
                return WaitOutcome.timedOut(elapsed, fresh, null, missing);
            }

            if (now >= nextProgressAt) {
                nextProgressAt += PROGRESS_LOG_INTERVAL_MS;
                log.info(StructuredLog.event("wait_progress",
                        "remainingSec", Math.max(0, (timeoutMs - elapsed) / 1000),
                        "found", fresh.isEmpty() ? "none" : fresh));
            }
            pause();
        }
    }

    /**
     * 논리 조건(앱 실행 / 영상 재생 / extra)이 같은 tick에 모두 만족되면 즉시 성공한다.
     *
     * @param requireLaunch      AppLaunchComplete 필요 여부
     * @param mediaRequiresVideo VOD 또는 Live 쌍 필요 여부
     * @param extraCategory      추가로 AND 할 beacon, 없으면 null
     */
    public WaitOutcome waitSmart(boolean requireLaunch,
                                 boolean mediaRequiresVideo,
                                 BeaconCategory extraCategory,
                                 Set<BeaconCategory> baseline,
                                 long timeoutMs) {
        Set<BeaconCategory> base = baseline != null ? baseline : Set.of();

        log.info(StructuredLog.event("wait_smart_started",
                "requireLaunch", requireLaunch,
                "requireVideo", mediaRequiresVideo,
                "extra", extraCategory,
                "baselineSize", base.size(),
                "timeoutMs", timeoutMs));

        long start = clock.nowMs();
        long nextProgressAt = start + PROGRESS_LOG_INTERVAL_MS;
        ContentType fixed = null;

        while (true) {
            ensureConnected();
            long now = clock.nowMs();
            long elapsed = now - start;
            Set<BeaconCategory> current = monitor.snapshot();

            boolean launchOk = !requireLaunch || isFresh(BeaconCategory.APP_LAUNCH_COMPLETE, current, base);

            if (mediaRequiresVideo && fixed == null) {
                for (ContentType type : ContentType.values()) {
                    if (isFresh(type.getInitiate(), current, base) && isFresh(type.getComplete(), current, base)) {
                        fixed = type;
                        log.info(StructuredLog.event("wait_content_type_detected",
                                "contentType", type.getLabel(),
                                "elapsedMs", elapsed));
                        break;
                    }
                }
            }
            boolean videoOk = !mediaRequiresVideo || fixed != null;
            boolean extraOk = extraCategory == null || isFresh(extraCategory, current, base);

            List<BeaconCategory> found = foundSmart(requireLaunch, mediaRequiresVideo, extraCategory, fixed, current, base);

            if (launchOk && videoOk && extraOk) {
                log.info(StructuredLog.event("wait_smart_passed",
                        "durationMs", elapsed,
                        "contentType", fixed != null ? fixed.getLabel() : null,
                        "found", found));
                return WaitOutcome.passed(elapsed, found, fixed);
            }

            if (elapsed >= timeoutMs) {
                List<String> missing = new ArrayList<>();
                if (!launchOk) {
                    missing.add(BeaconCategory.APP_LAUNCH_COMPLETE.name());
                }
                if (!videoOk) {
                    missing.add(VIDEO_CONDITION);
                }
                if (!extraOk) {
                    missing.add(extraCategory.name());
                }
                log.warn(StructuredLog.event("wait_smart_timeout",
                        "durationMs", elapsed,
                        "found", found,
                        "missing", missing));
                return WaitOutcome.timedOut(elapsed, found, fixed, missing);
            }

            if (now >= nextProgressAt) {
                nextProgressAt += PROGRESS_LOG_INTERVAL_MS;
                log.info(StructuredLog.event("wait_progress",
                        "remainingSec", Math.max(0, (timeoutMs - elapsed) / 1000),
                        "appLaunch", requireLaunch ? (launchOk ? "ok" : "waiting") : "n/a",
                        "video", mediaRequiresVideo ? (videoOk ? "ok" : "waiting") : "n/a"));
            }
            pause();
        }
    }

    private static List<BeaconCategory> foundSmart(boolean requireLaunch,
                                                   boolean mediaRequiresVideo,
                                                   BeaconCategory extra,
                                                   ContentType fixed,
                                                   Set<BeaconCategory> current,
                                                   Set<BeaconCategory> base) {
        List<BeaconCategory> found = new ArrayList<>();
        if (requireLaunch && isFresh(BeaconCategory.APP_LAUNCH_COMPLETE, current, base)) {
            found.add(BeaconCategory.APP_LAUNCH_COMPLETE);
        }
        if (mediaRequiresVideo) {
            if (fixed != null) {
                found.addAll(fixed.pair());
            } else {
                // 쌍이 완성되기 전: 진단용으로 들어온 것만
                for (ContentType type : ContentType.values()) {
                    for (BeaconCategory c : type.pair()) {
                        if (isFresh(c, current, base)) {
                            found.add(c);
                        }
                    }
                }
            }
        }
        if (extra != null && isFresh(extra, current, base) && !found.contains(extra)) {
            found.add(extra);
        }
        return found;
    }

    private static boolean isFresh(BeaconCategory c, Set<BeaconCategory> current, Set<BeaconCategory> base) {
        return current.contains(c) && !base.contains(c);
    }

    private void ensureConnected() {
        String failure = monitor.connectionFailure();
        if (failure != null) {
            throw new ConnectionException(failure);
        }
    }

    private void pause() {
        try {
            sleeper.sleep(POLL_INTERVAL_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("beacon wait interrupted", e);
        }
    }
}
