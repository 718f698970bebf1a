package com.nori.tc.deeplink.sequencer;

import com.nori.tc.deeplink.beacon.BeaconCategory;
import com.nori.tc.deeplink.logging.StructuredLog;
import com.nori.tc.deeplink.wait.ContentType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * beacon timing 기반 인증 기준 분석.
 *
 * 기준:
 * - 앱 실행(AppLaunchComplete Duration) 15초 이내
 * - 영상 시작(VODStartComplete / LiveStartComplete Duration) 8초 이내
 * - total time to video = 앱 실행 + 영상 시작 (둘 다 있을 때만)
 *
 * VOD와 Live가 모두 있으면 VOD를 본다.
 *
 * @param initiateTimeBaseMs VOD/Live StartInitiate의 TimeBase(앱 실행 후 경과), 없으면 null
 */
public record TimingAnalysis(Long appLaunchMs,
                             ContentType videoType,
                             Long initiateTimeBaseMs,
                             Long videoStartMs) {

    private static final Logger log = LoggerFactory.getLogger(TimingAnalysis.class);

    public static final long APP_LAUNCH_LIMIT_MS = 15_000;
    public static final long VIDEO_START_LIMIT_MS = 8_000;

    public static TimingAnalysis from(Map<BeaconCategory, Long> timings) {
        Long launch = timings.get(BeaconCategory.APP_LAUNCH_COMPLETE);
        for (ContentType type : ContentType.values()) {
            Long start = timings.get(type.getComplete());
            if (start != null) {
                return new TimingAnalysis(launch, type, timings.get(type.getInitiate()), start);
            }
        }
        return new TimingAnalysis(launch, null, null, null);
    }

    /** 측정값이 없으면 null */
    public Boolean appLaunchWithinLimit() {
        return appLaunchMs == null ? null : appLaunchMs <= APP_LAUNCH_LIMIT_MS;
    }

    /** 측정값이 없으면 null */
    public Boolean videoStartWithinLimit() {
        return videoStartMs == null ? null : videoStartMs <= VIDEO_START_LIMIT_MS;
    }

    public Long totalTimeToVideoMs() {
        return (appLaunchMs != null && videoStartMs != null) ? appLaunchMs + videoStartMs : null;
    }

    public boolean isEmpty() {
        return appLaunchMs == null && videoStartMs == null;
    }

    /**
     * 분석 결과를 로그로 남긴다. 기준 초과는 warn.
     */
    public void log(TestPhase phase) {
        if (appLaunchMs != null) {
            boolean ok = appLaunchWithinLimit();
            String msg = StructuredLog.event("timing_app_launch",
                    "phase", phase.getDisplayName(),
                    "durationMs", appLaunchMs,
                    "limitMs", APP_LAUNCH_LIMIT_MS,
                    "result", ok ? "PASS" : "FAIL - EXCEEDS 15s LIMIT");
            if (ok) {
                log.info(msg);
            } else {
                log.warn(msg);
            }
        }
        if (videoStartMs != null) {
            boolean ok = videoStartWithinLimit();
            String msg = StructuredLog.event("timing_video_start",
                    "phase", phase.getDisplayName(),
                    "contentType", videoType.getLabel(),
                    "initiateTimeBaseMs", initiateTimeBaseMs,
                    "durationMs", videoStartMs,
                    "limitMs", VIDEO_START_LIMIT_MS,
                    "result", ok ? "PASS" : "FAIL - EXCEEDS 8s LIMIT");
            if (ok) {
                log.info(msg);
            } else {
                log.warn(msg);
            }
        }
        Long total = totalTimeToVideoMs();
        if (total != null) {
            log.info(StructuredLog.event("timing_total_to_video",
                    "phase", phase.getDisplayName(),
                    "contentType", videoType.getLabel(),
                    "totalMs", total));
        }
    }
}
