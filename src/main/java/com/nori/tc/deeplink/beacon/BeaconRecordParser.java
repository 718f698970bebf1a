package com.nori.tc.deeplink.beacon;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * BeaconRecordParser
 *
 * 목적:
 * - 디바이스 로그 한 줄에서 인증 beacon과 timing 필드를 추출한다.
 *
 * 문법:
 * - {@code <Category>...<FieldName>(<digits> ms)...}
 * - FieldName: Duration | TimeBase
 *
 * 추출 규칙:
 * - AppLaunchComplete: Duration 필드가 있는 레코드만 인정한다. 없으면 노이즈로 버린다.
 * - VODStartInitiate / LiveStartInitiate: TimeBase
 * - VODStartComplete / LiveStartComplete / AppDialogInitiate: Duration(있으면)
 * - custom beacon: Duration(있으면)
 */
public final class BeaconRecordParser {

    public static final String DURATION = "Duration";
    public static final String TIME_BASE = "TimeBase";

    private static final Pattern DURATION_PATTERN = timingPattern(DURATION);
    private static final Pattern TIME_BASE_PATTERN = timingPattern(TIME_BASE);

    private BeaconRecordParser() {
        // utility class
    }

    /**
     * 레코드에서 매칭되는 beacon을 고정 vocabulary 순서, custom 순서로 반환한다.
     *
     * @param record 개행이 제거된 로그 한 줄
     * @param custom 추가로 인식할 custom beacon (표준 이름과 겹치면 무시)
     * @return 매칭 결과(없으면 빈 리스트)
     */
    public static List<BeaconSighting> parse(String record, Collection<BeaconCategory> custom) {
        List<BeaconSighting> out = new ArrayList<>(2);
        if (record == null || record.isBlank()) {
            return out;
        }

        if (record.contains(BeaconCategory.APP_LAUNCH_COMPLETE.name())) {
            Long duration = extractTiming(record, DURATION);
            if (duration != null) {
                out.add(new BeaconSighting(BeaconCategory.APP_LAUNCH_COMPLETE, duration));
            }
        }
        addIfPresent(out, record, BeaconCategory.APP_DIALOG_INITIATE, DURATION);
        addIfPresent(out, record, BeaconCategory.VOD_START_INITIATE, TIME_BASE);
        addIfPresent(out, record, BeaconCategory.VOD_START_COMPLETE, DURATION);
        addIfPresent(out, record, BeaconCategory.LIVE_START_INITIATE, TIME_BASE);
        addIfPresent(out, record, BeaconCategory.LIVE_START_COMPLETE, DURATION);

        if (custom != null) {
            for (BeaconCategory c : custom) {
                if (!c.isStandard()) {
                    addIfPresent(out, record, c, DURATION);
                }
            }
        }
        return out;
    }

    /**
     * AppLaunchComplete 토큰은 있지만 Duration이 없는 레코드인지.
     */
    public static boolean isLaunchNoise(String record) {
        return record != null
                && record.contains(BeaconCategory.APP_LAUNCH_COMPLETE.name())
                && extractTiming(record, DURATION) == null;
    }

    /**
     * {@code Duration(1234 ms)} / {@code TimeBase(1234 ms)} 값 추출.
     *
     * @return ms 값, 필드가 없거나 범위를 벗어나면 null
     */
    public static Long extractTiming(String record, String fieldName) {
        if (record == null) {
            return null;
        }
        Pattern p = switch (fieldName) {
            case DURATION -> DURATION_PATTERN;
            case TIME_BASE -> TIME_BASE_PATTERN;
            default -> timingPattern(fieldName);
        };
        Matcher m = p.matcher(record);
        if (!m.find()) {
            return null;
        }
        try {
            return Long.parseLong(m.group(1));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static void addIfPresent(List<BeaconSighting> out, String record, BeaconCategory category, String field) {
        if (record.contains(category.name())) {
            out.add(new BeaconSighting(category, extractTiming(record, field)));
        }
    }

    private static Pattern timingPattern(String fieldName) {
        return Pattern.compile(Pattern.quote(fieldName) + "\\((\\d+)\\s*ms\\)");
    }
}
