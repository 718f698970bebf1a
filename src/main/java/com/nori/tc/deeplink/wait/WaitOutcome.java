package com.nori.tc.deeplink.wait;

import com.nori.tc.deeplink.beacon.BeaconCategory;
import com.nori.tc.deeplink.error.BeaconTimeoutException;
import com.nori.tc.deeplink.error.ErrorKind;

import java.util.List;
import java.util.Optional;

/**
 * 대기 1회의 결과.
 *
 * - passed=false이면 errorKind=BEACON_TIMEOUT, missing에 미충족 조건 이름이 들어간다.
 * - beaconsFound / durationMs는 성공 여부와 무관하게 채워진다.
 *
 * @param contentType smart 대기에서 확정된 VOD/Live, 없으면 null
 */
public record WaitOutcome(boolean passed,
                          long durationMs,
                          List<BeaconCategory> beaconsFound,
                          ContentType contentType,
                          List<String> missing,
                          ErrorKind errorKind,
                          String errorMessage) {

    public WaitOutcome {
        beaconsFound = List.copyOf(beaconsFound);
        missing = List.copyOf(missing);
    }

    public static WaitOutcome passed(long durationMs, List<BeaconCategory> found, ContentType contentType) {
        return new WaitOutcome(true, durationMs, found, contentType, List.of(), null, null);
    }

    public static WaitOutcome timedOut(long durationMs, List<BeaconCategory> found, ContentType contentType,
                                       List<String> missing) {
        String message = "Timeout after " + durationMs + "ms. Missing: " + String.join(", ", missing);
        return new WaitOutcome(false, durationMs, found, contentType, missing, ErrorKind.BEACON_TIMEOUT, message);
    }

    public Optional<ContentType> detectedContentType() {
        return Optional.ofNullable(contentType);
    }

    /**
     * 실패 결과를 예외로 올리고 싶은 호출자용.
     */
    public BeaconTimeoutException toException() {
        if (passed) {
            throw new IllegalStateException("wait passed; nothing to raise");
        }
        return new BeaconTimeoutException(durationMs, missing);
    }
}
