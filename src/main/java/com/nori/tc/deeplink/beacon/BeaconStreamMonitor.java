package com.nori.tc.deeplink.beacon;

import com.nori.tc.deeplink.logging.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * BeaconStreamMonitor
 *
 * 역할:
 * - 이벤트 스트림(8085)에서 들어온 레코드를 beacon vocabulary로 해석하여 누적한다.
 * - received set / timing map / 최근 raw line 버퍼를 보유한다.
 *
 * 스레드 모델:
 * - writer: Netty EventLoop 1개 (onData)
 * - reader: 테스트 진행 스레드 (snapshot/contains/timings/recentLines)
 * - 모든 상태 접근은 this 모니터 락으로 보호한다.
 *
 * baseline 규칙:
 * - reset()은 phase 사이에서만 호출한다(연결 사이가 아님).
 * - raw line 버퍼는 reset 대상이 아니다(실패 진단용).
 */
public final class BeaconStreamMonitor {

    private static final Logger log = LoggerFactory.getLogger(BeaconStreamMonitor.class);

    public static final int DEFAULT_LOG_BUFFER_SIZE = 50;

    /** verbose 모드에서 원문을 남길 디바이스 로그 키워드 */
    private static final List<String> VERBOSE_MARKERS = List.of(
            "beacon.signal", "Channel launched", "RokuComponent", "SceneGraph", "Error", "BrightScript");

    private final int maxBufferedLines;
    private final boolean verbose;
    private final Set<BeaconCategory> customCategories = new CopyOnWriteArraySet<>();

    private final Set<BeaconCategory> received = new LinkedHashSet<>();
    private final Map<BeaconCategory, Long> timings = new LinkedHashMap<>();
    private final Deque<String> recentLines = new ArrayDeque<>();

    /** 연결이 끊긴 경우 원인. null이면 정상 */
    private volatile String connectionFailure;

    public BeaconStreamMonitor() {
        this(DEFAULT_LOG_BUFFER_SIZE, false);
    }

    public BeaconStreamMonitor(int maxBufferedLines, boolean verbose) {
        this.maxBufferedLines = Math.max(1, maxBufferedLines);
        this.verbose = verbose;
    }

    /**
     * 고정 vocabulary 외에 인식할 beacon을 등록한다. (예: --expect-beacon)
     */
    public void registerCustomCategory(BeaconCategory category) {
        if (category != null && !category.isStandard()) {
            customCategories.add(category);
        }
    }

    /**
     * 수신 데이터 1건 처리.
     *
     * - 정상 경로에서는 framer가 이미 한 줄 단위로 잘라서 넘긴다.
     * - chunk 안에 개행이 남아 있으면 줄 단위로 다시 나누어 처리한다.
     */
    public void onData(String chunk) {
        if (chunk == null || chunk.isEmpty()) {
            return;
        }
        for (String line : chunk.split("\\r?\\n|\\r")) {
            String record = line.trim();
            if (!record.isEmpty()) {
                onRecord(record);
            }
        }
    }

    private void onRecord(String record) {
        List<BeaconSighting> sightings = BeaconRecordParser.parse(record, customCategories);

        synchronized (this) {
            recentLines.addLast(record);
            while (recentLines.size() > maxBufferedLines) {
                recentLines.removeFirst();
            }
            for (BeaconSighting s : sightings) {
                received.add(s.category());
                timings.put(s.category(), s.timingMs());
            }
        }

        for (BeaconSighting s : sightings) {
            log.info(StructuredLog.event("beacon_detected",
                    "category", s.category().name(),
                    "timingMs", s.timingMs()));
        }
        if (sightings.isEmpty() && BeaconRecordParser.isLaunchNoise(record)) {
            log.debug(StructuredLog.event("beacon_launch_without_duration_ignored", "record", record));
        }
        if (verbose && isInteresting(record)) {
            log.info(StructuredLog.event("device_log", "line", record));
        }
    }

    private static boolean isInteresting(String record) {
        for (String marker : VERBOSE_MARKERS) {
            if (record.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 현재 received set의 불변 복사본(baseline).
     */
    public synchronized Set<BeaconCategory> snapshot() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(received));
    }

    /**
     * phase 사이 baseline 초기화. received set / timing map만 비운다.
     */
    public synchronized void reset() {
        received.clear();
        timings.clear();
    }

    public synchronized boolean contains(BeaconCategory category) {
        return received.contains(category);
    }

    /**
     * category -> 최근 timing(ms). 값이 null일 수 있다.
     */
    public synchronized Map<BeaconCategory, Long> timings() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(timings));
    }

    /**
     * 최근 raw line 최대 n개(오래된 것부터).
     */
    public synchronized List<String> recentLines(int n) {
        List<String> all = new ArrayList<>(recentLines);
        int from = Math.max(0, all.size() - Math.max(0, n));
        return List.copyOf(all.subList(from, all.size()));
    }

    /**
     * 전송 계층에서 연결이 끊겼음을 알린다. 첫 원인만 유지한다.
     */
    public void connectionLost(String reason) {
        if (connectionFailure == null) {
            connectionFailure = (reason == null || reason.isBlank()) ? "connection closed" : reason;
            log.warn(StructuredLog.event("beacon_stream_lost", "reason", connectionFailure));
        }
    }

    /**
     * @return 연결 끊김 원인, 정상이면 null
     */
    public String connectionFailure() {
        return connectionFailure;
    }
}
