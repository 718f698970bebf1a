package com.nori.tc.deeplink.sequencer;

import com.nori.tc.deeplink.beacon.BeaconCategory;
import com.nori.tc.deeplink.wait.ContentType;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TimingAnalysisTests {

    @Test
    void flags_launch_and_video_over_limits() {
        Map<BeaconCategory, Long> timings = new LinkedHashMap<>();
        timings.put(BeaconCategory.APP_LAUNCH_COMPLETE, 15_001L);
        timings.put(BeaconCategory.LIVE_START_INITIATE, 200L);
        timings.put(BeaconCategory.LIVE_START_COMPLETE, 8_000L);

        TimingAnalysis analysis = TimingAnalysis.from(timings);

        assertEquals(ContentType.LIVE, analysis.videoType());
        assertFalse(analysis.appLaunchWithinLimit());
        assertTrue(analysis.videoStartWithinLimit());
        assertEquals(23_001L, analysis.totalTimeToVideoMs());
    }

    @Test
    void missing_timings_yield_nulls() {
        Map<BeaconCategory, Long> timings = new LinkedHashMap<>();
        timings.put(BeaconCategory.VOD_START_COMPLETE, null);

        TimingAnalysis analysis = TimingAnalysis.from(timings);

        assertTrue(analysis.isEmpty());
        assertNull(analysis.appLaunchWithinLimit());
        assertNull(analysis.totalTimeToVideoMs());
        analysis.log(TestPhase.INPUT_TEST);
    }
}
