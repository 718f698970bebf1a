package com.nori.tc.deeplink.beacon;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BeaconRecordParserTests {

    @Test
    void app_launch_complete_requires_duration() {
        List<BeaconSighting> withDuration = BeaconRecordParser.parse(
                "[beacon.signal] |AppLaunchComplete ------> Duration(1523 ms), 3.24 KiB", List.of());
        assertEquals(List.of(new BeaconSighting(BeaconCategory.APP_LAUNCH_COMPLETE, 1523L)), withDuration);

        String noise = "[scrpt.cmpl] Compiling 'dev', id 'dev' AppLaunchComplete";
        assertTrue(BeaconRecordParser.parse(noise, List.of()).isEmpty());
        assertTrue(BeaconRecordParser.isLaunchNoise(noise));
    }

    @Test
    void initiate_uses_time_base_and_complete_uses_duration() {
        List<BeaconSighting> initiate = BeaconRecordParser.parse(
                "[beacon.signal] |VODStartInitiate --------> TimeBase(4200 ms)", List.of());
        assertEquals(List.of(new BeaconSighting(BeaconCategory.VOD_START_INITIATE, 4200L)), initiate);

        List<BeaconSighting> complete = BeaconRecordParser.parse(
                "[beacon.signal] |LiveStartComplete -------> Duration(1800 ms)", List.of());
        assertEquals(List.of(new BeaconSighting(BeaconCategory.LIVE_START_COMPLETE, 1800L)), complete);
    }

    @Test
    void complete_without_timing_is_still_recorded() {
        List<BeaconSighting> s = BeaconRecordParser.parse("|VODStartComplete", List.of());
        assertEquals(1, s.size());
        assertEquals(BeaconCategory.VOD_START_COMPLETE, s.get(0).category());
        assertNull(s.get(0).timingMs());
    }

    @Test
    void custom_category_is_matched_only_when_registered() {
        BeaconCategory custom = BeaconCategory.of("AdStartComplete");
        String record = "|AdStartComplete Duration(300 ms)";

        assertTrue(BeaconRecordParser.parse(record, List.of()).isEmpty());
        assertEquals(List.of(new BeaconSighting(custom, 300L)), BeaconRecordParser.parse(record, List.of(custom)));
    }

    @Test
    void extract_timing_tolerates_missing_space() {
        assertEquals(77L, BeaconRecordParser.extractTiming("x Duration(77ms)", BeaconRecordParser.DURATION));
        assertNull(BeaconRecordParser.extractTiming("x Duration(abc ms)", BeaconRecordParser.DURATION));
    }
}
