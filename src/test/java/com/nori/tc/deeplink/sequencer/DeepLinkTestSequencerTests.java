package com.nori.tc.deeplink.sequencer;

import com.nori.tc.deeplink.beacon.BeaconCategory;
import com.nori.tc.deeplink.beacon.BeaconStreamMonitor;
import com.nori.tc.deeplink.control.CommandDispatcher;
import com.nori.tc.deeplink.control.DeepLinkParams;
import com.nori.tc.deeplink.control.RecordingCommandDispatcher;
import com.nori.tc.deeplink.control.RestCommandDispatcher;
import com.nori.tc.deeplink.error.ErrorKind;
import com.nori.tc.deeplink.rasp.RaspScriptRunner;
import com.nori.tc.deeplink.runtime.HostPort;
import com.nori.tc.deeplink.time.ManualTime;
import com.nori.tc.deeplink.wait.BeaconWaitCoordinator;
import com.nori.tc.deeplink.wait.ContentType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class DeepLinkTestSequencerTests {

    private static final String LAUNCH = "[beacon.signal] |AppLaunchComplete ------> Duration(1523 ms)";
    private static final String VOD = "[beacon.signal] |VODStartInitiate --------> TimeBase(410 ms)\n"
            + "[beacon.signal] |VODStartComplete --------> Duration(1800 ms)";

    private static final DeepLinkParams MOVIE = new DeepLinkParams("1234", "movie");

    private BeaconStreamMonitor monitor;
    private ManualTime time;

    @BeforeEach
    void setUp() {
        monitor = new BeaconStreamMonitor();
        time = new ManualTime();
    }

    @Test
    void launch_test_against_mocked_control_channel_detects_vod() {
        RestTemplate template = new RestTemplate();
        MockRestServiceServer server = MockRestServiceServer.bindTo(template).build();
        server.expect(requestTo("http://192.168.1.114:8060/launch/dev?contentId=1234&mediaType=movie"))
                .andExpect(method(HttpMethod.POST))
                .andRespond(request -> {
                    monitor.onData(LAUNCH + "\n" + VOD);
                    return withSuccess().createResponse(request);
                });
        CommandDispatcher dispatcher =
                new RestCommandDispatcher(new HostPort("192.168.1.114", 8060), template, template);

        SequenceResult result = sequencer(dispatcher).run(target(true, false, false, null, null));

        server.verify();
        assertFalse(result.aborted());
        assertEquals(1, result.phases().size());

        PhaseResult launch = result.phases().get(0);
        assertEquals(TestPhase.LAUNCH_TEST, launch.getPhase());
        assertEquals(PhaseStatus.PASSED, launch.getStatus());
        assertEquals(ContentType.VOD, launch.getContentType());
        assertEquals(List.of("AppLaunchComplete", BeaconWaitCoordinator.VIDEO_CONDITION),
                launch.getExpectedConditions());

        TimingAnalysis timing = launch.getTimingAnalysis();
        assertEquals(1523L, timing.appLaunchMs());
        assertEquals(1800L, timing.videoStartMs());
        assertEquals(410L, timing.initiateTimeBaseMs());
        assertTrue(timing.appLaunchWithinLimit());
        assertTrue(timing.videoStartWithinLimit());
        assertEquals(3323L, timing.totalTimeToVideoMs());

        // 테스트 전 settle + launch 후 settle
        assertEquals(List.of(3000L, 3000L), time.sleeps());
    }

    @Test
    void full_run_warms_up_app_before_input_test() {
        RecordingCommandDispatcher dispatcher = new RecordingCommandDispatcher()
                .onCall("launch dev {", c -> monitor.onData(LAUNCH + "\n" + VOD))
                .onCall("launch dev", c -> {
                    if (c.equals("launch dev")) {
                        monitor.onData(LAUNCH);
                    }
                })
                .onCall("input", c -> monitor.onData(VOD));

        SequenceResult result = sequencer(dispatcher).run(target(false, false, false, null, null));

        assertEquals(List.of(
                "launch dev {contentId=1234, mediaType=movie}",
                "keypress Home",
                "launch dev",
                "input {contentId=1234, mediaType=movie}"), dispatcher.calls());

        assertEquals(2, result.phases().size());
        assertTrue(result.phases().get(0).isPassed());
        PhaseResult input = result.phases().get(1);
        assertEquals(TestPhase.INPUT_TEST, input.getPhase());
        assertTrue(input.isPassed());
        assertEquals(ContentType.VOD, input.getContentType());
        assertEquals(List.of(BeaconWaitCoordinator.VIDEO_CONDITION), input.getExpectedConditions());
    }

    @Test
    void warm_up_timeout_skips_input_test() {
        RecordingCommandDispatcher dispatcher = new RecordingCommandDispatcher()
                .onCall("launch dev {", c -> monitor.onData(LAUNCH + "\n" + VOD));

        SequenceResult result = sequencer(dispatcher).run(target(false, false, false, null, null));

        assertEquals(List.of(
                "launch dev {contentId=1234, mediaType=movie}",
                "keypress Home",
                "launch dev"), dispatcher.calls());
        PhaseResult input = result.phases().get(1);
        assertEquals(PhaseStatus.SKIPPED, input.getStatus());
        assertTrue(input.getErrorMessage().startsWith("App did not launch properly: Timeout after 30000ms"));
        assertFalse(result.aborted());
    }

    @Test
    void home_keypress_failure_does_not_stop_warm_up() {
        RecordingCommandDispatcher dispatcher = new RecordingCommandDispatcher()
                .failOn("keypress Home")
                .onCall("launch dev", c -> monitor.onData(LAUNCH))
                .onCall("input", c -> monitor.onData(VOD));

        SequenceResult result = sequencer(dispatcher)
                .run(target(false, false, true, null, null));

        assertEquals(1, result.phases().size());
        assertTrue(result.phases().get(0).isPassed());
    }

    @Test
    void launch_command_failure_aborts_run() {
        RecordingCommandDispatcher dispatcher = new RecordingCommandDispatcher().failOn("launch");
        monitor.onData("some earlier device line");

        SequenceResult result = sequencer(dispatcher).run(target(false, false, false, null, null));

        assertEquals(ErrorKind.COMMAND, result.abortKind());
        assertEquals(1, result.phases().size());
        PhaseResult launch = result.phases().get(0);
        assertEquals(PhaseStatus.FAILED, launch.getStatus());
        assertTrue(launch.getErrorMessage().startsWith(PhaseResult.SEND_FAILED_MESSAGE));
        assertEquals(List.of("some earlier device line"), launch.getRecentLines());
        // InputTest 없음
        assertEquals(1, dispatcher.calls().size());
    }

    @Test
    void input_command_failure_fails_only_that_phase() {
        RecordingCommandDispatcher dispatcher = new RecordingCommandDispatcher()
                .failOn("input")
                .onCall("launch dev", c -> monitor.onData(LAUNCH));

        SequenceResult result = sequencer(dispatcher).run(target(false, false, true, null, null));

        assertFalse(result.aborted());
        PhaseResult input = result.phases().get(0);
        assertEquals(PhaseStatus.FAILED, input.getStatus());
        assertEquals(ErrorKind.COMMAND, input.getErrorKind());
    }

    @Test
    void expected_extra_beacon_is_required_in_every_phase() {
        BeaconCategory extra = BeaconCategory.of("AdStartComplete");
        RecordingCommandDispatcher dispatcher = new RecordingCommandDispatcher()
                .onCall("launch dev {", c -> monitor.onData(LAUNCH + "\n" + VOD));

        SequenceResult result = sequencer(dispatcher).run(new CertificationTarget(
                "dev", MOVIE, 5_000, true, false, false, null, extra, 10));

        PhaseResult launch = result.phases().get(0);
        assertEquals(PhaseStatus.FAILED, launch.getStatus());
        assertEquals(ErrorKind.BEACON_TIMEOUT, launch.getErrorKind());
        assertEquals(List.of("AdStartComplete"), launch.getMissing());
        assertEquals(ContentType.VOD, launch.getContentType());
        assertFalse(launch.getRecentLines().isEmpty());
    }

    @Test
    void signed_in_without_script_aborts_with_script_error() {
        RecordingCommandDispatcher dispatcher = new RecordingCommandDispatcher();

        SequenceResult result = sequencer(dispatcher).run(new CertificationTarget(
                "dev", MOVIE, 5_000, false, false, true, null, null, 10));

        assertEquals(ErrorKind.SCRIPT, result.abortKind());
        assertTrue(result.phases().isEmpty());
        assertTrue(dispatcher.calls().isEmpty());
    }

    @Test
    void signed_in_run_executes_script_and_skips_warm_up() throws Exception {
        String script = Paths.get(getClass().getResource("/rasp/signin-example.rasp").toURI()).toString();
        RecordingCommandDispatcher dispatcher = new RecordingCommandDispatcher()
                .onCall("launch dev {", c -> monitor.onData(LAUNCH + "\n" + VOD))
                .onCall("input", c -> monitor.onData(VOD));

        SequenceResult result = sequencer(dispatcher).run(new CertificationTarget(
                "dev", MOVIE, 5_000, false, false, true, script, null, 10));

        assertEquals(List.of(
                "launch dev",
                "keypress Select",
                "lit a", "lit b",
                "launch dev {contentId=1234, mediaType=movie}",
                "input {contentId=1234, mediaType=movie}"), dispatcher.calls());
        // pause 5s + 3 gaps x 1s + 2 chars x 50ms
        assertEquals(8100L, result.signInDurationMs());
        assertEquals(2, result.phases().size());
        assertTrue(result.phases().stream().allMatch(PhaseResult::isPassed));
    }

    @Test
    void lost_connection_aborts_with_phases_so_far() {
        RecordingCommandDispatcher dispatcher = new RecordingCommandDispatcher()
                .onCall("launch dev {", c -> monitor.connectionLost("Telnet connection closed by device"));

        SequenceResult result = sequencer(dispatcher).run(target(false, false, false, null, null));

        assertEquals(ErrorKind.CONNECTION, result.abortKind());
        assertEquals("Telnet connection closed by device", result.abortMessage());
        assertTrue(result.phases().isEmpty());
    }

    private DeepLinkTestSequencer sequencer(CommandDispatcher dispatcher) {
        BeaconWaitCoordinator coordinator = new BeaconWaitCoordinator(monitor, time, time);
        RaspScriptRunner scriptRunner = new RaspScriptRunner(dispatcher, name -> Optional.empty(), time);
        return new DeepLinkTestSequencer(dispatcher, monitor, coordinator, scriptRunner, time, time);
    }

    private static CertificationTarget target(boolean launchOnly, boolean signedIn, boolean inputOnly,
                                              String script, BeaconCategory extra) {
        return new CertificationTarget("dev", MOVIE, 30_000, launchOnly, inputOnly, signedIn, script, extra, 10);
    }
}
