package com.nori.tc.deeplink.netty;

import com.nori.tc.deeplink.beacon.BeaconCategory;
import com.nori.tc.deeplink.beacon.BeaconStreamMonitor;
import com.nori.tc.deeplink.framing.LineEndingFrameDecoder;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class BeaconRecordHandlerTests {

    @Test
    void framed_lines_reach_monitor() {
        BeaconStreamMonitor monitor = new BeaconStreamMonitor();
        EmbeddedChannel ch = new EmbeddedChannel();
        ch.pipeline().addLast("framer", new LineEndingFrameDecoder());
        ch.pipeline().addLast("beacons", new BeaconRecordHandler(monitor));

        ch.writeInbound(Unpooled.copiedBuffer("AppLaunchComplete Duration(1500 ms)\r\nVODStart",
                StandardCharsets.UTF_8));
        assertTrue(monitor.contains(BeaconCategory.APP_LAUNCH_COMPLETE));
        assertFalse(monitor.contains(BeaconCategory.VOD_START_INITIATE));

        ch.writeInbound(Unpooled.copiedBuffer("Initiate TimeBase(20 ms)\n", StandardCharsets.UTF_8));
        assertTrue(monitor.contains(BeaconCategory.VOD_START_INITIATE));
        assertEquals(20L, monitor.timings().get(BeaconCategory.VOD_START_INITIATE));

        ch.finishAndReleaseAll();
    }

    @Test
    void pipeline_exception_marks_connection_lost_and_closes() {
        BeaconStreamMonitor monitor = new BeaconStreamMonitor();
        EmbeddedChannel ch = new EmbeddedChannel(new BeaconRecordHandler(monitor));

        ch.pipeline().fireExceptionCaught(new IllegalStateException("boom"));

        assertNotNull(monitor.connectionFailure());
        assertTrue(monitor.connectionFailure().contains("boom"));
        assertFalse(ch.isOpen());
        ch.finishAndReleaseAll();
    }
}
