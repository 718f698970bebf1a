package com.nori.tc.deeplink.netty;

import com.nori.tc.deeplink.beacon.BeaconStreamMonitor;
import com.nori.tc.deeplink.framing.LineEndingFrameDecoder;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.socket.SocketChannel;

/**
 * 이벤트 스트림 채널 파이프라인: framer(LF/CRLF) -> beacon handler
 */
public class BeaconChannelInitializer extends ChannelInitializer<SocketChannel> {

    private final BeaconStreamMonitor monitor;
    private final int maxFrameLength;

    public BeaconChannelInitializer(BeaconStreamMonitor monitor, int maxFrameLength) {
        this.monitor = monitor;
        this.maxFrameLength = maxFrameLength;
    }

    @Override
    protected void initChannel(SocketChannel ch) {
        ch.pipeline().addLast("framer", new LineEndingFrameDecoder(maxFrameLength));
        ch.pipeline().addLast("beacons", new BeaconRecordHandler(monitor));
    }
}
