package com.nori.tc.deeplink.netty;

import com.nori.tc.deeplink.beacon.BeaconStreamMonitor;
import com.nori.tc.deeplink.logging.StructuredLog;
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * BeaconRecordHandler
 *
 * 역할:
 * - framer가 잘라준 한 줄을 UTF-8로 디코딩하여 monitor에 전달한다.
 * - 파이프라인 예외는 monitor에 연결 실패로 기록하고 채널을 닫는다.
 *
 * 주의:
 * - autoRelease=true: ByteBuf는 channelRead0 이후 자동 release된다.
 * - 정상 close / 비정상 close 구분은 BeaconStreamClient의 closeFuture 리스너가 담당한다.
 */
public class BeaconRecordHandler extends SimpleChannelInboundHandler<ByteBuf> {

    private static final Logger log = LoggerFactory.getLogger(BeaconRecordHandler.class);

    private final BeaconStreamMonitor monitor;

    public BeaconRecordHandler(BeaconStreamMonitor monitor) {
        super(true);
        this.monitor = Objects.requireNonNull(monitor, "monitor must not be null");
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, ByteBuf msg) {
        monitor.onData(msg.toString(StandardCharsets.UTF_8));
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.warn(StructuredLog.event("beacon_stream_error",
                "connId", ctx.channel().id().asShortText(),
                "error", cause.getMessage()), cause);
        monitor.connectionLost("beacon stream error: " + cause.getMessage());
        ctx.close();
    }
}
