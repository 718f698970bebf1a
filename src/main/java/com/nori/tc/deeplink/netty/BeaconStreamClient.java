package com.nori.tc.deeplink.netty;

import com.nori.tc.deeplink.beacon.BeaconStreamMonitor;
import com.nori.tc.deeplink.error.ConnectionException;
import com.nori.tc.deeplink.framing.LineEndingFrameDecoder;
import com.nori.tc.deeplink.logging.StructuredLog;
import com.nori.tc.deeplink.runtime.HostPort;
import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioSocketChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * BeaconStreamClient
 *
 * 역할:
 * - 디바이스 이벤트 스트림(기본 8085)에 TCP로 접속하여 run 동안 연결을 유지합니다.
 * - 수신 라인은 BeaconChannelInitializer 파이프라인을 거쳐 BeaconStreamMonitor에 누적됩니다.
 *
 * 연결 정책:
 * - 재연결하지 않습니다. 접속 실패는 ConnectionException, 도중 끊김은 monitor에 기록되어
 *   다음 poll tick에서 대기 코디네이터가 ConnectionException으로 run을 중단합니다.
 * - close()로 닫은 경우(stopped=true)는 끊김으로 기록하지 않습니다.
 *
 * 자원:
 * - EventLoopGroup(1 스레드)을 client마다 소유하고 close()에서 정리합니다.
 * - try-with-resources로 사용합니다.
 */
public final class BeaconStreamClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BeaconStreamClient.class);

    private final HostPort target;
    private final BeaconStreamMonitor monitor;
    private final long connectTimeoutMs;
    private final EventLoopGroup group;
    private final Bootstrap bootstrap;

    /** close() 이후 true. closeFuture 리스너가 정상 종료를 구분하는 데 사용 */
    private volatile boolean stopped = false;

    private volatile Channel channel;

    public BeaconStreamClient(HostPort target, BeaconStreamMonitor monitor, long connectTimeoutMs) {
        this.target = Objects.requireNonNull(target, "target must not be null");
        this.monitor = Objects.requireNonNull(monitor, "monitor must not be null");
        this.connectTimeoutMs = connectTimeoutMs > 0 ? connectTimeoutMs : 10_000L;

        this.group = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap();
        bootstrap.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.SO_KEEPALIVE, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(Integer.MAX_VALUE, this.connectTimeoutMs))
                .handler(new BeaconChannelInitializer(monitor, LineEndingFrameDecoder.DEFAULT_MAX_FRAME_LENGTH));
    }

    /**
     * 접속이 완료될 때까지 블로킹합니다.
     *
     * @throws ConnectionException 접속 실패/타임아웃/인터럽트
     */
    public void connect() {
        if (stopped) {
            throw new IllegalStateException("client already closed");
        }

        log.info(StructuredLog.event("beacon_stream_connecting",
                "target", target,
                "connectTimeoutMs", connectTimeoutMs));

        ChannelFuture future = bootstrap.connect(target.host(), target.port());
        boolean completed;
        try {
            completed = future.await(connectTimeoutMs + 1_000L, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(false);
            throw new ConnectionException("Telnet connection interrupted: " + target, e);
        }

        if (!completed) {
            future.cancel(false);
            throw new ConnectionException("Telnet connection timeout: " + target);
        }
        if (!future.isSuccess()) {
            Throwable cause = future.cause();
            throw new ConnectionException("Telnet connection failed: " + target
                    + (cause != null ? " (" + cause.getMessage() + ")" : ""), cause);
        }

        channel = future.channel();
        log.info(StructuredLog.event("beacon_stream_connected",
                "connId", channel.id().asShortText(),
                "remote", String.valueOf(channel.remoteAddress()),
                "local", String.valueOf(channel.localAddress())));

        channel.closeFuture().addListener((ChannelFutureListener) f -> onChannelClosed());
    }

    public boolean isConnected() {
        Channel ch = channel;
        return ch != null && ch.isActive();
    }

    private void onChannelClosed() {
        if (stopped) {
            return;
        }
        monitor.connectionLost("Telnet connection closed by device: " + target);
    }

    /**
     * 채널을 닫고 EventLoopGroup을 정리합니다. 여러 번 호출해도 안전합니다.
     */
    @Override
    public void close() {
        if (stopped) {
            return;
        }
        stopped = true;

        Channel ch = channel;
        if (ch != null) {
            log.info(StructuredLog.event("beacon_stream_closing", "connId", ch.id().asShortText()));
            ch.close().syncUninterruptibly();
        }
        group.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
        log.info(StructuredLog.event("beacon_stream_closed", "target", target));
    }
}
