package com.nori.tc.deeplink.framing;

import com.nori.tc.deeplink.logging.StructuredLog;
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 이벤트 스트림 라인 프레이밍 디코더
 *
 * - LF 기준으로 프레임을 분리하고, 바로 앞의 CR은 함께 제거한다. (LF / CRLF 혼용 허용)
 * - TCP chunk가 한 줄을 나누거나 여러 줄을 합쳐 들어와도 레코드 경계를 복원한다.
 * - maxFrameLength를 넘는 줄은 다음 LF까지 버린다.
 *
 * 예:
 * - 입력: "A\r\nB", "\n"
 * - 출력: "A", "B"
 */
public class LineEndingFrameDecoder extends ByteToMessageDecoder {

    private static final Logger log = LoggerFactory.getLogger(LineEndingFrameDecoder.class);

    public static final int DEFAULT_MAX_FRAME_LENGTH = 16 * 1024;

    private static final byte LF = 0x0A;
    private static final byte CR = 0x0D;

    private final int maxFrameLength;

    /** 너무 긴 줄을 버리는 중이면 true (다음 LF까지) */
    private boolean discarding = false;

    public LineEndingFrameDecoder() {
        this(DEFAULT_MAX_FRAME_LENGTH);
    }

    public LineEndingFrameDecoder(int maxFrameLength) {
        if (maxFrameLength <= 0) {
            throw new IllegalArgumentException("maxFrameLength must be > 0");
        }
        this.maxFrameLength = maxFrameLength;
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        while (in.isReadable()) {
            int readerIdx = in.readerIndex();
            int lfIdx = in.indexOf(readerIdx, in.writerIndex(), LF);

            if (lfIdx < 0) {
                if (in.readableBytes() > maxFrameLength) {
                    log.warn(StructuredLog.event("beacon_frame_too_long",
                            "bytes", in.readableBytes(),
                            "maxFrameLength", maxFrameLength));
                    in.skipBytes(in.readableBytes());
                    discarding = true;
                }
                // LF가 아직 없으면 다음 데이터까지 대기
                return;
            }

            if (discarding) {
                in.readerIndex(lfIdx + 1);
                discarding = false;
                continue;
            }

            int frameEnd = lfIdx;
            if (frameEnd > readerIdx && in.getByte(frameEnd - 1) == CR) {
                frameEnd--;
            }
            int frameLen = frameEnd - readerIdx;

            if (frameLen > maxFrameLength) {
                log.warn(StructuredLog.event("beacon_frame_too_long",
                        "bytes", frameLen,
                        "maxFrameLength", maxFrameLength));
                in.readerIndex(lfIdx + 1);
                continue;
            }

            out.add(in.retainedSlice(readerIdx, frameLen));
            in.readerIndex(lfIdx + 1);
        }
    }
}
