package com.nori.tc.deeplink.framing;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.util.ReferenceCountUtil;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

/**
 * 이벤트 스트림 라인 프레이머 테스트
 */
class LineEndingFrameDecoderTests {

    @Test
    void mixed_lf_and_crlf_in_one_buffer() {
        EmbeddedChannel ch = new EmbeddedChannel(new LineEndingFrameDecoder());

        ch.writeInbound(Unpooled.copiedBuffer("A\r\nB\n", StandardCharsets.UTF_8));

        Object m1 = ch.readInbound();
        Object m2 = ch.readInbound();
        Object m3 = ch.readInbound();

        try {
            assertEquals("A", ((ByteBuf) m1).toString(StandardCharsets.UTF_8));
            assertEquals("B", ((ByteBuf) m2).toString(StandardCharsets.UTF_8));
            assertNull(m3);
        } finally {
            ReferenceCountUtil.release(m1);
            ReferenceCountUtil.release(m2);
        }
        ch.finishAndReleaseAll();
    }

    @Test
    void record_split_across_chunks() {
        EmbeddedChannel ch = new EmbeddedChannel(new LineEndingFrameDecoder());

        // 한 레코드가 TCP chunk 두 개로 나뉘어 들어옴
        ch.writeInbound(Unpooled.copiedBuffer("VODStartComplete Dura", StandardCharsets.UTF_8));
        assertNull(ch.readInbound());

        ch.writeInbound(Unpooled.copiedBuffer("tion(1800 ms)\r\n", StandardCharsets.UTF_8));

        Object m1 = ch.readInbound();
        try {
            assertEquals("VODStartComplete Duration(1800 ms)", ((ByteBuf) m1).toString(StandardCharsets.UTF_8));
        } finally {
            ReferenceCountUtil.release(m1);
        }
        ch.finishAndReleaseAll();
    }

    @Test
    void overlong_line_is_dropped_until_next_lf() {
        EmbeddedChannel ch = new EmbeddedChannel(new LineEndingFrameDecoder(8));

        ch.writeInbound(Unpooled.copiedBuffer("0123456789ABCDEF", StandardCharsets.UTF_8));
        assertNull(ch.readInbound());

        ch.writeInbound(Unpooled.copiedBuffer("tail\nok\n", StandardCharsets.UTF_8));

        Object m1 = ch.readInbound();
        try {
            assertEquals("ok", ((ByteBuf) m1).toString(StandardCharsets.UTF_8));
            assertNull(ch.readInbound());
        } finally {
            ReferenceCountUtil.release(m1);
        }
        ch.finishAndReleaseAll();
    }
}
