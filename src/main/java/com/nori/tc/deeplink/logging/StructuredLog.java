package com.nori.tc.deeplink.logging;

import java.util.Locale;

/**
 * StructuredLog
 *
 * 목적:
 * - 인증 테스트 로그를 "event=... key=value" 한 줄 형식으로 통일한다.
 * - 디바이스 로그 원문(raw line)처럼 공백/따옴표가 섞인 값도 한 줄로 안전하게 남긴다.
 *
 * 예:
 * - StructuredLog.event("beacon_detected", "category", "VODStartComplete", "timingMs", 1800)
 *   -> event=beacon_detected category=VODStartComplete timingMs=1800
 *
 * 주의:
 * - secret 값은 반드시 {@link #mask(String)}를 거친 뒤 넘긴다.
 */
public final class StructuredLog {

    private StructuredLog() {
        // utility class
    }

    public static String event(String event, Object... kv) {
        StringBuilder sb = new StringBuilder(128);
        append(sb, "event", event);
        if (kv != null) {
            // 홀수 개면 마지막 key는 버린다
            int pairs = kv.length / 2;
            for (int i = 0; i < pairs; i++) {
                append(sb, String.valueOf(kv[2 * i]), kv[2 * i + 1]);
            }
        }
        return sb.toString();
    }

    /**
     * 길이만 남기고 내용을 가린다. (예: "secret" -> "******")
     */
    public static String mask(String value) {
        if (value == null) {
            return null;
        }
        return "*".repeat(value.length());
    }

    private static void append(StringBuilder sb, String key, Object value) {
        if (key == null || key.isBlank()) {
            return;
        }
        if (!sb.isEmpty()) {
            sb.append(' ');
        }
        sb.append(key).append('=').append(quoteIfNeeded(value));
    }

    private static String quoteIfNeeded(Object value) {
        if (value == null) {
            return "null";
        }
        String s = String.valueOf(value);
        if (s.isEmpty()) {
            return "\"\"";
        }

        boolean plain = true;
        for (int i = 0; i < s.length() && plain; i++) {
            char c = s.charAt(i);
            plain = !(Character.isWhitespace(c) || c == '"' || c == '\\' || c == '=' || c < 0x20);
        }
        if (plain) {
            return s;
        }

        StringBuilder out = new StringBuilder(s.length() + 8).append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"' -> out.append("\\\"");
                case '\\' -> out.append("\\\\");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                default -> {
                    if (c < 0x20) {
                        out.append(String.format(Locale.ROOT, "\\u%04x", (int) c));
                    } else {
                        out.append(c);
                    }
                }
            }
        }
        return out.append('"').toString();
    }
}
