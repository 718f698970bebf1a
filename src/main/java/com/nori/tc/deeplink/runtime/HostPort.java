package com.nori.tc.deeplink.runtime;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * 디바이스 주소(host + port) 값 객체.
 *
 * 예:
 * - 제어 채널: 192.168.1.114:8060
 * - 이벤트 스트림: 192.168.1.114:8085
 */
public record HostPort(String host, int port) {

    private static final Pattern DOTTED_IPV4 = Pattern.compile("^\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}$");

    public HostPort {
        Objects.requireNonNull(host, "host must not be null");
        if (host.isBlank()) {
            throw new IllegalArgumentException("host is blank");
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("invalid port: " + port);
        }
    }

    /**
     * "a.b.c.d" 형식인지 확인한다. (각 옥텟 범위는 검사하지 않는다)
     */
    public static boolean isDottedIpv4(String host) {
        return host != null && DOTTED_IPV4.matcher(host.trim()).matches();
    }

    public String httpBaseUrl() {
        return "http://" + host + ":" + port;
    }

    @Override
    public String toString() {
        return host + ":" + port;
    }
}
