package com.nori.tc.deeplink.rasp;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * RASP 키 이름 규칙.
 *
 * - ALIASES: 스크립트 토큰(소문자) -> ECP 키 이름
 * - KNOWN_KEYS: 검증기가 허용하는 토큰(소문자). alias 외에 select/play/rev/fwd 포함
 * - alias에 없는 토큰은 실행 시 그대로 전달된다(신규 raw 키 이름 허용).
 */
public final class RaspKeys {

    public static final Map<String, String> ALIASES;

    static {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("ok", "Select");
        m.put("up", "Up");
        m.put("down", "Down");
        m.put("left", "Left");
        m.put("right", "Right");
        m.put("home", "Home");
        m.put("back", "Back");
        m.put("replay", "InstantReplay");
        m.put("info", "Info");
        m.put("backspace", "Backspace");
        m.put("search", "Search");
        m.put("enter", "Enter");
        ALIASES = Collections.unmodifiableMap(m);
    }

    public static final Set<String> KNOWN_KEYS = Set.of(
            "ok", "up", "down", "left", "right", "home", "back", "replay", "info",
            "backspace", "search", "enter", "select", "play", "rev", "fwd");

    private static final Pattern SINGLE_ALNUM = Pattern.compile("^[A-Za-z0-9]$");

    private RaspKeys() {
        // utility class
    }

    /**
     * 대소문자 무시 alias 해석. alias가 없으면 토큰을 그대로 반환한다.
     */
    public static String normalize(String token) {
        if (token == null) {
            return null;
        }
        String mapped = ALIASES.get(token.trim().toLowerCase(Locale.ROOT));
        return mapped != null ? mapped : token.trim();
    }

    /**
     * 검증 규칙: 알려진 키이거나 영숫자 한 글자.
     */
    public static boolean isValidKey(String token) {
        if (token == null || token.isBlank()) {
            return false;
        }
        return KNOWN_KEYS.contains(token.toLowerCase(Locale.ROOT)) || SINGLE_ALNUM.matcher(token).matches();
    }
}
