package com.nori.tc.deeplink.rasp;

import java.util.Locale;

/**
 * text step placeholder 규칙.
 *
 * - "script-login"    -> RASP_LOGIN
 * - "script-password" -> RASP_PASSWORD
 * - "script-&lt;x&gt;"      -> RASP_&lt;X&gt; (대문자, 영숫자 외 문자는 '_')
 */
public final class SecretPlaceholders {

    public static final String PREFIX = "script-";

    public static final String LOGIN_SECRET = "RASP_LOGIN";
    public static final String PASSWORD_SECRET = "RASP_PASSWORD";

    private SecretPlaceholders() {
        // utility class
    }

    public static boolean isPlaceholder(String value) {
        return value != null && value.startsWith(PREFIX);
    }

    /**
     * placeholder가 가리키는 secret 이름.
     *
     * @throws IllegalArgumentException placeholder가 아닌 값
     */
    public static String secretName(String value) {
        if (!isPlaceholder(value)) {
            throw new IllegalArgumentException("not a secret placeholder: " + value);
        }
        String suffix = value.substring(PREFIX.length()).toUpperCase(Locale.ROOT);
        if (suffix.equals("LOGIN")) {
            return LOGIN_SECRET;
        }
        if (suffix.equals("PASSWORD")) {
            return PASSWORD_SECRET;
        }
        return "RASP_" + suffix.replaceAll("[^A-Z0-9_]", "_");
    }
}
