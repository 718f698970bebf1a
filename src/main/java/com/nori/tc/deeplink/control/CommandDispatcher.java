package com.nori.tc.deeplink.control;

import com.nori.tc.deeplink.error.CommandException;
import com.nori.tc.deeplink.time.Sleeper;

/**
 * CommandDispatcher
 *
 * 역할:
 * - 디바이스 제어 채널(ECP)로 상태 없는 명령을 보낸다.
 * - 성공 = 프로토콜 수준 수락(2xx)뿐이다. 실제 동작 여부는 beacon 대기로 확인한다.
 *
 * 규칙:
 * - 재시도하지 않는다.
 * - 실패(비 2xx, 네트워크, 타임아웃)는 {@link CommandException}.
 */
public interface CommandDispatcher {

    /** 문자 입력 간격: RASP 스크립트 실행 */
    long SCRIPT_CHAR_DELAY_MS = 50;

    /**
     * POST /launch/{appId}[?contentId&mediaType]
     */
    void launch(String appId, DeepLinkParams params);

    /**
     * POST /input?contentId&mediaType
     */
    void input(DeepLinkParams params);

    /**
     * POST /keypress/{key}
     */
    void keypress(String key);

    /**
     * POST /keypress/Lit_{urlEncodedChar}
     *
     * @param character 코드포인트 1개로 이루어진 문자열
     */
    void enterCharacter(String character);

    /**
     * 문자열을 한 글자씩 보낸다. 각 글자 뒤에 delayMs만큼 쉰다.
     * 화면 키보드 입력 누락을 막기 위한 고정 간격이다.
     */
    default void enterText(String text, long delayMs, Sleeper sleeper) throws InterruptedException {
        if (text == null) {
            return;
        }
        int i = 0;
        while (i < text.length()) {
            int cp = text.codePointAt(i);
            enterCharacter(new String(Character.toChars(cp)));
            sleeper.sleep(delayMs);
            i += Character.charCount(cp);
        }
    }
}
