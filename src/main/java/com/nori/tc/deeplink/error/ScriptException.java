package com.nori.tc.deeplink.error;

/**
 * RASP 스크립트 파싱/실행 실패(형식 오류, 알 수 없는 step, secret 누락, step 실행 실패).
 */
public class ScriptException extends DeepLinkCertException {

    public ScriptException(String message) {
        super(ErrorKind.SCRIPT, message);
    }

    public ScriptException(String message, Throwable cause) {
        super(ErrorKind.SCRIPT, message, cause);
    }
}
