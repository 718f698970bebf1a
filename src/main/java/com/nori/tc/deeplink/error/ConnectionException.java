package com.nori.tc.deeplink.error;

/**
 * 이벤트 스트림 연결 실패 또는 연결 중 끊김.
 */
public class ConnectionException extends DeepLinkCertException {

    public ConnectionException(String message) {
        super(ErrorKind.CONNECTION, message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(ErrorKind.CONNECTION, message, cause);
    }
}
