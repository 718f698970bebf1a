package com.nori.tc.deeplink.error;

import java.util.Objects;

/**
 * 코어에서 발생하는 모든 실패의 공통 상위 타입.
 *
 * 규칙:
 * - unchecked 예외로만 전파한다.
 * - kind로 Sequencer가 phase 실패 / run 중단을 판단한다.
 */
public abstract class DeepLinkCertException extends RuntimeException {

    private final ErrorKind kind;

    protected DeepLinkCertException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    protected DeepLinkCertException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public ErrorKind getKind() {
        return kind;
    }
}
