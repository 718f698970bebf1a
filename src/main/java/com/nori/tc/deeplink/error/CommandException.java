package com.nori.tc.deeplink.error;

/**
 * ECP 명령이 2xx가 아닌 응답을 받았거나 네트워크/타임아웃으로 실패한 경우.
 *
 * - httpStatus: 응답을 받은 경우의 상태 코드, 네트워크 실패면 null
 */
public class CommandException extends DeepLinkCertException {

    private final String command;
    private final Integer httpStatus;

    public CommandException(String command, Integer httpStatus, String message, Throwable cause) {
        super(ErrorKind.COMMAND, message, cause);
        this.command = command;
        this.httpStatus = httpStatus;
    }

    public String getCommand() {
        return command;
    }

    public Integer getHttpStatus() {
        return httpStatus;
    }
}
