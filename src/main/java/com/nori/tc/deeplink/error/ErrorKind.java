package com.nori.tc.deeplink.error;

/**
 * 실패 분류(taxonomy)
 *
 * - CONNECTION    : 이벤트 스트림(8085) 연결 실패/끊김 -> 전체 run 중단
 * - COMMAND       : ECP 요청 거절 또는 네트워크 실패 -> 현재 phase만 실패
 * - BEACON_TIMEOUT: 대기 deadline 경과(누락 beacon 포함)
 * - SCRIPT        : RASP 스크립트 오류, secret 누락 -> sign-in 및 전체 run 중단
 */
public enum ErrorKind {
    CONNECTION,
    COMMAND,
    BEACON_TIMEOUT,
    SCRIPT
}
