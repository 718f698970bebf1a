package com.nori.tc.deeplink.time;

/**
 * 경과 시간 계산 전용 시간원.
 *
 * 규칙:
 * - 대기 deadline / grace / sign-in 소요시간 계산은 반드시 이 인터페이스를 사용한다.
 * - 값 자체는 의미가 없고 두 값의 차이만 의미가 있다.
 */
public interface MonotonicClock {

    long nowMs();
}
