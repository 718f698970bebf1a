package com.nori.tc.deeplink.time;

/**
 * 협조적 대기 지점(poll tick, pause, step 간 delay, 문자 간 delay).
 *
 * 테스트에서는 가상 시간을 전진시키는 구현으로 교체한다.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(long millis) throws InterruptedException;
}
