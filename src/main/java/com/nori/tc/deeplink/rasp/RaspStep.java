package com.nori.tc.deeplink.rasp;

/**
 * RASP step marker interface.
 *
 * 스크립트 한 줄 {@code {launch|press|text|pause: value}}에 대응하는 닫힌 variant 집합.
 */
public sealed interface RaspStep permits
        LaunchStep,
        PressStep,
        TextStep,
        PauseStep {

    /** YAML 키 이름(launch/press/text/pause) */
    String kind();

    /** 진행 로그용 설명 */
    String describe();
}
