package com.nori.tc.deeplink.rasp;

import java.util.Optional;

/**
 * secret 이름 -> 값.
 *
 * - 값이 없거나 빈 문자열이면 Optional.empty()
 */
@FunctionalInterface
public interface SecretProvider {

    Optional<String> lookup(String name);
}
