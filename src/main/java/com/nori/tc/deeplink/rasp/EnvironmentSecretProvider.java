package com.nori.tc.deeplink.rasp;

import org.springframework.core.env.Environment;

import java.util.Objects;
import java.util.Optional;

/**
 * Spring Environment 기반 secret 조회.
 *
 * - OS 환경변수(RASP_LOGIN 등), system property, 커맨드라인 인자를 모두 본다.
 */
public class EnvironmentSecretProvider implements SecretProvider {

    private final Environment environment;

    public EnvironmentSecretProvider(Environment environment) {
        this.environment = Objects.requireNonNull(environment, "environment must not be null");
    }

    @Override
    public Optional<String> lookup(String name) {
        String v = environment.getProperty(name);
        return (v == null || v.isEmpty()) ? Optional.empty() : Optional.of(v);
    }
}
