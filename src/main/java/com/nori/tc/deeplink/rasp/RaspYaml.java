package com.nori.tc.deeplink.rasp;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * RASP 파일을 YAML 트리(Map/List/scalar)로 읽는다.
 *
 * - SafeConstructor만 사용한다(임의 타입 생성 금지).
 * - 파서와 검증기가 같은 로더를 공유한다.
 */
final class RaspYaml {

    private RaspYaml() {
    }

    /**
     * @return YAML 루트 객체, 빈 문서면 null
     * @throws java.nio.file.NoSuchFileException 파일 없음
     * @throws org.yaml.snakeyaml.error.YAMLException 문법 오류
     */
    static Object load(Path file) throws IOException {
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return yaml.load(r);
        }
    }

    /**
     * YAML 숫자 또는 숫자 문자열을 double로. 해석 불가하거나 NaN/무한대면 null.
     */
    static Double asNumber(Object v) {
        Double d = null;
        if (v instanceof Number n) {
            d = n.doubleValue();
        } else if (v instanceof String s && !s.isBlank()) {
            try {
                d = Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return d != null && Double.isFinite(d) ? d : null;
    }

    static long secondsToMs(double seconds) {
        return Math.round(seconds * 1000.0);
    }
}
