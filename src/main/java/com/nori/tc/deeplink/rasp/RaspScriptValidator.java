package com.nori.tc.deeplink.rasp;

import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * RaspScriptValidator
 *
 * 역할:
 * - 디바이스 없이 RASP 파일의 구조/값을 검사하고 예상 실행 시간을 계산한다.
 * - 파일 읽기 외에는 부작용이 없다.
 *
 * 규칙:
 * - 오류는 예외로 던지지 않고 모두 수집한다(파일 없음/YAML 문법 오류 포함).
 * - 예상 시간은 ms 정수로 누적한 뒤 초 단위로 올림한다.
 *   launch 3s, press 0.1s, text 글자당 0.05s, pause 지정값, step 사이마다 default_keypress_wait(기본 1s)
 */
public class RaspScriptValidator {

    public static final Set<String> STEP_TYPES = Set.of("launch", "press", "text", "pause");

    static final long LAUNCH_ESTIMATE_MS = 3000;
    static final long PRESS_ESTIMATE_MS = 100;
    static final long TEXT_CHAR_ESTIMATE_MS = 50;

    public RaspValidationResult validate(String scriptPath) {
        Object root;
        try {
            root = RaspYaml.load(Paths.get(scriptPath));
        } catch (NoSuchFileException e) {
            return RaspValidationResult.of(List.of("Script file not found: " + scriptPath), 0, 0);
        } catch (IOException | YAMLException e) {
            return RaspValidationResult.of(List.of("Failed to parse YAML: " + e.getMessage()), 0, 0);
        }
        return validateTree(root);
    }

    /**
     * 이미 로드된 YAML 트리 검증.
     */
    public RaspValidationResult validateTree(Object root) {
        List<String> errors = new ArrayList<>();

        if (!(root instanceof Map<?, ?> doc)) {
            errors.add(root == null
                    ? "Script file is empty or invalid YAML"
                    : "Script must be a mapping with a \"steps\" section");
            return RaspValidationResult.of(errors, 0, 0);
        }

        Object paramsNode = doc.get(RaspScriptParser.KEY_PARAMS);
        long stepDelayMs = RaspParams.DEFAULT_STEP_DELAY_MS;
        if (paramsNode != null) {
            if (paramsNode instanceof Map<?, ?> params) {
                stepDelayMs = validateParams(params, errors);
            } else {
                errors.add("params must be an object");
            }
        }

        Object stepsNode = doc.get(RaspScriptParser.KEY_STEPS);
        if (stepsNode == null) {
            errors.add("Script must contain a \"steps\" section");
            return RaspValidationResult.of(errors, 0, 0);
        }
        if (!(stepsNode instanceof List<?> steps)) {
            errors.add("\"steps\" must be an array");
            return RaspValidationResult.of(errors, 0, 0);
        }

        long totalMs = 0;
        for (int i = 0; i < steps.size(); i++) {
            totalMs = saturatedAdd(totalMs, validateStep(i + 1, steps.get(i), errors));
        }
        if (steps.size() > 1) {
            long gapsMs;
            try {
                gapsMs = Math.multiplyExact(steps.size() - 1L, stepDelayMs);
            } catch (ArithmeticException e) {
                gapsMs = Long.MAX_VALUE;
            }
            totalMs = saturatedAdd(totalMs, gapsMs);
        }

        long seconds = totalMs / 1000 + (totalMs % 1000 == 0 ? 0 : 1);
        return RaspValidationResult.of(errors, steps.size(), seconds);
    }

    // 아주 큰 pause 값에서도 합계가 음수로 넘어가지 않게 Long.MAX_VALUE에서 멈춘다
    private static long saturatedAdd(long a, long b) {
        long sum = a + b;
        return sum < a ? Long.MAX_VALUE : sum;
    }

    /**
     * @return 검증된 step 간격(ms). 값이 잘못되었으면 기본값
     */
    private static long validateParams(Map<?, ?> params, List<String> errors) {
        Object version = params.get(RaspScriptParser.KEY_VERSION);
        if (version != null && !(version instanceof Number && RaspYaml.asNumber(version) != null)) {
            errors.add("rasp_version must be a number");
        }

        long delayMs = RaspParams.DEFAULT_STEP_DELAY_MS;
        Object wait = params.get(RaspScriptParser.KEY_DEFAULT_WAIT);
        if (wait != null) {
            Double sec = wait instanceof Number ? RaspYaml.asNumber(wait) : null;
            if (sec != null && sec >= 0) {
                delayMs = RaspYaml.secondsToMs(sec);
            } else {
                errors.add("default_keypress_wait must be a number");
            }
        }

        Object channels = params.get(RaspScriptParser.KEY_CHANNELS);
        if (channels != null && !(channels instanceof Map)) {
            errors.add("channels must be an object");
        }
        return delayMs;
    }

    /**
     * @return step 예상 시간(ms)
     */
    private static long validateStep(int stepNo, Object node, List<String> errors) {
        String prefix = "Step " + stepNo + ": ";
        if (!(node instanceof Map<?, ?> step)) {
            errors.add(prefix + "Must be an object");
            return 0;
        }
        if (step.size() != 1) {
            errors.add(prefix + "Must contain exactly one action");
            return 0;
        }

        Map.Entry<?, ?> entry = step.entrySet().iterator().next();
        String type = String.valueOf(entry.getKey());
        Object value = entry.getValue();

        if (!STEP_TYPES.contains(type)) {
            errors.add(prefix + "Unknown step type \"" + type + "\"");
            return 0;
        }

        switch (type) {
            case "launch" -> {
                if (!isNonEmptyString(value)) {
                    errors.add(prefix + "launch requires a string channel ID");
                }
                return LAUNCH_ESTIMATE_MS;
            }
            case "press" -> {
                if (!isNonEmptyString(value)) {
                    errors.add(prefix + "press requires a string key name");
                } else if (!RaspKeys.isValidKey((String) value)) {
                    errors.add(prefix + "\"" + value + "\" is not a valid key");
                }
                return PRESS_ESTIMATE_MS;
            }
            case "text" -> {
                if (!isNonEmptyString(value)) {
                    errors.add(prefix + "text requires a string value");
                    return 0;
                }
                return ((String) value).length() * TEXT_CHAR_ESTIMATE_MS;
            }
            default -> {
                Double seconds = RaspYaml.asNumber(value);
                if (seconds == null || seconds < 0) {
                    errors.add(prefix + "pause requires a positive number of seconds");
                    return 0;
                }
                return RaspYaml.secondsToMs(seconds);
            }
        }
    }

    private static boolean isNonEmptyString(Object value) {
        return value instanceof String s && !s.isEmpty();
    }
}
