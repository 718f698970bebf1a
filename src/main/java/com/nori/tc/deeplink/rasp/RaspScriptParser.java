package com.nori.tc.deeplink.rasp;

import com.nori.tc.deeplink.error.ScriptException;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * RaspScriptParser
 *
 * 지원 문법:
 * <pre>
 * params:
 *   rasp_version: 1
 *   default_keypress_wait: 2
 *   channels:
 *     MyApp: dev
 * steps:
 *   - launch: MyApp
 *   - pause: 5
 *   - press: ok
 *   - text: script-login
 * </pre>
 *
 * 오류 정책:
 * - 첫 오류에서 ScriptException으로 중단한다(전체 오류 수집은 RaspScriptValidator 담당).
 * - launch/press/text 값은 scalar면 문자열로 받는다(예: launch: 151908).
 */
public final class RaspScriptParser {

    public static final String KEY_PARAMS = "params";
    public static final String KEY_STEPS = "steps";
    public static final String KEY_VERSION = "rasp_version";
    public static final String KEY_DEFAULT_WAIT = "default_keypress_wait";
    public static final String KEY_CHANNELS = "channels";

    private RaspScriptParser() {}

    public static RaspScript parseFile(String scriptPath) {
        Path p = Paths.get(scriptPath);
        Object root;
        try {
            root = RaspYaml.load(p);
        } catch (NoSuchFileException e) {
            throw new ScriptException("RASP script file not found: " + scriptPath, e);
        } catch (IOException | YAMLException e) {
            throw new ScriptException("Failed to parse RASP script: " + scriptPath + " -> " + e.getMessage(), e);
        }
        return parse(p.toString(), root);
    }

    static RaspScript parse(String source, Object root) {
        if (!(root instanceof Map<?, ?> doc)) {
            throw new ScriptException("RASP script must be a mapping with a \"steps\" sequence: " + source);
        }

        RaspParams params = parseParams(source, doc.get(KEY_PARAMS));

        Object stepsNode = doc.get(KEY_STEPS);
        if (!(stepsNode instanceof List<?> rawSteps)) {
            throw new ScriptException("RASP script must contain a \"steps\" sequence: " + source);
        }

        List<RaspStep> steps = new ArrayList<>(rawSteps.size());
        for (int i = 0; i < rawSteps.size(); i++) {
            steps.add(parseStep(source, i + 1, rawSteps.get(i)));
        }
        return new RaspScript(source, params, steps);
    }

    private static RaspParams parseParams(String source, Object node) {
        if (node == null) {
            return RaspParams.DEFAULTS;
        }
        if (!(node instanceof Map<?, ?> map)) {
            throw new ScriptException("params must be a mapping in " + source);
        }

        Double version = null;
        Object versionNode = map.get(KEY_VERSION);
        if (versionNode != null) {
            version = RaspYaml.asNumber(versionNode);
            if (version == null) {
                throw new ScriptException(KEY_VERSION + " must be a number in " + source);
            }
        }

        long delayMs = RaspParams.DEFAULT_STEP_DELAY_MS;
        Object waitNode = map.get(KEY_DEFAULT_WAIT);
        if (waitNode != null) {
            Double sec = RaspYaml.asNumber(waitNode);
            if (sec == null || sec < 0) {
                throw new ScriptException(KEY_DEFAULT_WAIT + " must be a number >= 0 in " + source);
            }
            delayMs = RaspYaml.secondsToMs(sec);
        }

        Map<String, String> channels = new LinkedHashMap<>();
        Object channelsNode = map.get(KEY_CHANNELS);
        if (channelsNode != null) {
            if (!(channelsNode instanceof Map<?, ?> ch)) {
                throw new ScriptException(KEY_CHANNELS + " must be a mapping in " + source);
            }
            for (Map.Entry<?, ?> e : ch.entrySet()) {
                if (e.getKey() != null && e.getValue() != null) {
                    channels.put(String.valueOf(e.getKey()), String.valueOf(e.getValue()));
                }
            }
        }
        return new RaspParams(version, delayMs, channels);
    }

    private static RaspStep parseStep(String source, int stepNo, Object node) {
        if (!(node instanceof Map<?, ?> map) || map.size() != 1) {
            throw new ScriptException("Step " + stepNo + ": must contain exactly one action in " + source);
        }
        Map.Entry<?, ?> entry = map.entrySet().iterator().next();
        String kind = String.valueOf(entry.getKey());
        Object value = entry.getValue();

        switch (kind) {
            case "launch" -> {
                return new LaunchStep(requireScalar(source, stepNo, kind, value));
            }
            case "press" -> {
                return new PressStep(requireScalar(source, stepNo, kind, value));
            }
            case "text" -> {
                return new TextStep(requireScalar(source, stepNo, kind, value));
            }
            case "pause" -> {
                Double sec = RaspYaml.asNumber(value);
                if (sec == null || sec < 0) {
                    throw new ScriptException("Step " + stepNo + ": pause requires a number of seconds >= 0 in " + source);
                }
                return new PauseStep(RaspYaml.secondsToMs(sec));
            }
            default -> throw new ScriptException("Step " + stepNo + ": unknown step type \"" + kind + "\" in " + source);
        }
    }

    private static String requireScalar(String source, int stepNo, String kind, Object value) {
        if (value instanceof String s && !s.isEmpty()) {
            return s;
        }
        if (value instanceof Number || value instanceof Boolean) {
            return String.valueOf(value);
        }
        throw new ScriptException("Step " + stepNo + ": " + kind + " requires a non-empty value in " + source);
    }
}
