package com.nori.tc.deeplink.rasp;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RaspScriptValidatorTests {

    private final RaspScriptValidator validator = new RaspScriptValidator();

    @TempDir
    Path tmp;

    @Test
    void example_script_is_valid_with_estimate() {
        RaspValidationResult result = validator.validate(RaspFixtures.path("signin-example.rasp"));

        assertTrue(result.valid(), () -> String.join("; ", result.errors()));
        assertEquals(4, result.stepCount());
        // 3 + 5 + 0.1 + 0.1 + 3 gaps x 1s = 11.2 -> 12
        assertEquals(12, result.estimatedDurationSeconds());
    }

    @Test
    void collects_every_error() {
        RaspValidationResult result = validator.validate(RaspFixtures.path("invalid-steps.rasp"));

        assertFalse(result.valid());
        assertEquals(6, result.stepCount());
        assertEquals(List.of(
                "rasp_version must be a number",
                "channels must be an object",
                "Step 2: \"teleport\" is not a valid key",
                "Step 3: text requires a string value",
                "Step 4: pause requires a positive number of seconds",
                "Step 5: Unknown step type \"invalid\"",
                "Step 6: Must contain exactly one action"), result.errors());
    }

    @Test
    void missing_file_is_reported_not_thrown() {
        RaspValidationResult result = validator.validate("/no/such/dir/signin.rasp");

        assertFalse(result.valid());
        assertEquals(List.of("Script file not found: /no/such/dir/signin.rasp"), result.errors());
    }

    @Test
    void empty_and_broken_files_are_errors() {
        RaspValidationResult empty = validator.validate(RaspFixtures.path("empty.rasp"));
        assertEquals(List.of("Script file is empty or invalid YAML"), empty.errors());

        RaspValidationResult broken = validator.validate(RaspFixtures.path("broken-yaml.rasp"));
        assertFalse(broken.valid());
        assertTrue(broken.errors().get(0).startsWith("Failed to parse YAML"));
    }

    @Test
    void steps_section_must_be_a_sequence() {
        assertEquals(List.of("Script must contain a \"steps\" section"),
                validator.validate(RaspFixtures.path("no-steps.rasp")).errors());
        assertEquals(List.of("\"steps\" must be an array"),
                validator.validateTree(Map.of("steps", "launch dev")).errors());
    }

    @Test
    void step_gap_uses_default_keypress_wait() {
        Map<String, Object> tree = Map.of(
                "params", Map.of("default_keypress_wait", 2),
                "steps", List.of(Map.of("press", "ok"), Map.of("press", "ok"), Map.of("text", "abcd")));

        RaspValidationResult result = validator.validateTree(tree);

        assertTrue(result.valid());
        // 0.1 + 0.1 + 0.2 + 2 gaps x 2s = 4.4 -> 5
        assertEquals(5, result.estimatedDurationSeconds());
    }

    @Test
    void nan_pause_is_rejected() throws Exception {
        RaspValidationResult dotNan = validator.validate(write("""
                steps:
                  - pause: .nan
                """));
        assertFalse(dotNan.valid());
        assertEquals(List.of("Step 1: pause requires a positive number of seconds"), dotNan.errors());

        RaspValidationResult plainNan = validator.validate(write("""
                steps:
                  - pause: NaN
                """));
        assertFalse(plainNan.valid());
        assertEquals(List.of("Step 1: pause requires a positive number of seconds"), plainNan.errors());
    }

    @Test
    void infinite_pause_is_rejected_and_estimate_stays_finite() throws Exception {
        RaspValidationResult result = validator.validate(write("""
                steps:
                  - launch: dev
                  - pause: .inf
                """));

        assertFalse(result.valid());
        assertEquals(List.of("Step 2: pause requires a positive number of seconds"), result.errors());
        // launch 3s + 1 gap x 1s
        assertEquals(4, result.estimatedDurationSeconds());
    }

    @Test
    void infinite_default_keypress_wait_is_rejected() throws Exception {
        RaspValidationResult result = validator.validate(write("""
                params:
                  default_keypress_wait: .inf
                steps:
                  - press: ok
                  - press: ok
                """));

        assertFalse(result.valid());
        assertEquals(List.of("default_keypress_wait must be a number"), result.errors());
        // 잘못된 값은 기본 1s 간격으로 추정
        assertEquals(2, result.estimatedDurationSeconds());
    }

    @Test
    void huge_finite_pause_does_not_wrap_estimate() {
        Map<String, Object> tree = Map.of(
                "steps", List.of(Map.of("launch", "dev"), Map.of("pause", 1e300)));

        RaspValidationResult result = validator.validateTree(tree);

        assertTrue(result.valid());
        assertTrue(result.estimatedDurationSeconds() > 0);
    }

    private String write(String yaml) throws Exception {
        Path file = tmp.resolve("script.rasp");
        Files.writeString(file, yaml, StandardCharsets.UTF_8);
        return file.toString();
    }
}
