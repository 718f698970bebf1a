package com.nori.tc.deeplink.rasp;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * RaspScript
 *
 * - 파싱 후 불변. 실행/검증 1회 동안만 보유한다.
 */
public final class RaspScript {

    private final String sourceFile;
    private final RaspParams params;
    private final List<RaspStep> steps;

    public RaspScript(String sourceFile, RaspParams params, List<RaspStep> steps) {
        this.sourceFile = Objects.requireNonNull(sourceFile, "sourceFile must not be null");
        this.params = Objects.requireNonNull(params, "params must not be null");
        this.steps = Collections.unmodifiableList(List.copyOf(Objects.requireNonNull(steps, "steps must not be null")));
    }

    public String getSourceFile() {
        return sourceFile;
    }

    public RaspParams getParams() {
        return params;
    }

    public List<RaspStep> getSteps() {
        return steps;
    }
}
