package com.nori.tc.deeplink.rasp;

import com.nori.tc.deeplink.control.CommandDispatcher;
import com.nori.tc.deeplink.control.DeepLinkParams;
import com.nori.tc.deeplink.error.DeepLinkCertException;
import com.nori.tc.deeplink.error.ScriptException;
import com.nori.tc.deeplink.logging.StructuredLog;
import com.nori.tc.deeplink.time.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * RaspScriptRunner
 *
 * 역할:
 * - 파싱된 RaspScript를 순서대로 실행한다. 분기/재시도 없음.
 *
 * 실행 규칙:
 * - launch: channel 이름 해석 후 content 파라미터 없이 launch
 * - press : alias 해석 후 keypress
 * - text  : "script-" placeholder는 SecretProvider로 해석, 한 글자씩 50ms 간격 입력
 * - pause : 지정 시간만큼 sleep
 * - step 사이(마지막 뒤 제외)에 params.defaultStepDelayMs만큼 sleep
 *
 * 실패:
 * - 어느 step이든 실패하면 즉시 중단하고 ScriptException을 던진다.
 *   ScriptException이 아닌 원인은 "Step N (kind) failed"로 감싸 cause로 보존한다.
 *
 * 주의:
 * - secret 값은 로그에 마스킹해서만 남긴다.
 */
public class RaspScriptRunner {

    private static final Logger log = LoggerFactory.getLogger(RaspScriptRunner.class);

    private final CommandDispatcher dispatcher;
    private final SecretProvider secrets;
    private final Sleeper sleeper;

    public RaspScriptRunner(CommandDispatcher dispatcher, SecretProvider secrets, Sleeper sleeper) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.secrets = Objects.requireNonNull(secrets, "secrets must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    public void execute(RaspScript script) {
        List<RaspStep> steps = script.getSteps();
        RaspParams params = script.getParams();

        log.info(StructuredLog.event("rasp_started",
                "file", script.getSourceFile(),
                "steps", steps.size(),
                "stepDelayMs", params.getDefaultStepDelayMs()));

        for (int i = 0; i < steps.size(); i++) {
            RaspStep step = steps.get(i);
            int stepNo = i + 1;
            log.info(StructuredLog.event("rasp_step",
                    "step", "[" + stepNo + "/" + steps.size() + "]",
                    "action", step.describe()));
            try {
                run(step, params);
                if (i < steps.size() - 1) {
                    sleeper.sleep(params.getDefaultStepDelayMs());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("RASP script interrupted at step " + stepNo, e);
            } catch (ScriptException e) {
                log.warn(StructuredLog.event("rasp_step_failed", "step", stepNo, "kind", step.kind(),
                        "error", e.getMessage()));
                throw e;
            } catch (DeepLinkCertException | IllegalArgumentException e) {
                log.warn(StructuredLog.event("rasp_step_failed", "step", stepNo, "kind", step.kind(),
                        "error", e.getMessage()));
                throw new ScriptException("Step " + stepNo + " (" + step.kind() + ") failed: " + e.getMessage(), e);
            }
        }

        log.info(StructuredLog.event("rasp_completed", "file", script.getSourceFile(), "steps", steps.size()));
    }

    private void run(RaspStep step, RaspParams params) throws InterruptedException {
        if (step instanceof LaunchStep launch) {
            String appId = params.resolveChannel(launch.getChannelRef());
            dispatcher.launch(appId, DeepLinkParams.NONE);
        } else if (step instanceof PressStep press) {
            dispatcher.keypress(RaspKeys.normalize(press.getKeyToken()));
        } else if (step instanceof TextStep text) {
            enterText(text);
        } else if (step instanceof PauseStep pause) {
            sleeper.sleep(pause.getPauseMs());
        } else {
            throw new ScriptException("unsupported step: " + step.kind());
        }
    }

    private void enterText(TextStep step) throws InterruptedException {
        String value = step.getValue();
        if (step.isPlaceholder()) {
            String name = SecretPlaceholders.secretName(value);
            String secret = secrets.lookup(name)
                    .orElseThrow(() -> new ScriptException("Required secret not set: " + name));
            log.info(StructuredLog.event("rasp_text_secret", "secret", name, "value", StructuredLog.mask(secret)));
            dispatcher.enterText(secret, CommandDispatcher.SCRIPT_CHAR_DELAY_MS, sleeper);
        } else {
            log.info(StructuredLog.event("rasp_text", "length", value.length()));
            dispatcher.enterText(value, CommandDispatcher.SCRIPT_CHAR_DELAY_MS, sleeper);
        }
    }
}
