package com.jreinhal.concierge.playbook;

import java.util.Collections;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a single step through its handler. A missing handler skips the step; an exception fails it.
 */
final class StepInvoker {
    private static final Logger log = LoggerFactory.getLogger(StepInvoker.class);

    private StepInvoker() {
    }

    static StepResult invoke(PlaybookStep step, Map<String, StepHandler> handlers, Map<String, Object> input,
                             Map<String, StepResult> previous) {
        StepHandler handler = handlers.get(step.toolName());
        if (handler == null) {
            return StepResult.skipped(step, "Tool " + step.toolName() + " not found");
        }
        try {
            return StepResult.succeeded(step, handler.handle(step, input, Collections.unmodifiableMap(previous)));
        }
        catch (Exception e) {
            log.debug("Playbook step {} ({}) failed: {}", step.stepId(), step.toolName(), e.getMessage());
            return StepResult.failed(step, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }
}
