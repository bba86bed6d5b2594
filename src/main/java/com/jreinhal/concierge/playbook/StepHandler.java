package com.jreinhal.concierge.playbook;

import java.util.Map;

/**
 * Runs one playbook step on behalf of an agent, usually by invoking the tool named by
 * {@link PlaybookStep#toolName()}.
 */
@FunctionalInterface
public interface StepHandler {

    /**
     * @param previous results of the steps that already ran, keyed by step id
     * @return step output; a thrown exception fails the step
     */
    Map<String, Object> handle(PlaybookStep step, Map<String, Object> input, Map<String, StepResult> previous) throws Exception;
}
