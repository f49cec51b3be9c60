package com.autonomous.pipeline.logging;

import org.slf4j.MDC;

/**
 * MDC keys shown in the console pattern while a task, sequence or step runs.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setSequence(String sequenceId) {
        MDC.put("sequenceId", sequenceId);
    }

    public static void setTask(String taskId) {
        MDC.put("taskId", taskId);
    }

    public static void setStep(String stepName) {
        MDC.put("step", stepName);
    }

    public static void clearStep() {
        MDC.remove("step");
    }

    public static void clearTask() {
        MDC.remove("taskId");
        MDC.remove("step");
    }

    public static void clear() {
        MDC.remove("sequenceId");
        clearTask();
    }
}
