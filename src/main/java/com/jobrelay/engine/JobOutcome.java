package com.jobrelay.engine;

/**
 * What a worker reports at the end of an execution.
 */
public record JobOutcome(boolean succeeded, String error) {

    private static final JobOutcome SUCCESS = new JobOutcome(true, null);

    public static JobOutcome success() {
        return SUCCESS;
    }

    public static JobOutcome failure(String error) {
        return new JobOutcome(false, error == null ? "Job failed" : error);
    }

    public static JobOutcome failure(Throwable error) {
        String message = error.getMessage();
        return failure(message == null || message.isBlank()
                ? error.getClass().getName()
                : error.getClass().getName() + ": " + message);
    }
}
