package com.visionai.gateway.core.model;

/**
 * Result of one best-effort step such as a subscribe or a disconnect.
 *
 * <p>Batch operations return one outcome per member instead of throwing, so a failing member never
 * aborts the batch and callers (and tests) can still see what went wrong.</p>
 *
 * @param target what the step acted on (channel or service name)
 * @param step   short verb for logs, e.g. {@code "unsubscribe"}
 * @param error  failure message, {@code null} on success
 */
public record CleanupOutcome(String target, String step, String error) {

    public static CleanupOutcome ok(String target, String step) {
        return new CleanupOutcome(target, step, null);
    }

    public static CleanupOutcome failed(String target, String step, Throwable cause) {
        String message = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
        return new CleanupOutcome(target, step, message);
    }

    public boolean succeeded() {
        return error == null;
    }
}
