package com.ora.normalization.service.workflow;

import java.util.List;

/**
 * Outcome of a process control request.
 *
 * @param success   whether the request reached its goal
 * @param affected  workflow names or process ids the request acted on
 * @param remaining workflow names still running when the request gave up
 * @param message   operator-facing detail
 */
public record ProcessControlResult(boolean success, List<String> affected, List<String> remaining, String message) {

    public ProcessControlResult {
        affected = List.copyOf(affected);
        remaining = List.copyOf(remaining);
    }

    public static ProcessControlResult success(List<String> affected, String message) {
        return new ProcessControlResult(true, affected, List.of(), message);
    }

    public static ProcessControlResult failure(List<String> remaining, String message) {
        return new ProcessControlResult(false, List.of(), remaining, message);
    }
}
