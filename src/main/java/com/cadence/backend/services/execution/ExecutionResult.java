package com.cadence.backend.services.execution;

import com.cadence.backend.enums.ErrorCategory;

/**
 * Outcome reported by an {@link ExecutionAdapter}. Failures carry a typed
 * category so recovery never has to parse the diagnostic text.
 */
public class ExecutionResult {
    private final boolean success;
    private final ErrorCategory errorCategory;
    private final String message;

    private ExecutionResult(boolean success, ErrorCategory errorCategory, String message) {
        this.success = success;
        this.errorCategory = errorCategory;
        this.message = message;
    }

    public static ExecutionResult success() {
        return new ExecutionResult(true, null, null);
    }

    public static ExecutionResult failure(ErrorCategory errorCategory, String message) {
        return new ExecutionResult(false, errorCategory != null ? errorCategory : ErrorCategory.UNKNOWN, message);
    }

    public boolean isSuccess() { return success; }
    public ErrorCategory getErrorCategory() { return errorCategory; }
    public String getMessage() { return message; }

    public boolean isWarmupDeferral() {
        return !success && errorCategory == ErrorCategory.WARMUP_LIMIT_DEFERRED;
    }
}
