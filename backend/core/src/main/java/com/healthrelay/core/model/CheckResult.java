package com.healthrelay.core.model;

import java.time.Instant;
import java.util.List;

public record CheckResult(
        boolean success,
        int httpStatus,
        List<String> errors,
        Instant timestamp
) {
    public CheckResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static CheckResult healthy(int httpStatus, Instant timestamp) {
        return new CheckResult(true, httpStatus, List.of(), timestamp);
    }

    public static CheckResult failed(List<String> errors, Instant timestamp) {
        return new CheckResult(false, 0, errors, timestamp);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
