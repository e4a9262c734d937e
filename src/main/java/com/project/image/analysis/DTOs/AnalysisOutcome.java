package com.project.image.analysis.DTOs;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of a single pipeline stage. A failed outcome still carries a usable
 * fallback value so later stages always receive well-typed input.
 */
public final class AnalysisOutcome<T> {

    private final T value;
    private final AnalysisError error;

    private AnalysisOutcome(T value, AnalysisError error) {
        this.value = Objects.requireNonNull(value, "value");
        this.error = error;
    }

    public static <T> AnalysisOutcome<T> success(T value) {
        return new AnalysisOutcome<>(value, null);
    }

    public static <T> AnalysisOutcome<T> failure(AnalysisError error, T fallback) {
        return new AnalysisOutcome<>(fallback, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    /** The computed value, or the stage fallback when the stage failed. */
    public T value() {
        return value;
    }

    public Optional<AnalysisError> error() {
        return Optional.ofNullable(error);
    }

    @Override
    public String toString() {
        return isSuccess() ? "Success[" + value + "]" : "Failure[" + error.stage() + ": " + error.message() + "]";
    }
}
