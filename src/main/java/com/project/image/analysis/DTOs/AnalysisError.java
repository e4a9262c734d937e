package com.project.image.analysis.DTOs;

/** Why a pipeline stage fell back to its default value. */
public record AnalysisError(String stage, String message, Throwable cause) {

    public static AnalysisError of(String stage, Throwable cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new AnalysisError(stage, message, cause);
    }

    public static AnalysisError of(String stage, String message) {
        return new AnalysisError(stage, message, null);
    }
}
