package com.project.image.analysis.exceptions;

/** Domain-specific exception for image analysis errors. */
public class ImageAnalysisException extends RuntimeException {
    public ImageAnalysisException(String message) { super(message); }
    public ImageAnalysisException(String message, Throwable cause) { super(message, cause); }
}
