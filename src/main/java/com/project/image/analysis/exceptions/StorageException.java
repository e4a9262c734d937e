package com.project.image.analysis.exceptions;

/** Raised when uploads or analysis artifacts cannot be written or read. */
public class StorageException extends RuntimeException {
    public StorageException(String message) { super(message); }
    public StorageException(String message, Throwable cause) { super(message, cause); }
}
