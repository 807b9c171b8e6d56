package com.project.image.anomalies.exceptions;

/** Reading inputs from or writing artifacts to disk failed. */
public class StorageException extends RuntimeException {
    public StorageException(String message) { super(message); }
    public StorageException(String message, Throwable cause) { super(message, cause); }
}
