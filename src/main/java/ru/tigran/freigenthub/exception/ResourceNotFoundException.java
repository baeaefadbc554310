package ru.tigran.freigenthub.exception;

/**
 * Thrown when a requested profile or agent does not exist.
 * HTTP status: 404 Not Found
 */
public class ResourceNotFoundException extends ApplicationException {
    public ResourceNotFoundException(String message, String errorCode) {
        super(message, errorCode);
    }
}
