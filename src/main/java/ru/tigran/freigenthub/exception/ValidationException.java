package ru.tigran.freigenthub.exception;

/**
 * Thrown for business validation failures not covered by bean validation.
 * HTTP status: 400 Bad Request
 */
public class ValidationException extends ApplicationException {
    public ValidationException(String message, String errorCode) {
        super(message, errorCode);
    }
}
