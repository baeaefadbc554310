package ru.tigran.freigenthub.exception;

/**
 * Error body returned by {@link GlobalExceptionHandler}.
 */
public record ErrorResponse(String errorCode, String message) {
}
