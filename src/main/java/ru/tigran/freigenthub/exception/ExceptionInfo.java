package ru.tigran.freigenthub.exception;

import org.springframework.http.HttpStatus;

/**
 * HTTP status and log level for an {@link ApplicationException} subtype.
 */
record ExceptionInfo(HttpStatus status, boolean shouldLogError) {

    static ExceptionInfo forException(ApplicationException exception) {
        if (exception instanceof ResourceNotFoundException) {
            return new ExceptionInfo(HttpStatus.NOT_FOUND, false);
        } else if (exception instanceof ValidationException) {
            return new ExceptionInfo(HttpStatus.BAD_REQUEST, false);
        } else if (exception instanceof RecommendationGenerationException) {
            return new ExceptionInfo(HttpStatus.INTERNAL_SERVER_ERROR, true);
        }
        return new ExceptionInfo(HttpStatus.INTERNAL_SERVER_ERROR, true);
    }
}
