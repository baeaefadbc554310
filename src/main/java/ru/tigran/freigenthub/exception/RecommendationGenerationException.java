package ru.tigran.freigenthub.exception;

/**
 * Failure of a recommendation provider call (HTTP error, unreadable response, open circuit).
 * The gateway converts it to a fallback result, so it normally never reaches a controller.
 * HTTP status if it does: 500 Internal Server Error
 */
public class RecommendationGenerationException extends ApplicationException {
    public RecommendationGenerationException(String message, String errorCode) {
        super(message, errorCode);
    }

    public RecommendationGenerationException(String message, String errorCode, boolean retriable) {
        super(message, errorCode, retriable);
    }

    public RecommendationGenerationException(String message, String errorCode, boolean retriable, Throwable cause) {
        super(message, errorCode, retriable, cause);
    }
}
