package ru.tigran.freigenthub.exception;

/**
 * Transient HTTP status from the recommendation provider: 429, 502, 503 or 504.
 */
public class RetriableHttpException extends RuntimeException {
    private final int statusCode;

    public RetriableHttpException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
