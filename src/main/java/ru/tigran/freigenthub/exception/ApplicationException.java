package ru.tigran.freigenthub.exception;

/**
 * Base class for all application-specific exceptions.
 * Carries an error code from {@link ErrorCode} and a retriability flag.
 *
 * Retriable exceptions describe transient failures of external calls (429, 502, 503, 504).
 * Everything else is permanent for the current request.
 */
public abstract class ApplicationException extends RuntimeException {
    private final String errorCode;
    private final boolean retriable;

    protected ApplicationException(String message, String errorCode) {
        this(message, errorCode, false);
    }

    protected ApplicationException(String message, String errorCode, boolean retriable) {
        super(message);
        this.errorCode = errorCode;
        this.retriable = retriable;
    }

    protected ApplicationException(String message, String errorCode, boolean retriable, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.retriable = retriable;
    }

    public String getErrorCode() {
        return errorCode;
    }

    /**
     * @return true if the failed operation may succeed when repeated
     */
    public boolean isRetriable() {
        return retriable;
    }
}
