package ru.tigran.freigenthub.exception;

/**
 * Application error codes returned in {@link ErrorResponse#errorCode()}.
 */
public enum ErrorCode {
    // Not found
    PROFILE_NOT_FOUND("PROFILE_NOT_FOUND", "No profile stored for user"),
    AGENT_NOT_FOUND("AGENT_NOT_FOUND", "Agent is not registered in the hub"),

    // Validation
    VALIDATION_ERROR("VALIDATION_ERROR", "Validation failed"),
    INVALID_MAX_MESSAGES("INVALID_MAX_MESSAGES", "maxMessages must be positive"),

    // Recommendation provider
    AI_SERVICE_ERROR("AI_SERVICE_ERROR", "AI service error"),
    AI_SERVICE_UNAVAILABLE("AI_SERVICE_UNAVAILABLE", "AI service temporarily unavailable"),
    INVALID_AI_RESPONSE("INVALID_AI_RESPONSE", "Invalid response from AI service"),

    INTERNAL_SERVER_ERROR("INTERNAL_SERVER_ERROR", "An unexpected error occurred");

    private final String code;
    private final String defaultMessage;

    ErrorCode(String code, String defaultMessage) {
        this.code = code;
        this.defaultMessage = defaultMessage;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
