package ru.tigran.freigenthub.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import ru.tigran.freigenthub.dto.RecommendationResult;
import ru.tigran.freigenthub.dto.UserProfileData;
import ru.tigran.freigenthub.exception.ErrorCode;
import ru.tigran.freigenthub.exception.RecommendationGenerationException;
import ru.tigran.freigenthub.exception.RetriableHttpException;

/**
 * Generates product recommendations for a profile via an LLM provider.
 *
 * Supported providers (app.ai.provider):
 * - anthropic: Messages API, default
 * - openrouter: OpenAI-compatible chat completions
 *
 * Never throws: any provider, transport or parsing failure is turned into
 * {@link RecommendationResult#fallback(String)}.
 */
@Slf4j
@Service
public class RecommendationGatewayService {

    static final String ANTHROPIC_VERSION = "2023-06-01";

    // Maximum backoff delay per retry
    private static final long MAX_BACKOFF_MS = 8000;
    // Maximum response size (1 MB)
    private static final long MAX_RESPONSE_SIZE_BYTES = 1024 * 1024;

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final CircuitBreaker circuitBreaker;
    private final String provider;
    private final String anthropicApiKey;
    private final String anthropicModel;
    private final String anthropicBaseUrl;
    private final int maxTokens;
    private final String openRouterApiKey;
    private final String openRouterModel;
    private final String openRouterBaseUrl;
    private final long retryDelayMs;
    private final int maxRetries;
    private final int retryBackoffMultiplier;

    public RecommendationGatewayService(
            RestClient restClient,
            ObjectMapper objectMapper,
            CircuitBreaker recommendationProviderCircuitBreaker,
            @Value("${app.ai.provider:anthropic}") String provider,
            @Value("${app.anthropic.api-key:}") String anthropicApiKey,
            @Value("${app.anthropic.model:claude-3-haiku-20240307}") String anthropicModel,
            @Value("${app.anthropic.base-url:https://api.anthropic.com}") String anthropicBaseUrl,
            @Value("${app.ai.max-tokens:2048}") int maxTokens,
            @Value("${app.openrouter.api-key:}") String openRouterApiKey,
            @Value("${app.openrouter.model:anthropic/claude-3-haiku}") String openRouterModel,
            @Value("${app.openrouter.base-url:https://openrouter.ai/api/v1}") String openRouterBaseUrl,
            @Value("${app.ai.retry-delay-ms:1000}") long retryDelayMs,
            @Value("${app.ai.max-retries:1}") int maxRetries,
            @Value("${app.ai.retry-backoff-multiplier:2}") int retryBackoffMultiplier
    ) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
        this.circuitBreaker = recommendationProviderCircuitBreaker;
        this.provider = provider;
        this.anthropicApiKey = anthropicApiKey;
        this.anthropicModel = anthropicModel;
        this.anthropicBaseUrl = anthropicBaseUrl;
        this.maxTokens = maxTokens;
        this.openRouterApiKey = openRouterApiKey;
        this.openRouterModel = openRouterModel;
        this.openRouterBaseUrl = openRouterBaseUrl;
        this.retryDelayMs = retryDelayMs;
        this.maxRetries = Math.max(1, maxRetries);
        this.retryBackoffMultiplier = retryBackoffMultiplier;
    }

    /**
     * Generates 3-5 product recommendations for the given profile and query.
     *
     * Expected model output:
     * {
     *   "products": [{"name", "short_description", "why_match", "estimated_price_range"}],
     *   "summary_for_user": "..."
     * }
     *
     * @param profile profile the recommendations are personalised for
     * @param query   free-text product search query
     * @return parsed result, or the fallback result when anything fails
     */
    public RecommendationResult generateRecommendations(UserProfileData profile, String query) {
        String systemPrompt = RecommendationPromptBuilder.buildSystemPrompt();
        String userPrompt = RecommendationPromptBuilder.buildUserPrompt(profile, query);

        log.info("Generating recommendations for {} via {} (query length={})",
                profile.userId(), provider, query != null ? query.length() : 0);
        try {
            String content = circuitBreaker.executeSupplier(() -> callProvider(systemPrompt, userPrompt));
            RecommendationResult result = parseResult(content);
            log.info("Recommendations for {} generated: {} product(s)", profile.userId(), result.products().size());
            return result;
        } catch (CallNotPermittedException e) {
            log.warn("Circuit breaker is open, returning fallback for {}", profile.userId());
            return RecommendationResult.fallback(e.getMessage());
        } catch (Exception e) {
            log.error("Recommendation generation failed for {}: {}", profile.userId(), e.getMessage());
            return RecommendationResult.fallback(e.getMessage());
        }
    }

    public String getProvider() {
        return provider;
    }

    public String getConfiguredModel() {
        return isOpenRouter() ? openRouterModel : anthropicModel;
    }

    /**
     * Calls the configured provider, retrying transient HTTP statuses up to app.ai.max-retries attempts.
     *
     * @return text content of the model answer, markdown fences removed
     */
    private String callProvider(String systemPrompt, String userMessage) {
        int attempt = 0;
        while (true) {
            try {
                log.debug("Provider call attempt {}/{}, provider={}", attempt + 1, maxRetries, provider);
                return isOpenRouter()
                        ? callOpenRouter(systemPrompt, userMessage)
                        : callAnthropic(systemPrompt, userMessage);
            } catch (RetriableHttpException e) {
                attempt++;
                if (attempt >= maxRetries) {
                    throw new RecommendationGenerationException(
                            e.getMessage(),
                            ErrorCode.AI_SERVICE_UNAVAILABLE.getCode(),
                            true,
                            e
                    );
                }
                long backoffMs = calculateBackoffDelay(attempt);
                log.info("Retrying after {} ms (attempt {}/{}, status {})", backoffMs, attempt, maxRetries, e.getStatusCode());
                try {
                    Thread.sleep(backoffMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new RecommendationGenerationException(
                            "Interrupted during retry",
                            ErrorCode.AI_SERVICE_ERROR.getCode(),
                            false,
                            ie
                    );
                }
            }
        }
    }

    private String callAnthropic(String systemPrompt, String userMessage) {
        requireApiKey(anthropicApiKey);
        log.debug("Using Anthropic provider, model={}, key={}", anthropicModel, maskApiKey(anthropicApiKey));

        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", anthropicModel);
        body.put("max_tokens", maxTokens);
        body.put("system", systemPrompt);
        ObjectNode userMsg = body.putArray("messages").addObject();
        userMsg.put("role", "user");
        userMsg.put("content", userMessage);

        String response = restClient.post()
                .uri(anthropicBaseUrl + "/v1/messages")
                .header("x-api-key", anthropicApiKey)
                .header("anthropic-version", ANTHROPIC_VERSION)
                .contentType(MediaType.APPLICATION_JSON)
                .body(writeJson(body))
                .retrieve()
                .onStatus(HttpStatusCode::isError, (request, errorResponse) ->
                        handleErrorStatus(errorResponse.getStatusCode().value(), errorResponse.getStatusText()))
                .body(String.class);

        return extractContent(response, "/content/0/text");
    }

    private String callOpenRouter(String systemPrompt, String userMessage) {
        requireApiKey(openRouterApiKey);
        log.debug("Using OpenRouter provider, model={}, key={}", openRouterModel, maskApiKey(openRouterApiKey));

        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", openRouterModel);
        body.put("max_tokens", maxTokens);
        var messages = body.putArray("messages");
        ObjectNode systemMsg = messages.addObject();
        systemMsg.put("role", "system");
        systemMsg.put("content", systemPrompt);
        ObjectNode userMsg = messages.addObject();
        userMsg.put("role", "user");
        userMsg.put("content", userMessage);

        String response = restClient.post()
                .uri(openRouterBaseUrl + "/chat/completions")
                .header("Authorization", "Bearer " + openRouterApiKey)
                .contentType(MediaType.APPLICATION_JSON)
                .body(writeJson(body))
                .retrieve()
                .onStatus(HttpStatusCode::isError, (request, errorResponse) ->
                        handleErrorStatus(errorResponse.getStatusCode().value(), errorResponse.getStatusText()))
                .body(String.class);

        return extractContent(response, "/choices/0/message/content");
    }

    private void handleErrorStatus(int statusCode, String statusText) {
        // 429, 502, 503, 504 are transient
        if (statusCode == 429 || statusCode == 502 || statusCode == 503 || statusCode == 504) {
            log.warn("Retriable HTTP error {} from {}", statusCode, provider);
            throw new RetriableHttpException(
                    statusCode,
                    String.format("Retriable error from %s: %d %s", provider, statusCode, statusText)
            );
        }
        log.error("{} API error: {} {}", provider, statusCode, statusText);
        throw new RecommendationGenerationException(
                provider + " API error: " + statusCode,
                ErrorCode.AI_SERVICE_ERROR.getCode(),
                false
        );
    }

    /**
     * Parses model output into a result. Missing products become an empty list,
     * missing summary becomes {@link RecommendationResult#MISSING_SUMMARY}.
     */
    RecommendationResult parseResult(String content) {
        try {
            JsonNode root = objectMapper.readTree(content);
            if (root == null || !root.isObject()) {
                throw new RecommendationGenerationException(
                        "Expected a JSON object in model output",
                        ErrorCode.INVALID_AI_RESPONSE.getCode()
                );
            }
            return objectMapper.treeToValue(root, RecommendationResult.class);
        } catch (RecommendationGenerationException e) {
            throw e;
        } catch (Exception e) {
            throw new RecommendationGenerationException(
                    e.getMessage(),
                    ErrorCode.INVALID_AI_RESPONSE.getCode(),
                    false,
                    e
            );
        }
    }

    private String extractContent(String response, String pointer) {
        validateResponseSize(response);
        JsonNode content;
        try {
            content = objectMapper.readTree(response).at(pointer);
        } catch (Exception e) {
            throw new RecommendationGenerationException(
                    "Failed to parse API response: " + e.getMessage(),
                    ErrorCode.INVALID_AI_RESPONSE.getCode(),
                    false,
                    e
            );
        }
        if (content == null || content.isNull() || content.isMissingNode()) {
            log.error("Missing content in API response. Response preview: {}",
                    response.length() > 200 ? response.substring(0, 200) : response);
            throw new RecommendationGenerationException(
                    "Missing content in API response",
                    ErrorCode.INVALID_AI_RESPONSE.getCode()
            );
        }
        return cleanMarkdownCodeBlocks(content.asText().trim());
    }

    /**
     * Removes ```json ... ``` fences that models sometimes add despite the instructions.
     */
    private String cleanMarkdownCodeBlocks(String content) {
        if (content == null || content.isEmpty()) {
            return content;
        }
        String cleaned = content.trim();
        if (cleaned.startsWith("```")) {
            int firstNewline = cleaned.indexOf('\n');
            if (firstNewline != -1) {
                cleaned = cleaned.substring(firstNewline + 1);
            } else {
                cleaned = cleaned.substring(3);
                if (cleaned.startsWith("json")) {
                    cleaned = cleaned.substring(4);
                }
            }
            if (cleaned.endsWith("```")) {
                cleaned = cleaned.substring(0, cleaned.length() - 3);
            }
            cleaned = cleaned.trim();
        }
        return cleaned;
    }

    private void validateResponseSize(String responseBody) {
        if (responseBody == null) {
            throw new RecommendationGenerationException(
                    "Empty API response",
                    ErrorCode.INVALID_AI_RESPONSE.getCode()
            );
        }
        if (responseBody.length() > MAX_RESPONSE_SIZE_BYTES) {
            throw new RecommendationGenerationException(
                    String.format("API response exceeds maximum allowed size: %d bytes, max %d bytes",
                            responseBody.length(), MAX_RESPONSE_SIZE_BYTES),
                    ErrorCode.INVALID_AI_RESPONSE.getCode()
            );
        }
    }

    private String writeJson(ObjectNode body) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (Exception e) {
            throw new RecommendationGenerationException(
                    "Failed to build request body",
                    ErrorCode.AI_SERVICE_ERROR.getCode(),
                    false,
                    e
            );
        }
    }

    private void requireApiKey(String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new RecommendationGenerationException(
                    "API key for provider " + provider + " is not configured",
                    ErrorCode.AI_SERVICE_ERROR.getCode()
            );
        }
    }

    private long calculateBackoffDelay(int attemptNumber) {
        long backoffMs = retryDelayMs * (long) Math.pow(retryBackoffMultiplier, attemptNumber - 1);
        return Math.min(backoffMs, MAX_BACKOFF_MS);
    }

    private boolean isOpenRouter() {
        return "openrouter".equalsIgnoreCase(provider);
    }

    /**
     * Masks API key for logging, e.g. "sk-***xyz".
     */
    private String maskApiKey(String apiKey) {
        if (apiKey == null || apiKey.length() <= 6) {
            return "***MASKED***";
        }
        return apiKey.substring(0, 3) + "***" + apiKey.substring(apiKey.length() - 3);
    }
}
