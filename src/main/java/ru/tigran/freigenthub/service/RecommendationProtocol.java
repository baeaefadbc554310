package ru.tigran.freigenthub.service;

import ru.tigran.freigenthub.dto.RecommendationResult;
import ru.tigran.freigenthub.hub.AgentMessage;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Payload conventions of the recommendation request/response exchange between agents.
 *
 * recommendation_request:  {type, from_user_id, query}
 * recommendation_response: {type, original_message_id, query, profile_user_id, result}
 * recommendation_error:    {type, reason, original_message_id}
 */
public final class RecommendationProtocol {

    public static final String TYPE = AgentMessage.TYPE_KEY;

    public static final String REQUEST = "recommendation_request";
    public static final String RESPONSE = "recommendation_response";
    public static final String ERROR = "recommendation_error";

    public static final String FROM_USER_ID = "from_user_id";
    public static final String QUERY = "query";
    public static final String ORIGINAL_MESSAGE_ID = "original_message_id";
    public static final String PROFILE_USER_ID = "profile_user_id";
    public static final String RESULT = "result";
    public static final String REASON = "reason";

    private RecommendationProtocol() {
    }

    public static Map<String, Object> request(String fromUserId, String query) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(TYPE, REQUEST);
        payload.put(FROM_USER_ID, fromUserId);
        payload.put(QUERY, query);
        return payload;
    }

    public static Map<String, Object> response(
            String originalMessageId,
            String query,
            String profileUserId,
            RecommendationResult result
    ) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(TYPE, RESPONSE);
        payload.put(ORIGINAL_MESSAGE_ID, originalMessageId);
        payload.put(QUERY, query);
        payload.put(PROFILE_USER_ID, profileUserId);
        payload.put(RESULT, result);
        return payload;
    }

    public static Map<String, Object> error(String reason, String originalMessageId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(TYPE, ERROR);
        payload.put(REASON, reason);
        payload.put(ORIGINAL_MESSAGE_ID, originalMessageId);
        return payload;
    }

    public static String typeOf(AgentMessage message) {
        return message.payloadString(TYPE);
    }
}
