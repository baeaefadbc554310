package ru.tigran.freigenthub.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.tigran.freigenthub.dto.ProcessingOutcome;
import ru.tigran.freigenthub.dto.RecommendationResult;
import ru.tigran.freigenthub.dto.UserProfileData;
import ru.tigran.freigenthub.exception.ErrorCode;
import ru.tigran.freigenthub.exception.ValidationException;
import ru.tigran.freigenthub.hub.AgentMessage;
import ru.tigran.freigenthub.hub.MessagingHub;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Processes recommendation requests queued in one agent's mailbox.
 *
 * Each pass drains the whole mailbox, examines at most maxMessages in arrival order and
 * answers every recommendation_request with exactly one response or error message sent
 * back to the requester.
 */
@Slf4j
@Service
public class RecommendationWorker {

    private final MessagingHub hub;
    private final ProfileService profileService;
    private final RecommendationGatewayService gatewayService;
    private final Map<ProcessingOutcome.Status, Counter> outcomeCounters = new EnumMap<>(ProcessingOutcome.Status.class);

    public RecommendationWorker(
            MessagingHub hub,
            ProfileService profileService,
            RecommendationGatewayService gatewayService,
            MeterRegistry meterRegistry
    ) {
        this.hub = hub;
        this.profileService = profileService;
        this.gatewayService = gatewayService;
        for (ProcessingOutcome.Status status : ProcessingOutcome.Status.values()) {
            outcomeCounters.put(status, Counter.builder("worker.requests.processed")
                    .description("Mailbox messages examined by recommendation workers")
                    .tag("status", status.name().toLowerCase())
                    .register(meterRegistry));
        }
    }

    /**
     * Runs one worker pass for the agent.
     *
     * @param agentId     agent whose mailbox is processed
     * @param maxMessages how many drained messages are examined, the rest is dropped
     * @return one outcome per examined message, in arrival order
     * @throws ValidationException if maxMessages is less than 1
     */
    public List<ProcessingOutcome> process(String agentId, int maxMessages) {
        if (maxMessages < 1) {
            throw new ValidationException(
                    "maxMessages must be at least 1, got " + maxMessages,
                    ErrorCode.INVALID_MAX_MESSAGES.getCode()
            );
        }

        List<AgentMessage> drained = hub.getInbox(agentId, true);
        if (drained.size() > maxMessages) {
            log.warn("Worker {} drained {} message(s), only {} examined, {} dropped",
                    agentId, drained.size(), maxMessages, drained.size() - maxMessages);
        }

        List<AgentMessage> examined = drained.subList(0, Math.min(maxMessages, drained.size()));
        List<ProcessingOutcome> outcomes = new ArrayList<>(examined.size());
        for (AgentMessage message : examined) {
            ProcessingOutcome outcome = handle(agentId, message);
            outcomeCounters.get(outcome.status()).increment();
            outcomes.add(outcome);
        }

        log.info("Worker {} processed {} message(s)", agentId, outcomes.size());
        return outcomes;
    }

    private ProcessingOutcome handle(String agentId, AgentMessage message) {
        String type = RecommendationProtocol.typeOf(message);
        if (!RecommendationProtocol.REQUEST.equals(type)) {
            log.debug("Worker {} ignores message {} of type {}", agentId, message.messageId(), type);
            return ProcessingOutcome.ignored(message.messageId(), "Unsupported payload.type '" + type + "'");
        }

        String requester = message.fromAgentId();
        String query = Optional.ofNullable(message.payloadString(RecommendationProtocol.QUERY)).orElse("");
        String profileUserId = message.payloadString(RecommendationProtocol.FROM_USER_ID);
        if (profileUserId == null || profileUserId.isBlank()) {
            profileUserId = requester;
        }

        Optional<UserProfileData> profile;
        try {
            profile = profileService.loadProfile(profileUserId);
        } catch (RuntimeException e) {
            log.error("Worker {} failed to load profile {}: {}", agentId, profileUserId, e.getMessage());
            return replyError(agentId, message, "Failed to load profile for user_id '" + profileUserId + "': " + e.getMessage());
        }
        if (profile.isEmpty()) {
            return replyError(agentId, message, "No profile found for user_id '" + profileUserId + "'");
        }

        RecommendationResult result = gatewayService.generateRecommendations(profile.get(), query);
        hub.sendMessage(agentId, requester,
                RecommendationProtocol.response(message.messageId(), query, profileUserId, result));
        return ProcessingOutcome.ok(message.messageId(), requester);
    }

    private ProcessingOutcome replyError(String agentId, AgentMessage message, String reason) {
        log.warn("Worker {} answers message {} with error: {}", agentId, message.messageId(), reason);
        hub.sendMessage(agentId, message.fromAgentId(), RecommendationProtocol.error(reason, message.messageId()));
        return ProcessingOutcome.error(message.messageId(), reason);
    }
}
