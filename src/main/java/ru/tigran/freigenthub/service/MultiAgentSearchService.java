package ru.tigran.freigenthub.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import ru.tigran.freigenthub.dto.AutoSearchResponse;
import ru.tigran.freigenthub.dto.HelperResult;
import ru.tigran.freigenthub.dto.ProductRecommendation;
import ru.tigran.freigenthub.dto.RecommendationResult;
import ru.tigran.freigenthub.dto.SourcedProduct;
import ru.tigran.freigenthub.dto.UserProfileData;
import ru.tigran.freigenthub.exception.ProfileNotFoundException;
import ru.tigran.freigenthub.hub.AgentMessage;
import ru.tigran.freigenthub.hub.MessagingHub;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Orchestrated multi-agent search.
 *
 * One run: base recommendation, peer discovery, fan-out of recommendation requests through
 * the hub, synchronous worker dispatch per peer, fan-in from the base mailbox and a plain
 * merge in discovery order. Only a missing base profile aborts the run.
 *
 * Runs for the same base id must not overlap: fan-in drains the base mailbox.
 */
@Slf4j
@Service
public class MultiAgentSearchService {

    private final MessagingHub hub;
    private final ProfileService profileService;
    private final RecommendationGatewayService gatewayService;
    private final RecommendationWorker worker;
    private final ObjectMapper objectMapper;
    private final Timer autoSearchTimer;
    private final String agentType;
    private final int workerMaxMessages;

    public MultiAgentSearchService(
            MessagingHub hub,
            ProfileService profileService,
            RecommendationGatewayService gatewayService,
            RecommendationWorker worker,
            ObjectMapper objectMapper,
            MeterRegistry meterRegistry,
            @Value("${app.hub.agent-type:freigent}") String agentType,
            @Value("${app.hub.worker-max-messages:10}") int workerMaxMessages
    ) {
        this.hub = hub;
        this.profileService = profileService;
        this.gatewayService = gatewayService;
        this.worker = worker;
        this.objectMapper = objectMapper;
        this.agentType = agentType;
        this.workerMaxMessages = workerMaxMessages;
        this.autoSearchTimer = Timer.builder("freigent.auto_search")
                .description("Duration of orchestrated multi-agent searches")
                .register(meterRegistry);
    }

    /**
     * Runs a multi-agent search for the base user.
     *
     * @param baseUserId user whose agent starts the search
     * @param query      free-text product search query
     * @return base result, helper results and merged product list
     * @throws ProfileNotFoundException if no profile is stored for the base user
     */
    public AutoSearchResponse autoSearch(String baseUserId, String query) {
        Timer.Sample sample = Timer.start();
        try {
            return runSearch(baseUserId, query);
        } finally {
            sample.stop(autoSearchTimer);
        }
    }

    private AutoSearchResponse runSearch(String baseUserId, String query) {
        UserProfileData baseProfile = profileService.loadProfile(baseUserId)
                .orElseThrow(() -> new ProfileNotFoundException(baseUserId));

        log.info("Auto-search started for {}", baseUserId);
        RecommendationResult baseResult = gatewayService.generateRecommendations(baseProfile, query);

        List<String> peerIds = profileService.listPeerAgentIds(baseUserId, agentType);
        log.info("Auto-search {}: {} peer(s) discovered {}", baseUserId, peerIds.size(), peerIds);

        List<String> registeredPeerIds = registerPeers(peerIds);
        fanOut(baseUserId, registeredPeerIds, query);
        dispatch(registeredPeerIds);
        List<HelperResult> helperResults = fanIn(baseUserId);

        List<ProductRecommendation> mergedProducts = new ArrayList<>(baseResult.products());
        List<SourcedProduct> sourcedProducts = new ArrayList<>();
        baseResult.products().forEach(product -> sourcedProducts.add(SourcedProduct.base(baseUserId, product)));
        for (HelperResult helper : helperResults) {
            mergedProducts.addAll(helper.result().products());
            helper.result().products()
                    .forEach(product -> sourcedProducts.add(SourcedProduct.helper(helper.agentId(), product)));
        }

        log.info("Auto-search {} finished: {} helper result(s), {} product(s) merged",
                baseUserId, helperResults.size(), mergedProducts.size());
        return new AutoSearchResponse(
                baseUserId,
                List.copyOf(peerIds),
                baseResult,
                helperResults,
                mergedProducts,
                sourcedProducts,
                buildSummary(baseUserId, helperResults.size(), peerIds)
        );
    }

    /**
     * Helper count is the number of results received; the id list names every discovered peer.
     */
    static String buildSummary(String baseUserId, int helperCount, List<String> peerIds) {
        return "This response combines the base Freigent '" + baseUserId + "' recommendations with "
                + helperCount + " helper Freigent(s): "
                + (peerIds.isEmpty() ? "none" : String.join(", ", peerIds)) + ".";
    }

    /**
     * @return peers that were registered, in discovery order; only these are asked for recommendations
     */
    private List<String> registerPeers(List<String> peerIds) {
        List<String> registered = new ArrayList<>(peerIds.size());
        for (String peerId : peerIds) {
            try {
                Optional<UserProfileData> peerProfile = profileService.loadProfile(peerId);
                if (peerProfile.isEmpty()) {
                    log.warn("Peer {} has no profile anymore, skipped", peerId);
                    continue;
                }
                hub.registerAgent(peerId, agentType, peerProfile.get().name(), peerProfile.get().personality());
                registered.add(peerId);
            } catch (RuntimeException e) {
                log.warn("Failed to register peer {}, skipped: {}", peerId, e.getMessage());
            }
        }
        return registered;
    }

    private void fanOut(String baseUserId, List<String> peerIds, String query) {
        for (String peerId : peerIds) {
            hub.sendMessage(baseUserId, peerId, RecommendationProtocol.request(baseUserId, query));
        }
    }

    private void dispatch(List<String> peerIds) {
        for (String peerId : peerIds) {
            try {
                worker.process(peerId, workerMaxMessages);
            } catch (RuntimeException e) {
                log.warn("Worker run for peer {} failed: {}", peerId, e.getMessage());
            }
        }
    }

    private List<HelperResult> fanIn(String baseUserId) {
        List<HelperResult> helperResults = new ArrayList<>();
        for (AgentMessage message : hub.getInbox(baseUserId, true)) {
            if (!RecommendationProtocol.RESPONSE.equals(RecommendationProtocol.typeOf(message))) {
                log.debug("Fan-in for {} skips message {} of type {}",
                        baseUserId, message.messageId(), RecommendationProtocol.typeOf(message));
                continue;
            }
            toResult(message.payload().get(RecommendationProtocol.RESULT))
                    .ifPresentOrElse(
                            result -> helperResults.add(new HelperResult(message.fromAgentId(), result)),
                            () -> log.warn("Fan-in for {}: unreadable result in message {} from {}",
                                    baseUserId, message.messageId(), message.fromAgentId()));
        }
        return helperResults;
    }

    /**
     * Results sent in-process are already typed; results sent over HTTP arrive as plain maps.
     */
    private Optional<RecommendationResult> toResult(Object raw) {
        if (raw instanceof RecommendationResult result) {
            return Optional.of(result);
        }
        if (raw == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.convertValue(raw, RecommendationResult.class));
        } catch (IllegalArgumentException e) {
            log.debug("Cannot convert result payload: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
