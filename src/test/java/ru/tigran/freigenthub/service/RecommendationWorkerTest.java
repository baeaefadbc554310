package ru.tigran.freigenthub.service;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import ru.tigran.freigenthub.dto.ProcessingOutcome;
import ru.tigran.freigenthub.dto.ProductRecommendation;
import ru.tigran.freigenthub.dto.RecommendationResult;
import ru.tigran.freigenthub.dto.UserProfileData;
import ru.tigran.freigenthub.exception.ValidationException;
import ru.tigran.freigenthub.hub.AgentDirectory;
import ru.tigran.freigenthub.hub.AgentMessage;
import ru.tigran.freigenthub.hub.MailboxStore;
import ru.tigran.freigenthub.hub.MessagingHub;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit-тесты для RecommendationWorker.
 * Хаб настоящий, профили и LLM замоканы.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("RecommendationWorker unit тесты")
class RecommendationWorkerTest {

    @Mock
    private ProfileService profileService;

    @Mock
    private RecommendationGatewayService gatewayService;

    private SimpleMeterRegistry meterRegistry;
    private MessagingHub hub;
    private RecommendationWorker worker;

    private static final UserProfileData U1_PROFILE =
            new UserProfileData("u1", "Alice", "curious", "quality", List.of());

    private static final RecommendationResult RESULT = new RecommendationResult(
            List.of(new ProductRecommendation("Kettle", "Steel kettle", "Durable", "$40-$60")),
            "A kettle for you"
    );

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        hub = new MessagingHub(new AgentDirectory(), new MailboxStore(), meterRegistry);
        worker = new RecommendationWorker(hub, profileService, gatewayService, meterRegistry);
    }

    @Test
    @DisplayName("process - запрос обрабатывается по профилю from_user_id, ответ уходит запрашивающему")
    void processRequestSendsResponse() {
        AgentMessage request = hub.sendMessage("u1", "u2", RecommendationProtocol.request("u1", "kettle"));
        when(profileService.loadProfile("u1")).thenReturn(Optional.of(U1_PROFILE));
        when(gatewayService.generateRecommendations(U1_PROFILE, "kettle")).thenReturn(RESULT);

        List<ProcessingOutcome> outcomes = worker.process("u2", 10);

        assertEquals(1, outcomes.size());
        assertEquals(ProcessingOutcome.Status.OK, outcomes.get(0).status());
        assertEquals("u1", outcomes.get(0).sentTo());
        assertEquals(request.messageId(), outcomes.get(0).requestMessageId());

        List<AgentMessage> replies = hub.getInbox("u1", true);
        assertEquals(1, replies.size());
        AgentMessage reply = replies.get(0);
        assertEquals("u2", reply.fromAgentId());
        assertEquals(RecommendationProtocol.RESPONSE, reply.payloadString(RecommendationProtocol.TYPE));
        assertEquals(request.messageId(), reply.payloadString(RecommendationProtocol.ORIGINAL_MESSAGE_ID));
        assertEquals("u1", reply.payloadString(RecommendationProtocol.PROFILE_USER_ID));
        assertEquals("kettle", reply.payloadString(RecommendationProtocol.QUERY));
        assertSame(RESULT, reply.payload().get(RecommendationProtocol.RESULT));
        assertTrue(hub.getInbox("u2", false).isEmpty());
    }

    @Test
    @DisplayName("process - без from_user_id используется from_agent_id сообщения")
    void profileIdFallsBackToSender() {
        hub.sendMessage("u1", "u2", Map.of("type", RecommendationProtocol.REQUEST, "query", "mug"));
        when(profileService.loadProfile("u1")).thenReturn(Optional.of(U1_PROFILE));
        when(gatewayService.generateRecommendations(U1_PROFILE, "mug")).thenReturn(RESULT);

        List<ProcessingOutcome> outcomes = worker.process("u2", 10);

        assertEquals(ProcessingOutcome.Status.OK, outcomes.get(0).status());
        verify(profileService).loadProfile("u1");
    }

    @Test
    @DisplayName("process - сообщение другого типа игнорируется, ответ не отправляется")
    void unsupportedTypeIsIgnored() {
        hub.sendMessage("u1", "u2", Map.of("type", "chit_chat"));

        List<ProcessingOutcome> outcomes = worker.process("u2", 10);

        assertEquals(ProcessingOutcome.Status.IGNORED, outcomes.get(0).status());
        assertEquals("Unsupported payload.type 'chit_chat'", outcomes.get(0).reason());
        assertTrue(hub.getInbox("u1", false).isEmpty());
        verifyNoInteractions(profileService, gatewayService);
    }

    @Test
    @DisplayName("process - профиль не найден: recommendation_error отправляется обратно")
    void missingProfileSendsError() {
        AgentMessage request = hub.sendMessage("u1", "u2", RecommendationProtocol.request("u9", "lamp"));
        when(profileService.loadProfile("u9")).thenReturn(Optional.empty());

        List<ProcessingOutcome> outcomes = worker.process("u2", 10);

        assertEquals(ProcessingOutcome.Status.ERROR, outcomes.get(0).status());
        assertEquals("No profile found for user_id 'u9'", outcomes.get(0).reason());

        AgentMessage error = hub.getInbox("u1", true).get(0);
        assertEquals(RecommendationProtocol.ERROR, error.payloadString(RecommendationProtocol.TYPE));
        assertEquals(request.messageId(), error.payloadString(RecommendationProtocol.ORIGINAL_MESSAGE_ID));
        verifyNoInteractions(gatewayService);
    }

    @Test
    @DisplayName("process - сбой загрузки профиля обрабатывается как ошибка, а не исключение")
    void profileLookupFailureSendsError() {
        hub.sendMessage("u1", "u2", RecommendationProtocol.request("u1", "lamp"));
        when(profileService.loadProfile("u1")).thenThrow(new IllegalStateException("db down"));

        List<ProcessingOutcome> outcomes = worker.process("u2", 10);

        assertEquals(ProcessingOutcome.Status.ERROR, outcomes.get(0).status());
        assertTrue(outcomes.get(0).reason().contains("db down"));
        assertEquals(1, hub.getInbox("u1", true).size());
    }

    @Test
    @DisplayName("process - сообщения сверх maxMessages отбрасываются, ящик пуст")
    void excessMessagesAreDropped() {
        for (int i = 0; i < 5; i++) {
            hub.sendMessage("u1", "u2", Map.of("type", "noise-" + i));
        }

        List<ProcessingOutcome> outcomes = worker.process("u2", 3);

        assertEquals(3, outcomes.size());
        assertEquals("Unsupported payload.type 'noise-0'", outcomes.get(0).reason());
        assertEquals("Unsupported payload.type 'noise-2'", outcomes.get(2).reason());
        assertTrue(hub.getInbox("u2", false).isEmpty());
    }

    @Test
    @DisplayName("process - maxMessages < 1 отклоняется до чтения ящика")
    void invalidMaxMessages() {
        hub.sendMessage("u1", "u2", Map.of("type", "x"));

        assertThrows(ValidationException.class, () -> worker.process("u2", 0));
        assertEquals(1, hub.getInbox("u2", false).size());
    }

    @Test
    @DisplayName("process - пустой ящик дает пустой список")
    void emptyMailbox() {
        assertTrue(worker.process("nobody", 10).isEmpty());
        verify(gatewayService, never()).generateRecommendations(any(), anyString());
    }

    @Test
    @DisplayName("метрики - счетчик worker.requests.processed по статусам")
    void outcomeCounters() {
        hub.sendMessage("u1", "u2", RecommendationProtocol.request("u1", "kettle"));
        hub.sendMessage("u1", "u2", Map.of("type", "other"));
        when(profileService.loadProfile("u1")).thenReturn(Optional.of(U1_PROFILE));
        when(gatewayService.generateRecommendations(eq(U1_PROFILE), anyString())).thenReturn(RESULT);

        worker.process("u2", 10);

        assertEquals(1.0, meterRegistry.get("worker.requests.processed").tag("status", "ok").counter().count());
        assertEquals(1.0, meterRegistry.get("worker.requests.processed").tag("status", "ignored").counter().count());
        assertEquals(0.0, meterRegistry.get("worker.requests.processed").tag("status", "error").counter().count());
    }
}
