package ru.tigran.freigenthub.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import ru.tigran.freigenthub.dto.AgentRegisterRequest;
import ru.tigran.freigenthub.dto.AgentResponse;
import ru.tigran.freigenthub.dto.MessageResponse;
import ru.tigran.freigenthub.dto.MessageSendRequest;
import ru.tigran.freigenthub.dto.ProcessingOutcome;
import ru.tigran.freigenthub.exception.ErrorCode;
import ru.tigran.freigenthub.exception.ResourceNotFoundException;
import ru.tigran.freigenthub.hub.AgentRecord;
import ru.tigran.freigenthub.hub.MessagingHub;
import ru.tigran.freigenthub.service.RecommendationWorker;

import java.util.List;

/**
 * A2A hub endpoints: agent directory, mailboxes and manual worker runs.
 * Hub state is in-memory only, registrations here are not persisted.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/hub")
@Tag(name = "Hub", description = "Реестр агентов и обмен сообщениями между агентами")
public class HubController {

    private final MessagingHub hub;
    private final RecommendationWorker worker;

    public HubController(MessagingHub hub, RecommendationWorker worker) {
        this.hub = hub;
        this.worker = worker;
    }

    @PostMapping("/agents")
    @Operation(summary = "Зарегистрировать агента", description = "Регистрирует агента или перезаписывает существующую запись")
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Агент зарегистрирован",
                    content = @Content(schema = @Schema(implementation = AgentResponse.class))
            ),
            @ApiResponse(responseCode = "400", description = "Неверные параметры запроса")
    })
    public ResponseEntity<AgentResponse> registerAgent(@Valid @RequestBody AgentRegisterRequest request) {
        log.info("POST /api/v1/hub/agents - agentId: {}, type: {}", request.agentId(), request.agentType());
        AgentRecord record = hub.registerAgent(
                request.agentId(),
                request.agentType(),
                request.displayName(),
                request.personalitySummary()
        );
        return ResponseEntity.ok(AgentResponse.from(record));
    }

    @GetMapping("/agents")
    @Operation(summary = "Список агентов", description = "Все зарегистрированные агенты в порядке первой регистрации")
    public ResponseEntity<List<AgentResponse>> listAgents() {
        log.info("GET /api/v1/hub/agents");
        return ResponseEntity.ok(hub.listAgents().stream().map(AgentResponse::from).toList());
    }

    @GetMapping("/agents/{agentId}")
    @Operation(summary = "Получить агента по ID")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Агент найден"),
            @ApiResponse(responseCode = "404", description = "Агент не зарегистрирован")
    })
    public ResponseEntity<AgentResponse> getAgent(@PathVariable String agentId) {
        log.info("GET /api/v1/hub/agents/{}", agentId);
        return hub.getAgent(agentId)
                .map(AgentResponse::from)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new ResourceNotFoundException(
                        "Agent '" + agentId + "' is not registered",
                        ErrorCode.AGENT_NOT_FOUND.getCode()
                ));
    }

    /**
     * Sends a message. The recipient does not need to be registered.
     */
    @PostMapping("/messages")
    @Operation(summary = "Отправить сообщение", description = "Кладет сообщение в почтовый ящик получателя")
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Сообщение поставлено в очередь",
                    content = @Content(schema = @Schema(implementation = MessageResponse.class))
            ),
            @ApiResponse(responseCode = "400", description = "Неверные параметры запроса")
    })
    public ResponseEntity<MessageResponse> sendMessage(@Valid @RequestBody MessageSendRequest request) {
        log.info("POST /api/v1/hub/messages - {} -> {}", request.fromAgentId(), request.toAgentId());
        return ResponseEntity.ok(MessageResponse.from(
                hub.sendMessage(request.fromAgentId(), request.toAgentId(), request.payload())));
    }

    @GetMapping("/inbox/{agentId}")
    @Operation(
            summary = "Прочитать входящие",
            description = "Возвращает сообщения агента в порядке поступления. При clear=true ящик очищается атомарно."
    )
    public ResponseEntity<List<MessageResponse>> getInbox(
            @PathVariable String agentId,
            @Parameter(description = "Очистить ящик после чтения")
            @RequestParam(defaultValue = "true") boolean clear
    ) {
        log.info("GET /api/v1/hub/inbox/{} - clear: {}", agentId, clear);
        return ResponseEntity.ok(hub.getInbox(agentId, clear).stream().map(MessageResponse::from).toList());
    }

    /**
     * Runs the recommendation worker for one agent's mailbox.
     */
    @PostMapping("/agents/{agentId}/process")
    @Operation(
            summary = "Обработать запросы агента",
            description = "Опустошает ящик агента, обрабатывает до maxMessages запросов рекомендаций " +
                    "и отправляет ответы запрашивающим агентам. Остальные сообщения отбрасываются."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Результаты обработки по каждому сообщению"),
            @ApiResponse(responseCode = "400", description = "maxMessages меньше 1")
    })
    public ResponseEntity<List<ProcessingOutcome>> process(
            @PathVariable String agentId,
            @RequestParam(defaultValue = "10") int maxMessages
    ) {
        log.info("POST /api/v1/hub/agents/{}/process - maxMessages: {}", agentId, maxMessages);
        return ResponseEntity.ok(worker.process(agentId, maxMessages));
    }
}
