package ru.tigran.freigenthub.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import ru.tigran.freigenthub.dto.AutoSearchResponse;
import ru.tigran.freigenthub.dto.ProfileSaveResponse;
import ru.tigran.freigenthub.dto.RecommendationResult;
import ru.tigran.freigenthub.dto.SearchRequest;
import ru.tigran.freigenthub.dto.UserProfileData;
import ru.tigran.freigenthub.dto.UserProfileRequest;
import ru.tigran.freigenthub.service.FreigentService;
import ru.tigran.freigenthub.service.MultiAgentSearchService;
import ru.tigran.freigenthub.validation.AgentId;

@Slf4j
@RestController
@RequestMapping("/api/v1/freigent")
@Tag(name = "Freigent", description = "Профили пользователей и поиск товаров")
public class FreigentController {

    private final FreigentService freigentService;
    private final MultiAgentSearchService multiAgentSearchService;

    public FreigentController(FreigentService freigentService, MultiAgentSearchService multiAgentSearchService) {
        this.freigentService = freigentService;
        this.multiAgentSearchService = multiAgentSearchService;
    }

    /**
     * Saves (creates or replaces) the user's profile and registers the user's agent.
     */
    @PostMapping("/{userId}/profile")
    @Operation(
            summary = "Сохранить профиль",
            description = "Создает или обновляет профиль пользователя (опыт с товарами заменяется целиком) " +
                    "и регистрирует Freigent-агента пользователя в хабе."
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Профиль сохранен, агент зарегистрирован",
                    content = @Content(schema = @Schema(implementation = ProfileSaveResponse.class))
            ),
            @ApiResponse(responseCode = "400", description = "Неверные параметры запроса")
    })
    public ResponseEntity<ProfileSaveResponse> saveProfile(
            @PathVariable @AgentId String userId,
            @Valid @RequestBody UserProfileRequest request
    ) {
        log.info("POST /api/v1/freigent/{}/profile - experiences: {}", userId, request.experiences().size());
        return ResponseEntity.ok(freigentService.saveProfile(userId, request));
    }

    @GetMapping("/{userId}/profile")
    @Operation(summary = "Получить профиль", description = "Возвращает сохраненный профиль пользователя с опытом")
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Профиль найден",
                    content = @Content(schema = @Schema(implementation = UserProfileData.class))
            ),
            @ApiResponse(responseCode = "404", description = "Профиль не найден")
    })
    public ResponseEntity<UserProfileData> getProfile(@PathVariable @AgentId String userId) {
        log.info("GET /api/v1/freigent/{}/profile", userId);
        return ResponseEntity.ok(freigentService.getProfile(userId));
    }

    /**
     * Single-agent search: recommendations for the user's own profile only.
     */
    @PostMapping("/{userId}/search")
    @Operation(
            summary = "Поиск товаров",
            description = "Генерирует 3-5 рекомендаций для профиля пользователя. " +
                    "При ошибке LLM возвращает пустой список товаров и описание ошибки в summary_for_user."
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Рекомендации",
                    content = @Content(schema = @Schema(implementation = RecommendationResult.class))
            ),
            @ApiResponse(responseCode = "400", description = "Пустой запрос"),
            @ApiResponse(responseCode = "404", description = "Профиль не найден")
    })
    public ResponseEntity<RecommendationResult> search(
            @PathVariable @AgentId String userId,
            @Valid @RequestBody SearchRequest request
    ) {
        log.info("POST /api/v1/freigent/{}/search", userId);
        return ResponseEntity.ok(freigentService.search(userId, request.query()));
    }

    /**
     * Multi-agent search: the user's agent asks every peer Freigent through the hub
     * and merges their recommendations with its own.
     */
    @PostMapping("/{userId}/auto-search")
    @Operation(
            summary = "Мульти-агентный поиск",
            description = "Базовый агент получает свои рекомендации, рассылает запросы всем остальным " +
                    "Freigent-агентам с профилями, синхронно обрабатывает их и объединяет ответы."
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Объединенные рекомендации",
                    content = @Content(schema = @Schema(implementation = AutoSearchResponse.class))
            ),
            @ApiResponse(responseCode = "400", description = "Пустой запрос"),
            @ApiResponse(responseCode = "404", description = "Профиль базового пользователя не найден")
    })
    public ResponseEntity<AutoSearchResponse> autoSearch(
            @PathVariable @AgentId String userId,
            @Valid @RequestBody SearchRequest request
    ) {
        log.info("POST /api/v1/freigent/{}/auto-search", userId);
        AutoSearchResponse response = multiAgentSearchService.autoSearch(userId, request.query());
        log.info("Auto-search for {} returned {} merged product(s) from {} helper(s)",
                userId, response.mergedProducts().size(), response.helperResults().size());
        return ResponseEntity.ok(response);
    }
}
