package ru.tigran.freigenthub.controller;

import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Контроллер для информации об API и эндпоинтах
 */
@RestController
@RequestMapping("/api")
@Tag(name = "API Info", description = "Информация об API и доступных эндпоинтах")
public class ApiInfoController {

    @GetMapping("/endpoints")
    public ResponseEntity<ApiEndpointsResponse> getEndpoints() {
        return ResponseEntity.ok(new ApiEndpointsResponse(
                "Freigent Hub API",
                "Freigent-агенты: профили, A2A хаб и мульти-агентный поиск товаров",
                "1.0.0",
                List.of(
                    new EndpointGroup(
                            "Freigent",
                            "Профили пользователей и поиск товаров",
                            List.of(
                                    new ApiEndpoint("POST", "/api/v1/freigent/{userId}/profile", "Сохранить профиль и зарегистрировать агента"),
                                    new ApiEndpoint("GET", "/api/v1/freigent/{userId}/profile", "Получить профиль"),
                                    new ApiEndpoint("POST", "/api/v1/freigent/{userId}/search", "Рекомендации для одного агента"),
                                    new ApiEndpoint("POST", "/api/v1/freigent/{userId}/auto-search", "Мульти-агентный поиск через хаб")
                            )
                    ),
                    new EndpointGroup(
                            "Хаб",
                            "Реестр агентов и почтовые ящики",
                            List.of(
                                    new ApiEndpoint("POST", "/api/v1/hub/agents", "Зарегистрировать агента"),
                                    new ApiEndpoint("GET", "/api/v1/hub/agents", "Список агентов"),
                                    new ApiEndpoint("GET", "/api/v1/hub/agents/{agentId}", "Получить агента по ID"),
                                    new ApiEndpoint("POST", "/api/v1/hub/messages", "Отправить сообщение агенту"),
                                    new ApiEndpoint("GET", "/api/v1/hub/inbox/{agentId}", "Прочитать (и очистить) входящие"),
                                    new ApiEndpoint("POST", "/api/v1/hub/agents/{agentId}/process", "Обработать запросы рекомендаций агента")
                            )
                    ),
                    new EndpointGroup(
                            "Документация и мониторинг",
                            "Документация API и health check",
                            List.of(
                                    new ApiEndpoint("GET", "/swagger-ui.html", "Интерактивная документация Swagger UI"),
                                    new ApiEndpoint("GET", "/v3/api-docs", "OpenAPI документация в JSON формате"),
                                    new ApiEndpoint("GET", "/api/endpoints", "Получить список всех эндпоинтов"),
                                    new ApiEndpoint("GET", "/actuator/health", "Состояние сервиса и хаба")
                            )
                    )
                )
        ));
    }

    @Getter
    @RequiredArgsConstructor
    public static class ApiEndpointsResponse {
        private final String title;
        private final String description;
        private final String version;
        private final List<EndpointGroup> groups;
    }

    @Getter
    @RequiredArgsConstructor
    public static class EndpointGroup {
        private final String name;
        private final String description;
        private final List<ApiEndpoint> endpoints;
    }

    @Getter
    @RequiredArgsConstructor
    public static class ApiEndpoint {
        private final String method;
        private final String path;
        private final String description;
    }
}
