package com.example.FinSolve.controller;

import com.example.FinSolve.index.DocumentIndex;
import com.example.FinSolve.memory.ConversationMemoryService;
import lombok.RequiredArgsConstructor;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness summary for monitoring: one status per internal service.
 */
@RestController
@RequiredArgsConstructor
public class HealthController {

    static final String OPERATIONAL = "operational";
    static final String UNAVAILABLE = "unavailable";

    private final ObjectProvider<DocumentIndex> documentIndex;
    private final ObjectProvider<ConversationMemoryService> memoryService;
    private final ObjectProvider<ChatClient> chatClients;
    private final Clock clock;

    @GetMapping("/health")
    public HealthStatus health() {
        Map<String, String> services = new LinkedHashMap<>();
        services.put("documentIndex", documentIndex.getIfAvailable() != null ? OPERATIONAL : UNAVAILABLE);
        services.put("conversationMemory", memoryService.getIfAvailable() != null ? OPERATIONAL : UNAVAILABLE);
        services.put("generation", chatClients.stream().findAny().isPresent() ? OPERATIONAL : UNAVAILABLE);

        boolean healthy = services.values().stream().allMatch(OPERATIONAL::equals);
        return new HealthStatus(healthy ? "healthy" : "degraded", clock.instant(), services);
    }

    public record HealthStatus(String status, Instant timestamp, Map<String, String> services) { }
}
