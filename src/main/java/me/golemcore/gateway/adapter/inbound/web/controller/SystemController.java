package me.golemcore.gateway.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.adapter.inbound.web.dto.SystemHealthResponse;
import me.golemcore.gateway.domain.model.GatewayConfig;
import me.golemcore.gateway.domain.model.Session;
import me.golemcore.gateway.domain.model.SessionStatus;
import me.golemcore.gateway.domain.service.ConfigSnapshotHolder;
import me.golemcore.gateway.port.outbound.LlmPort;
import me.golemcore.gateway.port.outbound.MemoryPort;
import me.golemcore.gateway.port.outbound.SessionPort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.lang.management.ManagementFactory;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Health, model listing, statistics and configuration reload.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class SystemController {

    private final LlmPort llmPort;
    private final SessionPort sessionPort;
    private final MemoryPort memoryPort;
    private final ConfigSnapshotHolder configHolder;
    private final ObjectProvider<BuildProperties> buildPropertiesProvider;

    @GetMapping("/health")
    public Mono<ResponseEntity<SystemHealthResponse>> health() {
        GatewayConfig config = configHolder.current();
        BuildProperties buildProps = buildPropertiesProvider.getIfAvailable();
        SystemHealthResponse response = SystemHealthResponse.builder()
                .status("UP")
                .version(buildProps != null ? buildProps.getVersion() : "dev")
                .buildTime(buildProps != null && buildProps.getTime() != null ? buildProps.getTime().toString() : null)
                .uptimeMs(ManagementFactory.getRuntimeMXBean().getUptime())
                .defaultProvider(config.providerId())
                .defaultModel(config.model())
                .providers(llmPort.getProviderIds())
                .build();
        return Mono.just(ResponseEntity.ok(response));
    }

    /**
     * OpenAI-style model list: the configured default model plus one entry per
     * registered provider.
     */
    @GetMapping("/v1/models")
    public Mono<ResponseEntity<Map<String, Object>>> models() {
        GatewayConfig config = configHolder.current();
        List<Map<String, Object>> data = new ArrayList<>();
        data.add(modelEntry(config.model(), config.providerId()));
        for (String providerId : llmPort.getProviderIds()) {
            if (!providerId.equals(config.providerId())) {
                data.add(modelEntry(providerId + "/default", providerId));
            }
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("object", "list");
        body.put("data", data);
        return Mono.just(ResponseEntity.ok(body));
    }

    @GetMapping("/stats")
    public Mono<ResponseEntity<Map<String, Object>>> stats() {
        return Mono.fromCallable(() -> {
            List<Session> sessions = sessionPort.listAll();
            Map<String, Object> sessionStats = new LinkedHashMap<>();
            sessionStats.put("total", sessions.size());
            sessionStats.put("active", sessions.stream().filter(s -> s.getStatus() != SessionStatus.ENDED).count());
            sessionStats.put("compactions", sessions.stream().mapToInt(Session::getCompactionCount).sum());
            sessionStats.put("inputTokens", sessions.stream().mapToLong(s -> s.getUsage().getInputTokens()).sum());
            sessionStats.put("outputTokens", sessions.stream().mapToLong(s -> s.getUsage().getOutputTokens()).sum());

            Map<String, Object> stats = new LinkedHashMap<>();
            stats.put("provider", configHolder.current().providerId());
            stats.put("sessions", sessionStats);
            stats.put("memory", memoryPort.stats());
            return ResponseEntity.ok(stats);
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/api/config/reload")
    public Mono<ResponseEntity<Map<String, Object>>> reloadConfig() {
        return Mono.fromCallable(() -> {
            GatewayConfig config = configHolder.reload();
            log.info("[API] Configuration reloaded");
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("provider", config.providerId());
            body.put("model", config.model());
            body.put("hooks", config.hooks().definitions().size());
            return ResponseEntity.ok(body);
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private static Map<String, Object> modelEntry(String id, String provider) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("id", id);
        entry.put("object", "model");
        entry.put("owned_by", provider);
        return entry;
    }
}
