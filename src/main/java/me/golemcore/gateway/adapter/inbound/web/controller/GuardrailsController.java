package me.golemcore.gateway.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.adapter.inbound.web.dto.DiffStatsDto;
import me.golemcore.gateway.adapter.inbound.web.dto.QualityGateReportDto;
import me.golemcore.gateway.domain.model.GatewayConfig;
import me.golemcore.gateway.domain.model.GatewayException;
import me.golemcore.gateway.domain.model.guardrail.DiffStats;
import me.golemcore.gateway.domain.model.guardrail.DiffWarning;
import me.golemcore.gateway.domain.model.guardrail.QualityCheckResult;
import me.golemcore.gateway.domain.service.ConfigSnapshotHolder;
import me.golemcore.gateway.domain.service.GuardrailService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Optional;

/**
 * Session diff statistics and on-demand quality gates.
 */
@RestController
@RequestMapping("/api/guardrails")
@RequiredArgsConstructor
@Slf4j
public class GuardrailsController {

    private final GuardrailService guardrailService;
    private final ConfigSnapshotHolder configHolder;

    @GetMapping("/sessions/{id}/diff")
    public Mono<ResponseEntity<DiffStatsDto>> diff(@PathVariable String id) {
        GatewayConfig config = configHolder.current();
        DiffStats stats = guardrailService.diffStats(id);
        Optional<DiffWarning> warning = guardrailService.checkDiff(id, config.guardrails().diffMonitor());
        return Mono.just(ResponseEntity.ok(DiffStatsDto.builder()
                .sessionId(id)
                .linesAdded(stats.linesAdded())
                .linesRemoved(stats.linesRemoved())
                .linesChanged(stats.linesChanged())
                .filesChanged(stats.filesChanged())
                .files(stats.files())
                .warning(warning.map(DiffWarning::message).orElse(null))
                .action(warning.map(w -> w.action().name()).orElse(null))
                .build()));
    }

    @PostMapping("/quality-gates")
    public Mono<ResponseEntity<QualityGateReportDto>> runQualityGates() {
        return Mono.fromCallable(() -> {
            GatewayConfig config = configHolder.current();
            List<QualityCheckResult> results;
            try {
                results = guardrailService.runQualityGates(config);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new GatewayException("Quality gate run interrupted", e);
            }
            log.info("[API] Ran {} quality gate(s)", results.size());
            return ResponseEntity.ok(QualityGateReportDto.builder()
                    .enabled(config.guardrails().qualityGates().enabled())
                    .passed(results.stream().noneMatch(QualityCheckResult::blocking))
                    .checks(results.stream().map(GuardrailsController::toDto).toList())
                    .build());
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private static QualityGateReportDto.CheckDto toDto(QualityCheckResult result) {
        return QualityGateReportDto.CheckDto.builder()
                .name(result.name())
                .command(result.command())
                .passed(result.passed())
                .required(result.required())
                .exitCode(result.exitCode())
                .stdout(result.stdout())
                .stderr(result.stderr())
                .build();
    }
}
