package me.golemcore.gateway.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.gateway.adapter.inbound.web.dto.CompactionResultDto;
import me.golemcore.gateway.adapter.inbound.web.dto.HandoffNotesRequest;
import me.golemcore.gateway.adapter.inbound.web.dto.HookResolutionDto;
import me.golemcore.gateway.adapter.inbound.web.dto.LifecycleEventRequest;
import me.golemcore.gateway.adapter.inbound.web.dto.SessionDetailDto;
import me.golemcore.gateway.adapter.inbound.web.dto.SessionSummaryDto;
import me.golemcore.gateway.domain.model.Message;
import me.golemcore.gateway.domain.model.Session;
import me.golemcore.gateway.domain.model.ToolCallSegment;
import me.golemcore.gateway.domain.model.Turn;
import me.golemcore.gateway.domain.model.hook.HookResolution;
import me.golemcore.gateway.domain.service.CompactionService;
import me.golemcore.gateway.port.inbound.ExchangePort;
import me.golemcore.gateway.port.outbound.SessionPort;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Session inspection and history editing endpoints.
 */
@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
public class SessionsController {

    private final SessionPort sessionPort;
    private final ExchangePort exchangePort;

    @GetMapping
    public Mono<ResponseEntity<List<SessionSummaryDto>>> listSessions() {
        List<SessionSummaryDto> dtos = sessionPort.listAll().stream()
                .map(SessionsController::toSummary)
                .toList();
        return Mono.just(ResponseEntity.ok(dtos));
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<SessionDetailDto>> getSession(@PathVariable String id) {
        Session session = sessionPort.get(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Session not found"));
        return Mono.just(ResponseEntity.ok(toDetail(session)));
    }

    @PostMapping("/{id}/undo")
    public Mono<ResponseEntity<SessionDetailDto>> undo(@PathVariable String id) {
        return Mono.fromCallable(() -> {
            requireExists(id);
            Optional<Turn> undone = sessionPort.undo(id);
            if (undone.isEmpty()) {
                throw new IllegalStateException("Nothing to undo in session " + id);
            }
            return ResponseEntity.ok(toDetail(sessionPort.get(id).orElseThrow()));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/{id}/redo")
    public Mono<ResponseEntity<SessionDetailDto>> redo(@PathVariable String id) {
        return Mono.fromCallable(() -> {
            requireExists(id);
            Optional<Turn> restored = sessionPort.redo(id);
            if (restored.isEmpty()) {
                throw new IllegalStateException("Nothing to redo in session " + id);
            }
            return ResponseEntity.ok(toDetail(sessionPort.get(id).orElseThrow()));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/{id}/compact")
    public Mono<ResponseEntity<CompactionResultDto>> compact(@PathVariable String id) {
        return Mono.fromCallable(() -> {
            requireExists(id);
            CompactionService.Result result = exchangePort.compact(id);
            Session session = sessionPort.get(id).orElseThrow();
            return ResponseEntity.ok(CompactionResultDto.builder()
                    .sessionId(id)
                    .result(result.name())
                    .budgetUsed(session.getBudgetUsed())
                    .turnCount(session.getTurns().size())
                    .build());
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/{id}/end")
    public Mono<ResponseEntity<SessionDetailDto>> end(@PathVariable String id,
            @RequestParam(defaultValue = "other") String reason) {
        return Mono.fromCallable(() -> {
            requireExists(id);
            return ResponseEntity.ok(toDetail(exchangePort.sessionEnd(id, reason)));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Fires the lifecycle hooks a client reports outside of an exchange.
     * {@code session_start} creates the session when it does not exist yet.
     */
    @PostMapping("/{id}/events")
    public Mono<ResponseEntity<HookResolutionDto>> lifecycleEvent(@PathVariable String id,
            @RequestBody LifecycleEventRequest request) {
        String type = request.getType() != null ? request.getType() : "";
        return Mono.fromCallable(() -> {
            HookResolution resolution = switch (type) {
            case "session_start" -> exchangePort.sessionStart(id,
                    request.getSource() != null ? request.getSource() : "startup");
            case "notification" -> exchangePort.notify(id, request.getMessage(), request.getNotificationType());
            case "subagent_start" -> exchangePort.subagentStart(id, request.getAgentId(), request.getAgentType());
            case "subagent_stop" -> exchangePort.subagentStop(id, request.getAgentId(), request.getAgentType(),
                    request.getFailureReason());
            default -> throw new IllegalArgumentException("Unsupported lifecycle event: " + type);
            };
            return ResponseEntity.ok(HookResolutionDto.builder()
                    .event(type)
                    .blocked(resolution.isBlocked())
                    .reason(resolution.getBlockReason())
                    .systemMessages(resolution.getSystemMessages())
                    .build());
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping(value = "/{id}/handoff", produces = MediaType.TEXT_MARKDOWN_VALUE)
    public Mono<ResponseEntity<String>> handoff(@PathVariable String id) {
        return Mono.fromCallable(() -> {
            requireExists(id);
            return ResponseEntity.ok().contentType(MediaType.TEXT_MARKDOWN).body(exchangePort.handoff(id));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @PutMapping("/{id}/handoff-notes")
    public Mono<ResponseEntity<SessionDetailDto>> updateHandoffNotes(@PathVariable String id,
            @RequestBody HandoffNotesRequest request) {
        return Mono.fromCallable(() -> {
            requireExists(id);
            return ResponseEntity.ok(toDetail(sessionPort.updateHandoffNotes(id, request.getNotes())));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @DeleteMapping("/{id}")
    public Mono<ResponseEntity<Void>> deleteSession(@PathVariable String id) {
        return Mono.fromCallable(() -> {
            requireExists(id);
            sessionPort.delete(id);
            return ResponseEntity.noContent().<Void>build();
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private void requireExists(String id) {
        if (sessionPort.get(id).isEmpty()) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Session not found");
        }
    }

    private static SessionSummaryDto toSummary(Session session) {
        return SessionSummaryDto.builder()
                .id(session.getId())
                .status(session.getStatus().name())
                .turnCount(session.getTurns().size())
                .budgetUsed(session.getBudgetUsed())
                .hasSummary(session.hasSummary())
                .compactionCount(session.getCompactionCount())
                .createdAt(format(session.getCreatedAt()))
                .updatedAt(format(session.getUpdatedAt()))
                .build();
    }

    private static SessionDetailDto toDetail(Session session) {
        List<SessionDetailDto.TurnDto> turns = session.getTurns().stream()
                .map(turn -> SessionDetailDto.TurnDto.builder()
                        .id(turn.getId())
                        .kind(turn.getKind().name())
                        .estimatedSize(turn.getEstimatedSize())
                        .createdAt(format(turn.getCreatedAt()))
                        .messages(turn.getMessages().stream().map(SessionsController::toMessageDto).toList())
                        .build())
                .toList();
        return SessionDetailDto.builder()
                .id(session.getId())
                .status(session.getStatus().name())
                .budgetUsed(session.getBudgetUsed())
                .redoDepth(session.getRedoStack().size())
                .compactionCount(session.getCompactionCount())
                .inputTokens(session.getUsage().getInputTokens())
                .outputTokens(session.getUsage().getOutputTokens())
                .createdAt(format(session.getCreatedAt()))
                .updatedAt(format(session.getUpdatedAt()))
                .handoffNotes(session.getHandoffNotes())
                .turns(turns)
                .build();
    }

    private static SessionDetailDto.MessageDto toMessageDto(Message message) {
        return SessionDetailDto.MessageDto.builder()
                .id(message.getId())
                .role(message.getRole().wireName())
                .content(message.getText())
                .timestamp(format(message.getTimestamp()))
                .toolCalls(message.getToolCalls().stream().map(ToolCallSegment::name).toList())
                .attachments(message.getAttachments().size())
                .build();
    }

    private static String format(Instant instant) {
        return instant != null ? instant.toString() : null;
    }
}
