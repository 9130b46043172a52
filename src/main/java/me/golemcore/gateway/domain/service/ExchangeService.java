package me.golemcore.gateway.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.AssembledContext;
import me.golemcore.gateway.domain.model.CanonicalRequest;
import me.golemcore.gateway.domain.model.CanonicalResponse;
import me.golemcore.gateway.domain.model.ContentSegment;
import me.golemcore.gateway.domain.model.GatewayConfig;
import me.golemcore.gateway.domain.model.GatewayException;
import me.golemcore.gateway.domain.model.Message;
import me.golemcore.gateway.domain.model.RecentSession;
import me.golemcore.gateway.domain.model.Role;
import me.golemcore.gateway.domain.model.Session;
import me.golemcore.gateway.domain.model.StreamDelta;
import me.golemcore.gateway.domain.model.TextSegment;
import me.golemcore.gateway.domain.model.ToolCallSegment;
import me.golemcore.gateway.domain.model.Turn;
import me.golemcore.gateway.domain.model.hook.HookEvent;
import me.golemcore.gateway.domain.model.hook.HookEventKind;
import me.golemcore.gateway.domain.model.hook.HookPayload;
import me.golemcore.gateway.domain.model.hook.HookResolution;
import me.golemcore.gateway.domain.model.hook.NotificationPayload;
import me.golemcore.gateway.domain.model.hook.SessionEndPayload;
import me.golemcore.gateway.domain.model.hook.SessionStartPayload;
import me.golemcore.gateway.domain.model.hook.StopPayload;
import me.golemcore.gateway.domain.model.hook.SubagentPayload;
import me.golemcore.gateway.domain.model.hook.UserPromptSubmitPayload;
import me.golemcore.gateway.domain.system.KeyedLocks;
import me.golemcore.gateway.domain.system.SessionDigest;
import me.golemcore.gateway.domain.system.SessionHandoff;
import me.golemcore.gateway.domain.system.SizeEstimator;
import me.golemcore.gateway.domain.system.StreamAccumulator;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.inbound.ExchangeCommand;
import me.golemcore.gateway.port.inbound.ExchangeOutcome;
import me.golemcore.gateway.port.inbound.ExchangePort;
import me.golemcore.gateway.port.outbound.LlmPort;
import me.golemcore.gateway.port.outbound.MemoryPort;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Runs exchanges end to end.
 *
 * <p>
 * An exchange captures one configuration snapshot and holds the session lock
 * from the prompt hook until its turn is appended. Steps:
 * {@code user_prompt_submit} hooks, compaction check, context injection,
 * provider call, tool-use review, append of a single turn holding the
 * incoming messages and the response, then {@code stop} hooks. A failed or
 * cancelled exchange appends nothing, and one undo removes one exchange.
 */
@Service
@Slf4j
public class ExchangeService implements ExchangePort {

    private static final String START_SOURCE_STARTUP = "startup";

    private final ConfigSnapshotHolder configHolder;
    private final SessionService sessionService;
    private final HookEngine hookEngine;
    private final CompactionService compactionService;
    private final ContextInjector contextInjector;
    private final ToolUseGate toolUseGate;
    private final GuardrailService guardrailService;
    private final LlmPort llmPort;
    private final MemoryPort memoryPort;
    private final SizeEstimator sizeEstimator;
    private final ObjectMapper objectMapper;
    private final GatewayProperties properties;
    private final Clock clock;

    public ExchangeService(ConfigSnapshotHolder configHolder, SessionService sessionService, HookEngine hookEngine,
            CompactionService compactionService, ContextInjector contextInjector, ToolUseGate toolUseGate,
            GuardrailService guardrailService, LlmPort llmPort, MemoryPort memoryPort, SizeEstimator sizeEstimator,
            ObjectMapper objectMapper, GatewayProperties properties, Clock clock) {
        this.configHolder = configHolder;
        this.sessionService = sessionService;
        this.hookEngine = hookEngine;
        this.compactionService = compactionService;
        this.contextInjector = contextInjector;
        this.toolUseGate = toolUseGate;
        this.guardrailService = guardrailService;
        this.llmPort = llmPort;
        this.memoryPort = memoryPort;
        this.sizeEstimator = sizeEstimator;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public ExchangeOutcome exchange(ExchangeCommand command) {
        GatewayConfig config = configHolder.current();
        String sessionId = resolveSessionId(command);
        try (KeyedLocks.Handle ignored = lock(sessionId)) {
            Prepared prepared = prepare(sessionId, command, config);
            if (prepared.blockReason() != null) {
                return new ExchangeOutcome.Blocked(sessionId, prepared.blockReason());
            }
            CanonicalResponse response;
            try {
                response = llmPort.chat(prepared.request()).get();
            } catch (ExecutionException e) {
                fireStop(sessionId, null, rootMessage(e), config);
                throw unwrap(e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new GatewayException("Exchange interrupted for session " + sessionId, e);
            }
            CanonicalResponse reviewed = complete(prepared, response, config);
            return new ExchangeOutcome.Completed(sessionId, reviewed, prepared.context().skippedSources());
        }
    }

    /**
     * Checks the command, then returns a stream that takes the session lock
     * only when subscribed. A blocked prompt comes out as a single
     * {@link StreamDelta.Kind#BLOCKED} delta.
     */
    @Override
    public ExchangeOutcome exchangeStream(ExchangeCommand command) {
        GatewayConfig config = configHolder.current();
        String sessionId = resolveSessionId(command);
        requireIncoming(command);
        sessionService.get(sessionId).filter(Session::isEnded).ifPresent(ended -> {
            throw new IllegalStateException("Session " + sessionId + " has ended");
        });
        Flux<StreamDelta> deltas = Flux.using(
                () -> lock(sessionId),
                handle -> streamLocked(sessionId, command, config),
                KeyedLocks.Handle::close)
                .subscribeOn(Schedulers.boundedElastic());
        return new ExchangeOutcome.Streaming(sessionId, deltas);
    }

    private Flux<StreamDelta> streamLocked(String sessionId, ExchangeCommand command, GatewayConfig config) {
        Prepared prepared = prepare(sessionId, command, config);
        if (prepared.blockReason() != null) {
            return Flux.just(StreamDelta.blocked(prepared.blockReason()));
        }
        CanonicalRequest request = prepared.request();
        StreamAccumulator accumulator = new StreamAccumulator(objectMapper, request.getProviderId());
        // text and reasoning pass through live; tool calls are held back until reviewed
        return Flux.defer(() -> llmPort.chatStream(request))
                .doOnNext(accumulator::accept)
                .filter(delta -> delta.kind() == StreamDelta.Kind.TEXT || delta.kind() == StreamDelta.Kind.REASONING)
                .concatWith(Flux.defer(() -> {
                    CanonicalResponse response = accumulator.toResponse();
                    response.getNotes().addAll(request.getCapabilityNotes());
                    CanonicalResponse reviewed = complete(prepared, response, config);
                    return Flux.fromIterable(trailingDeltas(response, reviewed));
                }))
                .doOnError(e -> fireStop(sessionId, null, e.getMessage(), config))
                .doOnCancel(() -> log.info("[Exchange] Session {}: stream cancelled, nothing appended", sessionId));
    }

    @Override
    public CompactionService.Result compact(String sessionId) {
        GatewayConfig config = configHolder.current();
        try (KeyedLocks.Handle ignored = lock(sessionId)) {
            Session session = sessionService.get(sessionId)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown session: " + sessionId));
            return compactionService.compactNow(session, config.model(), config.providerId(), config);
        }
    }

    @Override
    public HookResolution sessionStart(String sessionId, String source) {
        GatewayConfig config = configHolder.current();
        Session session = sessionService.getOrCreate(sessionId);
        return dispatch(HookEventKind.SESSION_START, session.getId(), new SessionStartPayload(source), config);
    }

    @Override
    public Session sessionEnd(String sessionId, String reason) {
        GatewayConfig config = configHolder.current();
        Session existing = sessionService.get(sessionId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown session: " + sessionId));
        if (existing.isEnded()) {
            return existing;
        }
        dispatch(HookEventKind.SESSION_END, sessionId, new SessionEndPayload(reason), config);
        Session ended = sessionService.end(sessionId);
        saveRecentSession(ended);
        guardrailService.forget(sessionId);
        return ended;
    }

    @Override
    public String handoff(String sessionId) {
        Session session = sessionService.get(sessionId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown session: " + sessionId));
        Set<String> files = new LinkedHashSet<>();
        List<String> issues = List.of();
        try {
            files.addAll(memoryPort.getFilesModified(sessionId));
            issues = memoryPort.getIssuesWorked(sessionId);
        } catch (RuntimeException e) {
            log.warn("[Memory] Activity of session {} unavailable for handoff: {}", sessionId, e.getMessage());
        }
        files.addAll(guardrailService.diffStats(sessionId).files());
        return SessionHandoff.render(session, new ArrayList<>(files), issues);
    }

    @Override
    public HookResolution notify(String sessionId, String message, String notificationType) {
        return dispatch(HookEventKind.NOTIFICATION, sessionId, new NotificationPayload(message, notificationType),
                configHolder.current());
    }

    @Override
    public HookResolution subagentStart(String sessionId, String agentId, String agentType) {
        return dispatch(HookEventKind.SUBAGENT_START, sessionId, new SubagentPayload(agentId, agentType, null),
                configHolder.current());
    }

    @Override
    public HookResolution subagentStop(String sessionId, String agentId, String agentType, String failureReason) {
        return dispatch(HookEventKind.SUBAGENT_STOP, sessionId,
                new SubagentPayload(agentId, agentType, failureReason), configHolder.current());
    }

    // ==================== Pipeline ====================

    private Prepared prepare(String sessionId, ExchangeCommand command, GatewayConfig config) {
        requireIncoming(command);
        boolean isNew = sessionService.get(sessionId).isEmpty();
        Session session = sessionService.getOrCreate(sessionId);
        if (session.isEnded()) {
            throw new IllegalStateException("Session " + sessionId + " has ended");
        }

        List<String> hookMessages = new ArrayList<>();
        if (isNew) {
            HookResolution start = dispatch(HookEventKind.SESSION_START, sessionId,
                    new SessionStartPayload(START_SOURCE_STARTUP), config);
            hookMessages.addAll(start.getSystemMessages());
        }

        List<Message> incoming = new ArrayList<>(command.getIncoming());
        int promptIndex = lastUserPromptIndex(incoming);
        if (promptIndex >= 0) {
            String prompt = incoming.get(promptIndex).getText();
            HookResolution submit = dispatch(HookEventKind.USER_PROMPT_SUBMIT, sessionId,
                    new UserPromptSubmitPayload(prompt), config);
            if (submit.isBlocked()) {
                log.info("[Exchange] Session {}: prompt blocked: {}", sessionId, submit.getBlockReason());
                return Prepared.blocked(submit.getBlockReason());
            }
            if (submit.getUpdatedPrompt() != null) {
                incoming.set(promptIndex, replaceText(incoming.get(promptIndex), submit.getUpdatedPrompt()));
            }
            hookMessages.addAll(submit.getSystemMessages());
        }

        String model = command.getModel() != null ? command.getModel() : config.model();
        String providerId = command.getProviderId() != null ? command.getProviderId() : config.providerId();
        if (compactionService.compactIfNeeded(session, sizeEstimator.estimate(incoming), model, providerId,
                config) == CompactionService.Result.COMPACTED) {
            session = sessionService.get(sessionId).orElse(session);
        }

        AssembledContext context = contextInjector.assemble(session, incoming, command.getSystemPrompts(),
                hookMessages, config);
        CanonicalRequest request = CanonicalRequest.builder()
                .model(model)
                .providerId(providerId)
                .sessionId(sessionId)
                .messages(new ArrayList<>(context.messages()))
                .tools(new ArrayList<>(command.getTools()))
                .temperature(command.getTemperature())
                .maxTokens(command.getMaxTokens())
                .thinking(command.getThinking())
                .build();
        log.debug("[Exchange] Session {}: {} message(s) to {}/{}", sessionId, context.messages().size(),
                providerId, model);
        return new Prepared(session, context, request, null);
    }

    /**
     * Reviews tool calls, appends the exchange as one turn (incoming messages
     * followed by the assistant message) and fires the stop hooks.
     */
    private CanonicalResponse complete(Prepared prepared, CanonicalResponse response, GatewayConfig config) {
        Session session = prepared.session();
        CanonicalResponse reviewed = toolUseGate.review(session.getId(), response, config);
        Message assistant = reviewed.getMessage().toBuilder().timestamp(clock.instant()).build();

        List<Message> messages = new ArrayList<>();
        for (Message message : prepared.context().incoming()) {
            messages.add(message.getTimestamp() != null ? message
                    : message.toBuilder().timestamp(clock.instant()).build());
        }
        messages.add(assistant);
        Turn turn = Turn.builder()
                .messages(messages)
                .estimatedSize(sizeEstimator.estimate(messages))
                .createdAt(clock.instant())
                .build();
        sessionService.appendTurns(session.getId(), List.of(turn), reviewed.getUsage());

        if (reviewed.isIncomplete()) {
            log.warn("[Exchange] Session {}: response incomplete, kept partial content", session.getId());
        }
        if (reviewed.isDegraded()) {
            log.info("[Exchange] Session {}: degraded request: {}", session.getId(), reviewed.getNotes());
        }
        fireStop(session.getId(), reviewed.getFinishReason(), null, config);
        return reviewed.toBuilder().message(assistant).build();
    }

    /**
     * Deltas emitted after the live text: the reviewed tail of the message
     * (tool calls and blocked-call notes), usage and the finish reason.
     */
    private List<StreamDelta> trailingDeltas(CanonicalResponse original, CanonicalResponse reviewed) {
        List<ContentSegment> originalContent = original.getMessage().getContent();
        int firstToolCall = 0;
        while (firstToolCall < originalContent.size()
                && !(originalContent.get(firstToolCall) instanceof ToolCallSegment)) {
            firstToolCall++;
        }
        List<ContentSegment> reviewedContent = reviewed.getMessage().getContent();
        List<StreamDelta> deltas = new ArrayList<>();
        int index = 0;
        for (int i = firstToolCall; i < reviewedContent.size(); i++) {
            ContentSegment segment = reviewedContent.get(i);
            if (segment instanceof ToolCallSegment call) {
                deltas.add(StreamDelta.toolCall(index++, call.id(), call.name(), toJson(call)));
            } else if (segment instanceof TextSegment text) {
                deltas.add(StreamDelta.text(text.text()));
            }
        }
        if (reviewed.getUsage() != null) {
            deltas.add(StreamDelta.usage(reviewed.getUsage()));
        }
        deltas.add(StreamDelta.finish(reviewed.getFinishReason() != null
                ? reviewed.getFinishReason()
                : CanonicalResponse.FINISH_STOP));
        return deltas;
    }

    private String toJson(ToolCallSegment call) {
        try {
            return objectMapper.writeValueAsString(call.arguments());
        } catch (JsonProcessingException e) {
            throw new GatewayException("Cannot serialize arguments of tool call " + call.id(), e);
        }
    }

    private void fireStop(String sessionId, String finishReason, String failureReason, GatewayConfig config) {
        HookResolution stop = dispatch(HookEventKind.STOP, sessionId, new StopPayload(finishReason, failureReason),
                config);
        if (stop.isBlocked()) {
            // the response is already out; a stop block only gets recorded
            log.info("[Exchange] Session {}: stop hook asked to continue: {}", sessionId, stop.getBlockReason());
        }
    }

    private void saveRecentSession(Session session) {
        try {
            RecentSession recent = RecentSession.builder()
                    .sessionId(session.getId())
                    .summary(SessionDigest.of(session))
                    .filesModified(new ArrayList<>(memoryPort.getFilesModified(session.getId())))
                    .issuesWorked(new ArrayList<>(memoryPort.getIssuesWorked(session.getId())))
                    .startedAt(session.getCreatedAt())
                    .endedAt(clock.instant())
                    .build();
            memoryPort.saveRecentSession(recent);
            memoryPort.pruneRecentSessions();
        } catch (RuntimeException e) {
            log.warn("[Memory] Failed to save summary of session {}: {}", session.getId(), e.getMessage());
        }
    }

    private HookResolution dispatch(HookEventKind kind, String sessionId, HookPayload payload, GatewayConfig config) {
        return hookEngine.dispatch(HookEvent.of(kind, sessionId, config.context().projectDir(), payload),
                config.hooks());
    }

    private KeyedLocks.Handle lock(String sessionId) {
        try {
            return sessionService.getLocks().acquire(sessionId,
                    Duration.ofMillis(properties.getSession().getLockTimeoutMs()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for session " + sessionId, e);
        }
    }

    private static void requireIncoming(ExchangeCommand command) {
        if (command.getIncoming().isEmpty()) {
            throw new IllegalArgumentException("Exchange requires at least one incoming message");
        }
    }

    private static String resolveSessionId(ExchangeCommand command) {
        String id = command.getSessionId();
        return id != null && !id.isBlank() ? id : UUID.randomUUID().toString();
    }

    private static int lastUserPromptIndex(List<Message> incoming) {
        for (int i = incoming.size() - 1; i >= 0; i--) {
            Message message = incoming.get(i);
            if (message.getRole() == Role.USER && !message.getText().isBlank()) {
                return i;
            }
        }
        return -1;
    }

    private static Message replaceText(Message message, String text) {
        List<ContentSegment> segments = new ArrayList<>();
        for (ContentSegment segment : message.getContent()) {
            if (!(segment instanceof TextSegment)) {
                segments.add(segment);
            }
        }
        segments.add(new TextSegment(text));
        return message.withContent(segments);
    }

    private static RuntimeException unwrap(ExecutionException e) {
        Throwable cause = e.getCause();
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        return new GatewayException(cause != null ? cause.getMessage() : e.getMessage(), cause);
    }

    private static String rootMessage(ExecutionException e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        return cause.getMessage();
    }

    private record Prepared(Session session, AssembledContext context, CanonicalRequest request,
            String blockReason) {

        static Prepared blocked(String reason) {
            return new Prepared(null, null, null, reason);
        }
    }
}
