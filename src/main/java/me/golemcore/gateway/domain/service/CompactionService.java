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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.CanonicalRequest;
import me.golemcore.gateway.domain.model.CanonicalResponse;
import me.golemcore.gateway.domain.model.CompactionException;
import me.golemcore.gateway.domain.model.GatewayConfig;
import me.golemcore.gateway.domain.model.Message;
import me.golemcore.gateway.domain.model.Role;
import me.golemcore.gateway.domain.model.Session;
import me.golemcore.gateway.domain.model.SessionStatus;
import me.golemcore.gateway.domain.model.TextSegment;
import me.golemcore.gateway.domain.model.ToolCallSegment;
import me.golemcore.gateway.domain.model.ToolResultSegment;
import me.golemcore.gateway.domain.model.Turn;
import me.golemcore.gateway.domain.model.TurnKind;
import me.golemcore.gateway.domain.model.hook.HookEvent;
import me.golemcore.gateway.domain.model.hook.HookEventKind;
import me.golemcore.gateway.domain.model.hook.HookResolution;
import me.golemcore.gateway.domain.model.hook.PreCompactPayload;
import me.golemcore.gateway.domain.system.CompactionSummaryFormat;
import me.golemcore.gateway.domain.system.SizeEstimator;
import me.golemcore.gateway.port.outbound.LlmPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Keeps session history within the model's context budget by replacing a
 * prefix of turns with one structured summary turn.
 *
 * <p>
 * Compaction triggers when the running budget plus the incoming turn would
 * exceed {@code floor(contextLimit * thresholdFraction)}. A previous summary
 * is always part of the compacted prefix and gets folded into the new
 * summary, so history never holds two summaries. The history is only touched
 * once a usable summary exists: any failure leaves the session exactly as it
 * was and compaction is retried on the next exchange.
 *
 * <p>
 * Callers hold the session lock. The session passed in is left as it is; a
 * successful compaction publishes a new snapshot through
 * {@link SessionService#save}, which callers re-read.
 */
@Service
@Slf4j
public class CompactionService {

    static final String TRIGGER_AUTO = "auto";
    static final String TRIGGER_MANUAL = "manual";
    private static final String SUMMARY_PREFIX = "[Conversation summary]\n";
    private static final int MAX_RENDERED_CHARS_PER_MESSAGE = 4000;

    private final LlmPort llmPort;
    private final HookEngine hookEngine;
    private final SessionService sessionService;
    private final SizeEstimator sizeEstimator;
    private final Clock clock;

    public CompactionService(LlmPort llmPort, HookEngine hookEngine, SessionService sessionService,
            SizeEstimator sizeEstimator, Clock clock) {
        this.llmPort = llmPort;
        this.hookEngine = hookEngine;
        this.sessionService = sessionService;
        this.sizeEstimator = sizeEstimator;
        this.clock = clock;
    }

    public enum Result {
        NOT_NEEDED, COMPACTED, DEFERRED
    }

    /**
     * Compacts {@code session} when appending {@code incomingSize} more units
     * would cross the threshold for {@code model}.
     */
    public Result compactIfNeeded(Session session, int incomingSize, String model, String providerId,
            GatewayConfig config) {
        GatewayConfig.CompactionSettings settings = config.compaction();
        if (!settings.enabled()) {
            return Result.NOT_NEEDED;
        }
        int threshold = settings.thresholdFor(model);
        if (session.getBudgetUsed() + incomingSize <= threshold) {
            return Result.NOT_NEEDED;
        }
        log.info("[Compaction] Session {}: budget {} + incoming {} exceeds threshold {} for {}",
                session.getId(), session.getBudgetUsed(), incomingSize, threshold, model);
        return compact(session, TRIGGER_AUTO, threshold, model, providerId, config);
    }

    /**
     * Compacts on request, regardless of the budget.
     */
    public Result compactNow(Session session, String model, String providerId, GatewayConfig config) {
        return compact(session, TRIGGER_MANUAL, config.compaction().thresholdFor(model), model, providerId, config);
    }

    private Result compact(Session session, String trigger, int threshold, String model, String providerId,
            GatewayConfig config) {
        int preserve = Math.max(0, config.compaction().preserveRecentTurns());
        int compactableVerbatim = session.getVerbatimTurnCount() - preserve;
        if (compactableVerbatim <= 0) {
            log.debug("[Compaction] Session {}: nothing to compact ({} verbatim, {} preserved)",
                    session.getId(), session.getVerbatimTurnCount(), preserve);
            return Result.DEFERRED;
        }
        int replacedCount = compactableVerbatim + (session.hasSummary() ? 1 : 0);

        HookResolution hooks = hookEngine.dispatch(HookEvent.of(HookEventKind.PRE_COMPACT, session.getId(),
                config.context().projectDir(),
                new PreCompactPayload(trigger, session.getBudgetUsed(), threshold, session.getTurns().size())),
                config.hooks());
        if (hooks.isBlocked()) {
            log.info("[Compaction] Session {}: deferred by hook: {}", session.getId(), hooks.getBlockReason());
            return Result.DEFERRED;
        }

        Session compacting = session.copy();
        compacting.setStatus(SessionStatus.COMPACTING);
        sessionService.publish(compacting);
        boolean installed = false;
        try {
            List<Turn> prefix = new ArrayList<>(session.getTurns().subList(0, replacedCount));
            String summaryText = summarize(prefix, model, providerId, config);
            Message summaryMessage = Message.builder()
                    .role(Role.SYSTEM)
                    .segment(new TextSegment(SUMMARY_PREFIX + summaryText))
                    .timestamp(clock.instant())
                    .build();
            Turn summary = Turn.builder()
                    .kind(TurnKind.COMPACTION_SUMMARY)
                    .message(summaryMessage)
                    .estimatedSize(sizeEstimator.estimate(summaryMessage))
                    .createdAt(clock.instant())
                    .build();

            Session compacted = session.copy();
            compacted.installSummary(summary, replacedCount);
            sessionService.save(compacted);
            installed = true;
            sessionService.recordEvent(session.getId(), "compaction", Map.of(
                    "trigger", trigger,
                    "replacedTurns", replacedCount,
                    "budgetBefore", session.getBudgetUsed(),
                    "budgetAfter", compacted.getBudgetUsed(),
                    "summary", summary));
            log.info("[Compaction] Session {}: replaced {} turn(s), budget {} -> {}",
                    session.getId(), replacedCount, session.getBudgetUsed(), compacted.getBudgetUsed());
            return Result.COMPACTED;
        } catch (CompactionException e) {
            log.warn("[Compaction] Session {}: deferred, history kept: {}", session.getId(), e.getMessage());
            return Result.DEFERRED;
        } finally {
            if (!installed) {
                sessionService.publish(session);
            }
        }
    }

    private String summarize(List<Turn> prefix, String model, String providerId, GatewayConfig config) {
        GatewayConfig.CompactionSettings settings = config.compaction();
        CanonicalRequest request = CanonicalRequest.builder()
                .model(settings.summaryModel() != null ? settings.summaryModel() : model)
                .providerId(providerId)
                .messages(List.of(
                        Message.system(CompactionSummaryFormat.instructions()),
                        Message.user(renderConversation(prefix))))
                .maxTokens(settings.summaryMaxTokens())
                .temperature(0.3)
                .build();

        long start = clock.millis();
        CompletableFuture<CanonicalResponse> call = llmPort.chat(request);
        CanonicalResponse response;
        try {
            response = call.get(settings.summaryTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw new CompactionException("Summarization interrupted", e);
        } catch (TimeoutException e) {
            call.cancel(true);
            throw new CompactionException("Summarization timed out after " + settings.summaryTimeout().toMillis()
                    + " ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new CompactionException("Summarization failed: " + cause.getMessage(), cause);
        }

        String raw = response.getMessage() != null ? response.getMessage().getText() : null;
        String normalized = CompactionSummaryFormat.normalize(raw)
                .orElseThrow(() -> new CompactionException("Summary has no recognizable sections"));
        log.debug("[Compaction] Summarized {} turn(s) in {} ms ({} chars)", prefix.size(), clock.millis() - start,
                normalized.length());
        return normalized;
    }

    static String renderConversation(List<Turn> turns) {
        StringBuilder sb = new StringBuilder("Conversation to summarize:\n\n");
        for (Turn turn : turns) {
            for (Message message : turn.getMessages()) {
                sb.append(message.getRole().wireName()).append(": ");
                String text = message.getText();
                if (text != null && !text.isBlank()) {
                    sb.append(truncate(text, MAX_RENDERED_CHARS_PER_MESSAGE));
                }
                for (ToolCallSegment call : message.getToolCalls()) {
                    sb.append("\n[tool call ").append(call.name()).append(' ').append(call.arguments()).append(']');
                }
                for (ToolResultSegment result : message.getToolResults()) {
                    sb.append("\n[tool result ").append(result.toolName() != null ? result.toolName() : "")
                            .append(result.error() ? " (error)" : "").append("] ")
                            .append(truncate(result.content(), MAX_RENDERED_CHARS_PER_MESSAGE));
                }
                sb.append("\n\n");
            }
        }
        return sb.toString();
    }

    private static String truncate(String text, int maxLen) {
        if (text == null) {
            return "";
        }
        return text.length() <= maxLen ? text : text.substring(0, maxLen) + "...";
    }
}
