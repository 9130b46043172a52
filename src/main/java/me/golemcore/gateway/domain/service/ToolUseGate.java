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
import me.golemcore.gateway.domain.model.CanonicalResponse;
import me.golemcore.gateway.domain.model.ContentSegment;
import me.golemcore.gateway.domain.model.GatewayConfig;
import me.golemcore.gateway.domain.model.Message;
import me.golemcore.gateway.domain.model.TextSegment;
import me.golemcore.gateway.domain.model.ToolCallSegment;
import me.golemcore.gateway.domain.model.ToolResultSegment;
import me.golemcore.gateway.domain.model.hook.HookEvent;
import me.golemcore.gateway.domain.model.hook.HookEventKind;
import me.golemcore.gateway.domain.model.hook.HookPermission;
import me.golemcore.gateway.domain.model.hook.HookResolution;
import me.golemcore.gateway.domain.model.hook.PostToolUsePayload;
import me.golemcore.gateway.domain.model.hook.ToolFailurePayload;
import me.golemcore.gateway.domain.model.hook.ToolUsePayload;
import me.golemcore.gateway.port.outbound.ToolExecutor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Applies guardrails and tool-use hooks to tool calls.
 *
 * <p>
 * {@link #review} gates the tool calls a model asked for before they reach
 * the client: calls outside the guardrails or denied by a hook are replaced by
 * a text note, rewritten input replaces the call arguments, and an
 * {@code ask} verdict is escalated to a {@code permission_request} hook.
 * Guardrails run before the hooks and again on rewritten input. Every call
 * the gate lets through counts towards the session's diff. {@link #execute}
 * wraps a tool run with the pre and post hooks.
 */
@Service
@Slf4j
public class ToolUseGate {

    private final HookEngine hookEngine;
    private final GuardrailService guardrailService;

    public ToolUseGate(HookEngine hookEngine, GuardrailService guardrailService) {
        this.hookEngine = hookEngine;
        this.guardrailService = guardrailService;
    }

    public CanonicalResponse review(String sessionId, CanonicalResponse response, GatewayConfig config) {
        Message message = response.getMessage();
        if (message == null || !message.hasToolCalls()
                || (!config.hooks().enabled() && !config.guardrails().guardsToolCalls())) {
            return response;
        }
        GuardrailService.Turn turn = guardrailService.openTurn(sessionId, config);
        List<ContentSegment> segments = new ArrayList<>();
        int removed = 0;
        int kept = 0;
        for (ContentSegment segment : message.getContent()) {
            if (!(segment instanceof ToolCallSegment call)) {
                segments.add(segment);
                continue;
            }
            Verdict verdict = gate(sessionId, call, turn, config);
            if (verdict.blocked()) {
                log.info("[Gate] Session {}: tool call {} ({}) blocked: {}", sessionId, call.id(), call.name(),
                        verdict.reason());
                segments.add(new TextSegment(blockedNote(call, verdict.reason())));
                removed++;
            } else {
                segments.add(verdict.call());
                kept++;
            }
        }
        if (removed == 0 && segments.equals(message.getContent())) {
            return response;
        }
        CanonicalResponse.CanonicalResponseBuilder reviewed = response.toBuilder()
                .message(message.withContent(segments));
        if (kept == 0 && CanonicalResponse.FINISH_TOOL_CALLS.equals(response.getFinishReason())) {
            reviewed.finishReason(CanonicalResponse.FINISH_STOP);
        }
        return reviewed.build();
    }

    /**
     * Runs {@code call} through {@code executor} between the pre and post
     * tool-use hooks. A blocked call never reaches the executor.
     */
    public ToolResultSegment execute(String sessionId, ToolCallSegment call, ToolExecutor executor,
            GatewayConfig config) {
        Verdict verdict = gate(sessionId, call, guardrailService.openTurn(sessionId, config), config);
        if (verdict.blocked()) {
            log.info("[Gate] Session {}: tool {} not executed: {}", sessionId, call.name(), verdict.reason());
            return new ToolResultSegment(call.id(), call.name(), blockedNote(call, verdict.reason()), true);
        }
        ToolCallSegment effective = verdict.call();
        String cwd = config.context().projectDir();
        String output;
        try {
            output = executor.execute(effective);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failure(sessionId, effective, "Interrupted", cwd, config);
        } catch (Exception e) {
            log.warn("[Hooks] Session {}: tool {} failed: {}", sessionId, effective.name(), e.getMessage());
            return failure(sessionId, effective, e.getMessage() != null ? e.getMessage() : e.toString(), cwd,
                    config);
        }

        HookResolution post = hookEngine.dispatch(HookEvent.of(HookEventKind.POST_TOOL_USE, sessionId, cwd,
                new PostToolUsePayload(effective.name(), effective.arguments(), effective.id(), output)),
                config.hooks());
        StringBuilder content = new StringBuilder(output != null ? output : "");
        if (post.isBlocked()) {
            content.append("\n\n[").append(post.getBlockReason()).append(']');
        }
        for (String systemMessage : post.getSystemMessages()) {
            content.append("\n\n").append(systemMessage);
        }
        return new ToolResultSegment(effective.id(), effective.name(), content.toString(), false);
    }

    private ToolResultSegment failure(String sessionId, ToolCallSegment call, String error, String cwd,
            GatewayConfig config) {
        hookEngine.dispatch(HookEvent.of(HookEventKind.POST_TOOL_USE_FAILURE, sessionId, cwd,
                new ToolFailurePayload(call.name(), call.arguments(), call.id(), error)), config.hooks());
        return new ToolResultSegment(call.id(), call.name(), error, true);
    }

    private Verdict gate(String sessionId, ToolCallSegment call, GuardrailService.Turn turn, GatewayConfig config) {
        Optional<String> violation = turn.check(call);
        if (violation.isPresent()) {
            return Verdict.block(violation.get());
        }
        Verdict verdict = config.hooks().enabled() ? applyHooks(sessionId, call, config) : Verdict.allow(call);
        if (verdict.blocked()) {
            return verdict;
        }
        if (!verdict.call().equals(call)) {
            violation = turn.check(verdict.call());
            if (violation.isPresent()) {
                return Verdict.block(violation.get());
            }
        }
        turn.record(verdict.call());
        return verdict;
    }

    private Verdict applyHooks(String sessionId, ToolCallSegment call, GatewayConfig config) {
        String cwd = config.context().projectDir();
        ToolUsePayload payload = new ToolUsePayload(call.name(), call.arguments(), call.id());
        HookResolution pre = hookEngine.dispatch(HookEvent.of(HookEventKind.PRE_TOOL_USE, sessionId, cwd, payload),
                config.hooks());
        if (pre.isBlocked()) {
            return Verdict.block(pre.getBlockReason());
        }
        ToolCallSegment effective = pre.hasUpdatedInput() ? call.withArguments(pre.getUpdatedInput()) : call;
        if (pre.getPermission() == HookPermission.ASK) {
            HookResolution permission = hookEngine.dispatch(HookEvent.of(HookEventKind.PERMISSION_REQUEST, sessionId,
                    cwd, new ToolUsePayload(effective.name(), effective.arguments(), effective.id())),
                    config.hooks());
            if (permission.isBlocked()) {
                return Verdict.block(permission.getBlockReason());
            }
            if (permission.hasUpdatedInput()) {
                effective = effective.withArguments(permission.getUpdatedInput());
            }
            // unanswered ask: the client makes the final call
        }
        return Verdict.allow(effective);
    }

    private static String blockedNote(ToolCallSegment call, String reason) {
        return "[Tool call " + call.name() + " blocked: " + reason + "]";
    }

    private record Verdict(ToolCallSegment call, String reason) {

        static Verdict allow(ToolCallSegment call) {
            return new Verdict(call, null);
        }

        static Verdict block(String reason) {
            return new Verdict(null, reason);
        }

        boolean blocked() {
            return call == null;
        }
    }
}
