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
import me.golemcore.gateway.domain.model.GatewayConfig;
import me.golemcore.gateway.domain.model.hook.HookDecision;
import me.golemcore.gateway.domain.model.hook.HookDefinition;
import me.golemcore.gateway.domain.model.hook.HookEvent;
import me.golemcore.gateway.domain.model.hook.HookExecutionException;
import me.golemcore.gateway.domain.model.hook.HookOutcome;
import me.golemcore.gateway.domain.model.hook.HookPermission;
import me.golemcore.gateway.domain.model.hook.HookResolution;
import me.golemcore.gateway.domain.system.HookMatcher;
import me.golemcore.gateway.port.outbound.HookHandler;
import me.golemcore.gateway.port.outbound.HookHandlerProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Dispatches lifecycle events to matching hook handlers and merges their
 * decisions.
 *
 * <p>
 * Dispatch runs {@code Collecting -> Running -> Merging -> Resolved}: every
 * matched handler is started at once on the hook executor, then each is joined
 * against its own deadline measured from dispatch start. A handler that misses
 * its deadline is cancelled (interrupting it, which kills a command handler's
 * process) and contributes nothing; a handler that fails non-blockingly is
 * logged and contributes nothing.
 *
 * <p>
 * Merge rules, applied in declared (configuration) order since execution
 * order is undefined:
 * <ul>
 * <li>any {@code continue=false} or {@code DENY} blocks the event; the first
 * blocker's reason is surfaced;</li>
 * <li>permission resolves to the most restrictive verdict
 * ({@code DENY > ASK > ALLOW});</li>
 * <li>the last {@code updatedInput}/{@code updatedPrompt} wins; differing
 * rewrites are logged as conflicts;</li>
 * <li>system messages are kept in declared order unless the handler asked to
 * suppress output.</li>
 * </ul>
 */
@Service
@Slf4j
public class HookEngine {

    private final HookHandlerProvider handlerProvider;
    private final HookMatcher matcher;
    private final ExecutorService hookExecutor;

    public HookEngine(HookHandlerProvider handlerProvider, HookMatcher matcher,
            @Qualifier("hookExecutor") ExecutorService hookExecutor) {
        this.handlerProvider = handlerProvider;
        this.matcher = matcher;
        this.hookExecutor = hookExecutor;
    }

    public HookResolution dispatch(HookEvent event, GatewayConfig.HookSettings settings) {
        if (settings == null || !settings.enabled()) {
            return HookResolution.empty(event.kind());
        }
        List<HookDefinition> matched = new ArrayList<>();
        for (HookDefinition definition : settings.definitions()) {
            if (definition.getEvent() == event.kind()
                    && matcher.matches(definition.getMatcher(), event.matchTarget())) {
                matched.add(definition);
            }
        }
        if (matched.isEmpty()) {
            return HookResolution.empty(event.kind());
        }
        log.debug("[Hooks] {}: {} handler(s) matched '{}'", event.kind().key(), matched.size(), event.matchTarget());

        List<HookHandler> handlers = matched.stream().map(handlerProvider::handlerFor).toList();
        long start = System.nanoTime();
        List<Future<HookDecision>> futures = new ArrayList<>();
        for (HookHandler handler : handlers) {
            futures.add(hookExecutor.submit(() -> handler.execute(event)));
        }

        HookDecision[] decisions = new HookDecision[handlers.size()];
        List<HookOutcome> outcomes = new ArrayList<>();
        for (int i = 0; i < handlers.size(); i++) {
            HookHandler handler = handlers.get(i);
            Future<HookDecision> future = futures.get(i);
            long deadline = start + handler.timeout().toNanos();
            try {
                long remaining = Math.max(0, deadline - System.nanoTime());
                decisions[i] = future.get(remaining, TimeUnit.NANOSECONDS);
                HookOutcome.Status status = decisions[i] != null && decisions[i].isBlocking()
                        ? HookOutcome.Status.BLOCKED
                        : HookOutcome.Status.SUCCEEDED;
                outcomes.add(new HookOutcome(handler.name(), status, elapsed(start), null));
            } catch (TimeoutException e) {
                future.cancel(true);
                log.warn("[Hooks] {} timed out after {} ms, ignored", handler.name(), handler.timeout().toMillis());
                outcomes.add(new HookOutcome(handler.name(), HookOutcome.Status.TIMED_OUT, elapsed(start), null));
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (cause instanceof HookExecutionException) {
                    log.warn("[Hooks] {} failed (non-blocking): {}", handler.name(), cause.getMessage());
                } else {
                    log.error("[Hooks] {} crashed (non-blocking): {}", handler.name(), cause.getMessage(), cause);
                }
                outcomes.add(new HookOutcome(handler.name(), HookOutcome.Status.FAILED, elapsed(start),
                        cause.getMessage()));
            } catch (InterruptedException e) {
                futures.forEach(f -> f.cancel(true));
                Thread.currentThread().interrupt();
                log.warn("[Hooks] Dispatch of {} interrupted, no decision applied", event.kind().key());
                // partial decisions are never merged
                return HookResolution.builder().kind(event.kind()).outcomes(outcomes).build();
            }
        }
        return merge(event, handlers, decisions, outcomes);
    }

    private HookResolution merge(HookEvent event, List<HookHandler> handlers, HookDecision[] decisions,
            List<HookOutcome> outcomes) {
        HookResolution.HookResolutionBuilder resolution = HookResolution.builder()
                .kind(event.kind())
                .outcomes(outcomes);
        boolean blocked = false;
        String blockReason = null;
        HookPermission permission = null;
        Map<String, Object> updatedInput = null;
        String updatedInputBy = null;
        String updatedPrompt = null;

        for (int i = 0; i < decisions.length; i++) {
            HookDecision decision = decisions[i];
            if (decision == null) {
                continue;
            }
            String name = handlers.get(i).name();
            if (decision.isBlocking()) {
                if (!blocked) {
                    blockReason = decision.getReason() != null ? decision.getReason() : "Blocked by hook " + name;
                }
                blocked = true;
            }
            if (decision.getPermission() != null) {
                permission = decision.getPermission().mostRestrictive(permission);
            }
            if (decision.getUpdatedInput() != null) {
                if (updatedInput != null && !Objects.equals(updatedInput, decision.getUpdatedInput())) {
                    log.warn("[Hooks] Conflicting input rewrites for {}: {} overrides {}",
                            event.kind().key(), name, updatedInputBy);
                }
                updatedInput = decision.getUpdatedInput();
                updatedInputBy = name;
            }
            if (decision.getUpdatedPrompt() != null) {
                updatedPrompt = decision.getUpdatedPrompt();
            }
            if (decision.getSystemMessage() != null && !decision.isSuppressOutput()) {
                resolution.systemMessage(decision.getSystemMessage());
            }
        }

        if (blocked) {
            log.info("[Hooks] {} blocked: {}", event.kind().key(), blockReason);
        }
        return resolution
                .blocked(blocked)
                .blockReason(blockReason)
                .permission(permission)
                .updatedInput(updatedInput)
                .updatedPrompt(updatedPrompt)
                .build();
    }

    private static Duration elapsed(long start) {
        return Duration.ofNanos(System.nanoTime() - start);
    }
}
