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
import me.golemcore.gateway.domain.model.AssembledContext;
import me.golemcore.gateway.domain.model.AttachmentSegment;
import me.golemcore.gateway.domain.model.ContentSegment;
import me.golemcore.gateway.domain.model.CoreMemoryBlock;
import me.golemcore.gateway.domain.model.GatewayConfig;
import me.golemcore.gateway.domain.model.Message;
import me.golemcore.gateway.domain.model.RecentSession;
import me.golemcore.gateway.domain.model.Session;
import me.golemcore.gateway.port.outbound.AttachmentResolverPort;
import me.golemcore.gateway.port.outbound.MemoryPort;
import me.golemcore.gateway.port.outbound.RulesPort;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Assembles the provider message list in three tiers:
 * <ol>
 * <li>one system message: client system prompts, rule texts, core memory,
 * recent-session summaries and hook output wrapped in
 * {@code <system-reminder>} tags;</li>
 * <li>session history, oldest first (summary first when present);</li>
 * <li>the incoming messages, with their attachments resolved.</li>
 * </ol>
 *
 * <p>
 * Rules, memory and attachments are external sources. Each runs on the
 * context executor under the configured timeout; a source that fails or
 * times out contributes nothing and the exchange proceeds without it.
 */
@Service
@Slf4j
public class ContextInjector {

    static final String SOURCE_RULES = "rules";
    static final String SOURCE_CORE_MEMORY = "core_memory";
    static final String SOURCE_RECENT_SESSIONS = "recent_sessions";
    static final String SOURCE_ATTACHMENTS = "attachments";

    private final RulesPort rulesPort;
    private final MemoryPort memoryPort;
    private final AttachmentResolverPort attachmentResolver;
    private final ExecutorService contextExecutor;

    public ContextInjector(RulesPort rulesPort, MemoryPort memoryPort, AttachmentResolverPort attachmentResolver,
            @Qualifier("contextExecutor") ExecutorService contextExecutor) {
        this.rulesPort = rulesPort;
        this.memoryPort = memoryPort;
        this.attachmentResolver = attachmentResolver;
        this.contextExecutor = contextExecutor;
    }

    public AssembledContext assemble(Session session, List<Message> incoming, List<String> clientSystemPrompts,
            List<String> hookMessages, GatewayConfig config) {
        GatewayConfig.ContextSettings settings = config.context();
        Duration timeout = settings.sourceTimeout();

        List<AttachmentSegment> pending = new ArrayList<>();
        for (Message message : incoming) {
            for (AttachmentSegment attachment : message.getAttachments()) {
                if (!attachment.isResolved()) {
                    pending.add(attachment);
                }
            }
        }

        // all sources start at once; each is bounded by its own timeout
        CompletableFuture<List<String>> rules = start(() -> rulesPort.loadRules(settings.projectDir()), timeout);
        CompletableFuture<List<CoreMemoryBlock>> core = start(memoryPort::getCoreBlocks, timeout);
        CompletableFuture<List<RecentSession>> recent = start(
                () -> memoryPort.getRecentSessions(settings.recentSessionsLimit()), timeout);
        CompletableFuture<List<AttachmentSegment>> attachments = pending.isEmpty()
                ? CompletableFuture.completedFuture(List.of())
                : start(() -> attachmentResolver.resolve(pending), timeout);

        List<String> skipped = new ArrayList<>();
        List<String> ruleTexts = join(rules, SOURCE_RULES, session.getId(), skipped);
        List<CoreMemoryBlock> coreBlocks = join(core, SOURCE_CORE_MEMORY, session.getId(), skipped);
        List<RecentSession> recentSessions = join(recent, SOURCE_RECENT_SESSIONS, session.getId(), skipped);
        List<AttachmentSegment> resolved = join(attachments, SOURCE_ATTACHMENTS, session.getId(), skipped);

        List<String> systemParts = new ArrayList<>();
        if (clientSystemPrompts != null) {
            clientSystemPrompts.stream().filter(s -> s != null && !s.isBlank()).forEach(systemParts::add);
        }
        systemParts.addAll(ruleTexts);
        if (!coreBlocks.isEmpty()) {
            systemParts.add(renderCoreMemory(coreBlocks));
        }
        if (!recentSessions.isEmpty()) {
            systemParts.add(renderRecentSessions(recentSessions));
        }
        if (hookMessages != null) {
            hookMessages.stream().filter(s -> s != null && !s.isBlank())
                    .map(ContextInjector::systemReminder)
                    .forEach(systemParts::add);
        }

        List<Message> messages = new ArrayList<>();
        if (!systemParts.isEmpty()) {
            messages.add(Message.system(String.join("\n\n", systemParts)));
        }
        messages.addAll(session.getHistoryMessages());
        List<Message> resolvedIncoming = applyAttachments(incoming, resolved);
        messages.addAll(resolvedIncoming);

        log.debug("[Context] Session {}: {} system part(s), {} history message(s), {} incoming, skipped {}",
                session.getId(), systemParts.size(), session.getHistoryMessages().size(), resolvedIncoming.size(),
                skipped);
        return new AssembledContext(messages, resolvedIncoming, skipped);
    }

    private <T> CompletableFuture<List<T>> start(Supplier<List<T>> source, Duration timeout) {
        return CompletableFuture.supplyAsync(source, contextExecutor)
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private static <T> List<T> join(CompletableFuture<List<T>> future, String source, String sessionId,
            List<String> skipped) {
        try {
            List<T> value = future.join();
            return value != null ? value : List.of();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof TimeoutException) {
                log.warn("[Context] Session {}: {} timed out, skipped", sessionId, source);
            } else {
                log.warn("[Context] Session {}: {} failed, skipped: {}", sessionId, source, cause.getMessage());
            }
            future.cancel(true);
            skipped.add(source);
            return List.of();
        }
    }

    /**
     * Replaces unresolved attachment references with their resolved copies.
     * References that could not be resolved are dropped.
     */
    private static List<Message> applyAttachments(List<Message> incoming, List<AttachmentSegment> resolved) {
        List<Message> result = new ArrayList<>();
        for (Message message : incoming) {
            if (message.getAttachments().isEmpty()) {
                result.add(message);
                continue;
            }
            List<ContentSegment> segments = new ArrayList<>();
            for (ContentSegment segment : message.getContent()) {
                if (segment instanceof AttachmentSegment attachment && !attachment.isResolved()) {
                    resolved.stream()
                            .filter(r -> r.uri().equals(attachment.uri()))
                            .findFirst()
                            .ifPresent(segments::add);
                } else {
                    segments.add(segment);
                }
            }
            result.add(message.withContent(segments));
        }
        return result;
    }

    static String systemReminder(String content) {
        return "<system-reminder>\n" + content + "\n</system-reminder>";
    }

    static String renderCoreMemory(List<CoreMemoryBlock> blocks) {
        StringBuilder sb = new StringBuilder("<core_memory>\n");
        for (CoreMemoryBlock block : blocks) {
            sb.append('<').append(block.name()).append(">\n")
                    .append(block.content()).append('\n')
                    .append("</").append(block.name()).append(">\n");
        }
        return sb.append("</core_memory>").toString();
    }

    static String renderRecentSessions(List<RecentSession> sessions) {
        StringBuilder sb = new StringBuilder("<recent_sessions>\n");
        sb.append("The following sessions occurred recently. Use this context to maintain continuity:\n\n");
        for (int i = 0; i < sessions.size(); i++) {
            RecentSession session = sessions.get(i);
            sb.append("### Session ").append(i + 1);
            if (session.getEndedAt() != null) {
                sb.append(" (ended ").append(session.getEndedAt()).append(')');
            }
            sb.append('\n').append(session.getSummary()).append('\n');
            if (!session.getFilesModified().isEmpty()) {
                sb.append("Files modified: ").append(String.join(", ", session.getFilesModified())).append('\n');
            }
            if (!session.getIssuesWorked().isEmpty()) {
                sb.append("Issues worked: ").append(String.join(", ", session.getIssuesWorked())).append('\n');
            }
            sb.append('\n');
        }
        return sb.append("</recent_sessions>").toString();
    }
}
