package me.golemcore.gateway.adapter.outbound.hook;

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
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.CanonicalRequest;
import me.golemcore.gateway.domain.model.CanonicalResponse;
import me.golemcore.gateway.domain.model.Message;
import me.golemcore.gateway.domain.model.hook.HookDecision;
import me.golemcore.gateway.domain.model.hook.HookDefinition;
import me.golemcore.gateway.domain.model.hook.HookEvent;
import me.golemcore.gateway.domain.model.hook.HookExecutionException;
import me.golemcore.gateway.domain.model.hook.HookTimeoutException;
import me.golemcore.gateway.port.outbound.HookHandler;
import me.golemcore.gateway.port.outbound.LlmPort;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Hook handler that asks a model to judge the event.
 *
 * <p>
 * The configured prompt has {@code $ARGUMENTS} replaced by the event JSON (or
 * the JSON appended when the placeholder is absent). The model must answer
 * with {@code {"ok": true|false, "reason": "..."}}; {@code ok=false} blocks.
 * Full decision objects ({@code decision}, {@code systemMessage}, ...) are
 * accepted too.
 */
@Slf4j
public class PromptHookHandler implements HookHandler {

    static final String ARGUMENTS_PLACEHOLDER = "$ARGUMENTS";

    private static final String SYSTEM_INSTRUCTION = """
            You are evaluating a hook in an AI coding session.
            Reply with a single JSON object and nothing else:
            {"ok": true} to let the action proceed, or
            {"ok": false, "reason": "<why it must stop>"} to block it.""";
    private static final int MAX_ANSWER_TOKENS = 512;

    private final HookDefinition definition;
    private final LlmPort llmPort;
    private final HookEventEncoder encoder;
    private final HookOutputParser parser;
    private final ObjectMapper objectMapper;
    private final String defaultModel;

    public PromptHookHandler(HookDefinition definition, LlmPort llmPort, HookEventEncoder encoder,
            HookOutputParser parser, ObjectMapper objectMapper, String defaultModel) {
        this.definition = definition;
        this.llmPort = llmPort;
        this.encoder = encoder;
        this.parser = parser;
        this.objectMapper = objectMapper;
        this.defaultModel = defaultModel;
    }

    @Override
    public String name() {
        return definition.describe();
    }

    @Override
    public Duration timeout() {
        return definition.getTimeout();
    }

    @Override
    public HookDecision execute(HookEvent event) throws HookExecutionException, InterruptedException {
        CanonicalRequest request = CanonicalRequest.builder()
                .model(definition.getModel() != null ? definition.getModel() : defaultModel)
                .messages(List.of(
                        Message.system(SYSTEM_INSTRUCTION),
                        Message.user(renderPrompt(event))))
                .temperature(0.0)
                .maxTokens(MAX_ANSWER_TOKENS)
                .sessionId(event.sessionId())
                .build();

        CompletableFuture<CanonicalResponse> call = llmPort.chat(request);
        CanonicalResponse response;
        try {
            response = call.get(timeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            throw new HookTimeoutException(name(), timeout());
        } catch (InterruptedException e) {
            call.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new HookExecutionException("Prompt hook model call failed: " + cause.getMessage(), cause);
        }

        String answer = response.getMessage() != null ? response.getMessage().getText() : null;
        return interpret(answer);
    }

    String renderPrompt(HookEvent event) {
        String json = encoder.toJson(event);
        String template = definition.getPrompt() != null ? definition.getPrompt() : "";
        if (template.contains(ARGUMENTS_PLACEHOLDER)) {
            return template.replace(ARGUMENTS_PLACEHOLDER, json);
        }
        return template.isBlank() ? json : template + "\n\n" + json;
    }

    HookDecision interpret(String answer) throws HookExecutionException {
        String json = extractJsonObject(answer);
        if (json == null) {
            throw new HookExecutionException("Prompt hook answer is not JSON: " + abbreviate(answer));
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new HookExecutionException("Prompt hook answer is not JSON: " + abbreviate(answer), e);
        }
        if (root.has("ok")) {
            if (root.get("ok").asBoolean(true)) {
                return HookDecision.proceed();
            }
            String reason = root.path("reason").asText("");
            return HookDecision.block(reason.isBlank() ? "Rejected by prompt hook" : reason);
        }
        if (root.has("decision") || root.has("continue") || root.has("hookSpecificOutput")) {
            return parser.fromNode(root);
        }
        throw new HookExecutionException("Prompt hook answer has no decision: " + abbreviate(answer));
    }

    /**
     * First balanced {@code {...}} in {@code text}, tolerating code fences and
     * surrounding prose.
     */
    static String extractJsonObject(String text) {
        if (text == null) {
            return null;
        }
        int start = text.indexOf('{');
        while (start >= 0) {
            int depth = 0;
            boolean inString = false;
            for (int i = start; i < text.length(); i++) {
                char c = text.charAt(i);
                if (inString) {
                    if (c == '\\') {
                        i++;
                    } else if (c == '"') {
                        inString = false;
                    }
                } else if (c == '"') {
                    inString = true;
                } else if (c == '{') {
                    depth++;
                } else if (c == '}') {
                    depth--;
                    if (depth == 0) {
                        return text.substring(start, i + 1);
                    }
                }
            }
            start = text.indexOf('{', start + 1);
        }
        return null;
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "<empty>";
        }
        return text.length() > 200 ? text.substring(0, 200) + "..." : text;
    }
}
