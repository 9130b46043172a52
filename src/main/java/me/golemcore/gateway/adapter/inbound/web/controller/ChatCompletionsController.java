package me.golemcore.gateway.adapter.inbound.web.controller;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.adapter.inbound.web.OpenAiChatCodec;
import me.golemcore.gateway.domain.model.CanonicalResponse;
import me.golemcore.gateway.domain.model.StreamDelta;
import me.golemcore.gateway.port.inbound.ExchangeCommand;
import me.golemcore.gateway.port.inbound.ExchangeOutcome;
import me.golemcore.gateway.port.inbound.ExchangePort;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * OpenAI-compatible chat completions endpoint. {@code X-Session-Id} selects
 * the gateway session; a new one is created when the header is absent and its
 * id is returned in the same header. {@code X-Provider} overrides the default
 * provider.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class ChatCompletionsController {

    static final String SESSION_HEADER = "X-Session-Id";
    static final String PROVIDER_HEADER = "X-Provider";
    private static final String DONE = "[DONE]";

    private final ExchangePort exchangePort;
    private final OpenAiChatCodec codec;

    @PostMapping(value = "/v1/chat/completions", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Object>> chatCompletions(
            @RequestBody JsonNode body,
            @RequestHeader(value = SESSION_HEADER, required = false) String sessionId,
            @RequestHeader(value = PROVIDER_HEADER, required = false) String providerId) {
        ExchangeCommand command = codec.toCommand(body, sessionId, providerId);
        if (codec.isStream(body)) {
            return Mono.fromCallable(() -> exchangePort.exchangeStream(command))
                    .subscribeOn(Schedulers.boundedElastic())
                    .map(outcome -> streamResponse(outcome, command.getModel()));
        }
        return Mono.fromCallable(() -> exchangePort.exchange(command))
                .subscribeOn(Schedulers.boundedElastic())
                .map(outcome -> jsonResponse(outcome, command.getModel()));
    }

    private ResponseEntity<Object> jsonResponse(ExchangeOutcome outcome, String model) {
        Object body;
        if (outcome instanceof ExchangeOutcome.Completed completed) {
            body = codec.toCompletion(completed.response());
        } else if (outcome instanceof ExchangeOutcome.Blocked blocked) {
            body = codec.toBlockedCompletion(blocked.reason(), model);
        } else {
            throw new IllegalStateException("Unexpected outcome " + outcome.getClass().getSimpleName());
        }
        return ResponseEntity.ok()
                .header(SESSION_HEADER, outcome.sessionId())
                .contentType(MediaType.APPLICATION_JSON)
                .body(body);
    }

    private ResponseEntity<Object> streamResponse(ExchangeOutcome outcome, String model) {
        String id = codec.newCompletionId();
        if (!(outcome instanceof ExchangeOutcome.Streaming streaming)) {
            throw new IllegalStateException("Unexpected outcome " + outcome.getClass().getSimpleName());
        }
        AtomicBoolean first = new AtomicBoolean(true);
        Flux<ServerSentEvent<String>> events = streaming.deltas()
                .concatMap(this::expandBlocked)
                .map(delta -> ServerSentEvent.builder(codec.toChunk(id, model, delta, first.getAndSet(false)))
                        .build())
                .concatWith(Mono.just(ServerSentEvent.builder(DONE).build()))
                .doOnError(e -> log.warn("[API] Stream for session {} failed: {}", outcome.sessionId(),
                        e.getMessage()));
        return ResponseEntity.ok()
                .header(SESSION_HEADER, outcome.sessionId())
                .contentType(MediaType.TEXT_EVENT_STREAM)
                .body(events);
    }

    private Flux<StreamDelta> expandBlocked(StreamDelta delta) {
        if (delta.kind() != StreamDelta.Kind.BLOCKED) {
            return Flux.just(delta);
        }
        return Flux.just(StreamDelta.text(codec.blockedText(delta.text())),
                StreamDelta.finish(CanonicalResponse.FINISH_CONTENT_FILTER));
    }
}
