package me.golemcore.gateway.adapter.inbound.web.controller;

import me.golemcore.gateway.adapter.inbound.web.GlobalExceptionHandler;
import me.golemcore.gateway.adapter.inbound.web.OpenAiChatCodec;
import me.golemcore.gateway.domain.model.CanonicalResponse;
import me.golemcore.gateway.domain.model.Message;
import me.golemcore.gateway.domain.model.StreamDelta;
import me.golemcore.gateway.domain.model.TranslationException;
import me.golemcore.gateway.domain.model.UpstreamException;
import me.golemcore.gateway.infrastructure.config.AutoConfiguration;
import me.golemcore.gateway.port.inbound.ExchangeCommand;
import me.golemcore.gateway.port.inbound.ExchangeOutcome;
import me.golemcore.gateway.port.inbound.ExchangePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ChatCompletionsControllerTest {

    private static final String SIMPLE_REQUEST = """
            {"model": "gpt-4o", "messages": [{"role": "user", "content": "Hello"}]}""";

    private ExchangePort exchangePort;
    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        exchangePort = mock(ExchangePort.class);
        OpenAiChatCodec codec = new OpenAiChatCodec(AutoConfiguration.objectMapper(), Clock.systemUTC());
        webTestClient = WebTestClient.bindToController(new ChatCompletionsController(exchangePort, codec))
                .controllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private WebTestClient.ResponseSpec post(String body) {
        return webTestClient.post()
                .uri("/v1/chat/completions")
                .header(ChatCompletionsController.SESSION_HEADER, "s1")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchange();
    }

    @Test
    void shouldReturnCompletion() {
        when(exchangePort.exchange(any())).thenReturn(new ExchangeOutcome.Completed("s1",
                CanonicalResponse.builder()
                        .id("msg_1")
                        .model("gpt-4o")
                        .message(Message.assistant("Hi there"))
                        .finishReason(CanonicalResponse.FINISH_STOP)
                        .build(),
                List.of()));

        post(SIMPLE_REQUEST)
                .expectStatus().isOk()
                .expectHeader().valueEquals(ChatCompletionsController.SESSION_HEADER, "s1")
                .expectBody()
                .jsonPath("$.object").isEqualTo("chat.completion")
                .jsonPath("$.choices[0].message.content").isEqualTo("Hi there")
                .jsonPath("$.choices[0].finish_reason").isEqualTo("stop");

        ArgumentCaptor<ExchangeCommand> captor = ArgumentCaptor.forClass(ExchangeCommand.class);
        verify(exchangePort).exchange(captor.capture());
        assertEquals("s1", captor.getValue().getSessionId());
        assertEquals("Hello", captor.getValue().getIncoming().get(0).getText());
    }

    @Test
    void shouldPassProviderHeader() {
        when(exchangePort.exchange(any())).thenReturn(new ExchangeOutcome.Blocked("s1", "x"));

        webTestClient.post()
                .uri("/v1/chat/completions")
                .header(ChatCompletionsController.PROVIDER_HEADER, "deepseek")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(SIMPLE_REQUEST)
                .exchange()
                .expectStatus().isOk();

        ArgumentCaptor<ExchangeCommand> captor = ArgumentCaptor.forClass(ExchangeCommand.class);
        verify(exchangePort).exchange(captor.capture());
        assertEquals("deepseek", captor.getValue().getProviderId());
        assertNull(captor.getValue().getSessionId());
    }

    @Test
    void shouldReturnBlockedPromptAsContentFilter() {
        when(exchangePort.exchange(any())).thenReturn(new ExchangeOutcome.Blocked("s1", "contains secrets"));

        post(SIMPLE_REQUEST)
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.choices[0].message.content").isEqualTo("[Prompt blocked: contains secrets]")
                .jsonPath("$.choices[0].finish_reason").isEqualTo("content_filter");
    }

    @Test
    void shouldStreamServerSentEvents() {
        when(exchangePort.exchangeStream(any())).thenReturn(new ExchangeOutcome.Streaming("s1", Flux.just(
                StreamDelta.text("Hel"),
                StreamDelta.text("lo"),
                StreamDelta.finish(CanonicalResponse.FINISH_STOP))));

        String body = post("""
                {"model": "gpt-4o", "stream": true, "messages": [{"role": "user", "content": "Hello"}]}""")
                .expectStatus().isOk()
                .expectHeader().contentTypeCompatibleWith(MediaType.TEXT_EVENT_STREAM)
                .expectBody(String.class)
                .returnResult()
                .getResponseBody();

        assertNotNull(body);
        assertTrue(body.contains("\"content\":\"Hel\""), body);
        assertTrue(body.contains("\"role\":\"assistant\""), body);
        assertTrue(body.contains("\"finish_reason\":\"stop\""), body);
        assertTrue(body.trim().endsWith("data:[DONE]"), body);
        verify(exchangePort, never()).exchange(any());
    }

    @Test
    void shouldStreamBlockedPrompt() {
        when(exchangePort.exchangeStream(any())).thenReturn(
                new ExchangeOutcome.Streaming("s1", Flux.just(StreamDelta.blocked("nope"))));

        String body = post("""
                {"stream": true, "messages": [{"role": "user", "content": "Hello"}]}""")
                .expectStatus().isOk()
                .expectBody(String.class)
                .returnResult()
                .getResponseBody();

        assertNotNull(body);
        assertTrue(body.contains("[Prompt blocked: nope]"), body);
        assertTrue(body.contains("content_filter"), body);
    }

    // ===== errors =====

    @Test
    void shouldMapUpstreamFailureToBadGateway() {
        when(exchangePort.exchange(any())).thenThrow(
                new UpstreamException("anthropic", 429, "{\"error\":\"rate limited\"}"));

        post(SIMPLE_REQUEST)
                .expectStatus().isEqualTo(502)
                .expectBody()
                .jsonPath("$.type").isEqualTo("upstream_error")
                .jsonPath("$.provider").isEqualTo("anthropic")
                .jsonPath("$.upstreamStatus").isEqualTo(429)
                .jsonPath("$.message").isEqualTo("{\"error\":\"rate limited\"}");
    }

    @Test
    void shouldMapTranslationFailureToBadGateway() {
        when(exchangePort.exchange(any())).thenThrow(new TranslationException("openai", "missing choices"));

        post(SIMPLE_REQUEST)
                .expectStatus().isEqualTo(502)
                .expectBody()
                .jsonPath("$.type").isEqualTo("translation_error");
    }

    @Test
    void shouldRejectRequestWithoutMessages() {
        post("{\"model\": \"gpt-4o\", \"messages\": []}")
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.status").isEqualTo(400)
                .jsonPath("$.message").isEqualTo("'messages' must be a non-empty array");
        verifyNoInteractions(exchangePort);
    }

    @Test
    void shouldMapBusySessionToConflict() {
        when(exchangePort.exchange(any())).thenThrow(new IllegalStateException("session lock busy for key s1"));

        post(SIMPLE_REQUEST)
                .expectStatus().isEqualTo(409)
                .expectBody()
                .jsonPath("$.message").isEqualTo("session lock busy for key s1");
    }
}
