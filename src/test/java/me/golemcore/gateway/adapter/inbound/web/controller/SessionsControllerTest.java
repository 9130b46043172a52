package me.golemcore.gateway.adapter.inbound.web.controller;

import me.golemcore.gateway.adapter.inbound.web.GlobalExceptionHandler;
import me.golemcore.gateway.adapter.inbound.web.dto.HandoffNotesRequest;
import me.golemcore.gateway.adapter.inbound.web.dto.LifecycleEventRequest;
import me.golemcore.gateway.domain.model.Message;
import me.golemcore.gateway.domain.model.Session;
import me.golemcore.gateway.domain.model.SessionStatus;
import me.golemcore.gateway.domain.model.Turn;
import me.golemcore.gateway.domain.model.hook.HookEventKind;
import me.golemcore.gateway.domain.model.hook.HookResolution;
import me.golemcore.gateway.domain.service.CompactionService;
import me.golemcore.gateway.port.inbound.ExchangePort;
import me.golemcore.gateway.port.outbound.SessionPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class SessionsControllerTest {

    private SessionPort sessionPort;
    private ExchangePort exchangePort;
    private WebTestClient webTestClient;
    private Session session;

    @BeforeEach
    void setUp() {
        sessionPort = mock(SessionPort.class);
        exchangePort = mock(ExchangePort.class);
        webTestClient = WebTestClient.bindToController(new SessionsController(sessionPort, exchangePort))
                .controllerAdvice(new GlobalExceptionHandler())
                .build();

        session = Session.builder()
                .id("s1")
                .createdAt(Instant.parse("2026-03-01T10:00:00Z"))
                .build();
        session.appendTurn(Turn.builder().message(Message.user("hello")).estimatedSize(7).build());
        when(sessionPort.get(anyString())).thenReturn(Optional.empty());
        when(sessionPort.get("s1")).thenReturn(Optional.of(session));
    }

    @Test
    void shouldListSessions() {
        when(sessionPort.listAll()).thenReturn(List.of(session));

        webTestClient.get().uri("/api/sessions")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].id").isEqualTo("s1")
                .jsonPath("$[0].turnCount").isEqualTo(1)
                .jsonPath("$[0].budgetUsed").isEqualTo(7)
                .jsonPath("$[0].status").isEqualTo("ACTIVE");
    }

    @Test
    void shouldReturnSessionDetail() {
        webTestClient.get().uri("/api/sessions/s1")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.turns[0].kind").isEqualTo("VERBATIM")
                .jsonPath("$.turns[0].messages[0].role").isEqualTo("user")
                .jsonPath("$.turns[0].messages[0].content").isEqualTo("hello")
                .jsonPath("$.createdAt").isEqualTo("2026-03-01T10:00:00Z");
    }

    @Test
    void shouldReturnNotFoundForUnknownSession() {
        webTestClient.get().uri("/api/sessions/ghost")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.message").isEqualTo("Session not found");
    }

    @Test
    void shouldUndoLastTurn() {
        when(sessionPort.undo("s1")).thenReturn(Optional.of(session.getTurns().get(0)));

        webTestClient.post().uri("/api/sessions/s1/undo")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.id").isEqualTo("s1");

        verify(sessionPort).undo("s1");
    }

    @Test
    void shouldReturnConflictWhenNothingToRedo() {
        when(sessionPort.redo("s1")).thenReturn(Optional.empty());

        webTestClient.post().uri("/api/sessions/s1/redo")
                .exchange()
                .expectStatus().isEqualTo(409)
                .expectBody()
                .jsonPath("$.message").isEqualTo("Nothing to redo in session s1");
    }

    @Test
    void shouldCompactOnDemand() {
        when(exchangePort.compact("s1")).thenReturn(CompactionService.Result.NOT_NEEDED);

        webTestClient.post().uri("/api/sessions/s1/compact")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.result").isEqualTo("NOT_NEEDED")
                .jsonPath("$.turnCount").isEqualTo(1);
    }

    @Test
    void shouldEndSession() {
        Session ended = Session.builder().id("s1").status(SessionStatus.ENDED).build();
        when(exchangePort.sessionEnd("s1", "logout")).thenReturn(ended);

        webTestClient.post().uri("/api/sessions/s1/end?reason=logout")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("ENDED");
    }

    @Test
    void shouldDeleteSession() {
        webTestClient.delete().uri("/api/sessions/s1")
                .exchange()
                .expectStatus().isNoContent();

        verify(sessionPort).delete("s1");
    }

    @Test
    void shouldNotDeleteUnknownSession() {
        webTestClient.delete().uri("/api/sessions/ghost")
                .exchange()
                .expectStatus().isNotFound();

        verify(sessionPort, never()).delete(anyString());
    }

    // ===== handoff =====

    @Test
    void shouldReturnHandoffAsMarkdown() {
        when(exchangePort.handoff("s1")).thenReturn("## Session Handoff\n\nPrevious Session: s1\n");

        webTestClient.get().uri("/api/sessions/s1/handoff")
                .exchange()
                .expectStatus().isOk()
                .expectHeader().contentTypeCompatibleWith(MediaType.TEXT_MARKDOWN)
                .expectBody(String.class).isEqualTo("## Session Handoff\n\nPrevious Session: s1\n");
    }

    @Test
    void shouldNotRenderHandoffOfUnknownSession() {
        webTestClient.get().uri("/api/sessions/ghost/handoff")
                .exchange()
                .expectStatus().isNotFound();

        verify(exchangePort, never()).handoff(anyString());
    }

    @Test
    void shouldUpdateHandoffNotes() {
        Session noted = session.copy();
        noted.setHandoffNotes("Start with the lexer.");
        when(sessionPort.updateHandoffNotes("s1", "Start with the lexer.")).thenReturn(noted);

        webTestClient.put().uri("/api/sessions/s1/handoff-notes")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new HandoffNotesRequest("Start with the lexer."))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.handoffNotes").isEqualTo("Start with the lexer.");
    }

    // ===== lifecycle events =====

    @Test
    void shouldFireNotificationHooks() {
        when(exchangePort.notify("s1", "Build finished", "info")).thenReturn(HookResolution.builder()
                .kind(HookEventKind.NOTIFICATION)
                .systemMessage("logged")
                .build());

        webTestClient.post().uri("/api/sessions/s1/events")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(LifecycleEventRequest.builder()
                        .type("notification").message("Build finished").notificationType("info").build())
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.event").isEqualTo("notification")
                .jsonPath("$.blocked").isEqualTo(false)
                .jsonPath("$.systemMessages[0]").isEqualTo("logged");
    }

    @Test
    void shouldReportBlockingSubagentStop() {
        when(exchangePort.subagentStop("s1", "a1", "reviewer", null)).thenReturn(HookResolution.builder()
                .kind(HookEventKind.SUBAGENT_STOP)
                .blocked(true)
                .blockReason("keep going")
                .build());

        webTestClient.post().uri("/api/sessions/s1/events")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(LifecycleEventRequest.builder()
                        .type("subagent_stop").agentId("a1").agentType("reviewer").build())
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.blocked").isEqualTo(true)
                .jsonPath("$.reason").isEqualTo("keep going");
    }

    @Test
    void shouldStartSessionWithDefaultSource() {
        when(exchangePort.sessionStart("new", "startup"))
                .thenReturn(HookResolution.empty(HookEventKind.SESSION_START));

        webTestClient.post().uri("/api/sessions/new/events")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(LifecycleEventRequest.builder().type("session_start").build())
                .exchange()
                .expectStatus().isOk();

        verify(exchangePort).sessionStart("new", "startup");
    }

    @Test
    void shouldRejectUnknownEventType() {
        webTestClient.post().uri("/api/sessions/s1/events")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(LifecycleEventRequest.builder().type("pre_tool_use").build())
                .exchange()
                .expectStatus().isBadRequest();
    }
}
