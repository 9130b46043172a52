package me.golemcore.gateway.domain.service;

import me.golemcore.gateway.domain.model.CanonicalRequest;
import me.golemcore.gateway.domain.model.CanonicalResponse;
import me.golemcore.gateway.domain.model.GatewayConfig;
import me.golemcore.gateway.domain.model.GatewayException;
import me.golemcore.gateway.domain.model.Message;
import me.golemcore.gateway.domain.model.Session;
import me.golemcore.gateway.domain.model.SessionStatus;
import me.golemcore.gateway.domain.model.Turn;
import me.golemcore.gateway.domain.model.UpstreamException;
import me.golemcore.gateway.domain.model.hook.HookEvent;
import me.golemcore.gateway.domain.model.hook.HookEventKind;
import me.golemcore.gateway.domain.model.hook.HookResolution;
import me.golemcore.gateway.domain.model.hook.PreCompactPayload;
import me.golemcore.gateway.domain.system.SizeEstimator;
import me.golemcore.gateway.port.outbound.LlmPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class CompactionServiceTest {

    private static final String SUMMARY = """
            ## 1. Primary Request and Intent
            Build the parser.
            ## 4. Errors and Fixes
            None.
            ## 8. Current Work
            Writing tests for Parser.java.
            """;

    private LlmPort llmPort;
    private HookEngine hookEngine;
    private SessionService sessionService;
    private CompactionService service;

    @BeforeEach
    void setUp() {
        llmPort = mock(LlmPort.class);
        hookEngine = mock(HookEngine.class);
        sessionService = mock(SessionService.class);
        when(hookEngine.dispatch(any(), any())).thenAnswer(inv -> {
            HookEvent event = inv.getArgument(0);
            return HookResolution.empty(event != null ? event.kind() : null);
        });
        Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
        service = new CompactionService(llmPort, hookEngine, sessionService, new SizeEstimator(4.0, 0), clock);
    }

    private static GatewayConfig config(boolean enabled, int preserveRecentTurns) {
        GatewayConfig.CompactionSettings compaction = new GatewayConfig.CompactionSettings(
                enabled, 1.0, 1000, Map.of("small-model", 1000), preserveRecentTurns,
                Duration.ofSeconds(2), 1024, null);
        return new GatewayConfig("openai", "small-model", 50, compaction,
                new GatewayConfig.ContextSettings(Duration.ofSeconds(1), 5, "/work"),
                GatewayConfig.HookSettings.disabled());
    }

    private static Session sessionWithTurns(int count, int size) {
        Session session = Session.builder().id("s1").build();
        for (int i = 0; i < count; i++) {
            session.appendTurn(Turn.builder().message(Message.user("turn " + i)).estimatedSize(size).build());
        }
        return session;
    }

    private Session savedSession() {
        ArgumentCaptor<Session> captor = ArgumentCaptor.forClass(Session.class);
        verify(sessionService, atLeastOnce()).save(captor.capture());
        List<Session> saved = captor.getAllValues();
        return saved.get(saved.size() - 1);
    }

    private void answerWith(String text) {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(CanonicalResponse.builder()
                .message(Message.assistant(text))
                .finishReason(CanonicalResponse.FINISH_STOP)
                .build()));
    }

    // ===== threshold =====

    @Test
    void shouldNotCompactBelowThreshold() {
        Session session = sessionWithTurns(3, 200);

        CompactionService.Result result = service.compactIfNeeded(session, 400, "small-model", "openai",
                config(true, 0));

        assertEquals(CompactionService.Result.NOT_NEEDED, result);
        verifyNoInteractions(llmPort);
        assertEquals(600, session.getBudgetUsed());
    }

    @Test
    void shouldNotCompactWhenDisabled() {
        Session session = sessionWithTurns(3, 200);

        assertEquals(CompactionService.Result.NOT_NEEDED,
                service.compactIfNeeded(session, 5000, "small-model", "openai", config(false, 0)));
    }

    @Test
    void shouldReplaceHistoryWithSummaryWhenIncomingCrossesThreshold() {
        Session session = sessionWithTurns(3, 200);
        answerWith(SUMMARY);

        CompactionService.Result result = service.compactIfNeeded(session, 500, "small-model", "openai",
                config(true, 0));

        assertEquals(CompactionService.Result.COMPACTED, result);
        Session compacted = savedSession();
        assertEquals(1, compacted.getTurns().size());
        Turn summary = compacted.getTurns().get(0);
        assertTrue(summary.isSummary());
        String text = summary.getMessages().get(0).getText();
        assertTrue(text.startsWith("[Conversation summary]\n## 1. Primary Request and Intent\nBuild the parser."));
        assertTrue(text.contains("## 9. Optional Next Step\nNone."));
        assertEquals(summary.getEstimatedSize(), compacted.getBudgetUsed());
        assertTrue(compacted.getBudgetUsed() + 500 <= 1000);
        assertEquals(1, compacted.getCompactionCount());
        assertEquals(SessionStatus.ACTIVE, compacted.getStatus());
        assertEquals(3, session.getTurns().size());
        verify(sessionService).recordEvent(eq("s1"), eq("compaction"), any());
    }

    @Test
    void shouldSendConversationToSummarizer() {
        Session session = sessionWithTurns(2, 200);
        answerWith(SUMMARY);

        service.compactNow(session, "small-model", "openai", config(true, 0));

        ArgumentCaptor<CanonicalRequest> captor = ArgumentCaptor.forClass(CanonicalRequest.class);
        verify(llmPort).chat(captor.capture());
        CanonicalRequest request = captor.getValue();
        assertEquals("openai", request.getProviderId());
        assertEquals(1024, request.getMaxTokens());
        String conversation = request.getMessages().get(1).getText();
        assertTrue(conversation.contains("user: turn 0"));
        assertTrue(conversation.contains("user: turn 1"));
    }

    @Test
    void shouldPreserveRecentTurnsAndFoldPreviousSummary() {
        Session session = sessionWithTurns(3, 200);
        answerWith(SUMMARY);
        service.compactNow(session, "small-model", "openai", config(true, 1));
        Session once = savedSession().copy();
        once.appendTurn(Turn.builder().message(Message.user("turn 3")).estimatedSize(200).build());
        once.appendTurn(Turn.builder().message(Message.user("turn 4")).estimatedSize(200).build());

        CompactionService.Result result = service.compactNow(once, "small-model", "openai", config(true, 1));

        assertEquals(CompactionService.Result.COMPACTED, result);
        Session twice = savedSession();
        assertEquals(2, twice.getTurns().size());
        assertTrue(twice.getTurns().get(0).isSummary());
        assertEquals("turn 4", twice.getTurns().get(1).getMessages().get(0).getText());
        assertEquals(2, twice.getCompactionCount());
    }

    // ===== deferral =====

    @Test
    void shouldDeferWhenSummarizerFails() {
        Session session = sessionWithTurns(3, 200);
        when(llmPort.chat(any())).thenReturn(CompletableFuture.failedFuture(
                new UpstreamException("openai", 500, "boom")));

        CompactionService.Result result = service.compactIfNeeded(session, 500, "small-model", "openai",
                config(true, 0));

        assertEquals(CompactionService.Result.DEFERRED, result);
        assertEquals(3, session.getTurns().size());
        assertEquals(600, session.getBudgetUsed());
        assertEquals(SessionStatus.ACTIVE, session.getStatus());
        verify(sessionService, never()).save(any());
        verify(sessionService).publish(session);
    }

    @Test
    void shouldPublishCompactingStatusAndRestoreItOnUnexpectedFailure() {
        Session session = sessionWithTurns(3, 200);
        when(llmPort.chat(any())).thenThrow(new IllegalStateException("adapter bug"));

        assertThrows(IllegalStateException.class,
                () -> service.compactNow(session, "small-model", "openai", config(true, 0)));

        InOrder order = inOrder(sessionService);
        order.verify(sessionService).publish(argThat(s -> s != null && s.getStatus() == SessionStatus.COMPACTING));
        order.verify(sessionService).publish(session);
        assertEquals(SessionStatus.ACTIVE, session.getStatus());
    }

    @Test
    void shouldKeepPreviousSnapshotWhenPersistFails() {
        Session session = sessionWithTurns(3, 200);
        answerWith(SUMMARY);
        doThrow(new GatewayException("disk full")).when(sessionService).save(any());

        assertThrows(GatewayException.class,
                () -> service.compactNow(session, "small-model", "openai", config(true, 0)));

        verify(sessionService).publish(session);
        assertEquals(3, session.getTurns().size());
        assertEquals(0, session.getCompactionCount());
        verify(sessionService, never()).recordEvent(anyString(), eq("compaction"), any());
    }

    @Test
    void shouldDeferWhenSummaryHasNoSections() {
        Session session = sessionWithTurns(3, 200);
        answerWith("Sorry, I cannot help with that.");

        assertEquals(CompactionService.Result.DEFERRED,
                service.compactNow(session, "small-model", "openai", config(true, 0)));
        assertEquals(3, session.getTurns().size());
    }

    @Test
    void shouldDeferWhenSummarizerTimesOut() {
        Session session = sessionWithTurns(3, 200);
        CompletableFuture<CanonicalResponse> pending = new CompletableFuture<>();
        when(llmPort.chat(any())).thenReturn(pending);

        assertEquals(CompactionService.Result.DEFERRED,
                service.compactNow(session, "small-model", "openai", config(true, 0)));
        assertTrue(pending.isCancelled());
    }

    @Test
    void shouldDeferWhenPreCompactHookBlocks() {
        Session session = sessionWithTurns(3, 200);
        when(hookEngine.dispatch(any(), any())).thenReturn(HookResolution.builder()
                .kind(HookEventKind.PRE_COMPACT)
                .blocked(true)
                .blockReason("not now")
                .build());

        assertEquals(CompactionService.Result.DEFERRED,
                service.compactIfNeeded(session, 500, "small-model", "openai", config(true, 0)));
        verifyNoInteractions(llmPort);
    }

    @Test
    void shouldPassBudgetToPreCompactHook() {
        Session session = sessionWithTurns(3, 200);
        answerWith(SUMMARY);

        service.compactIfNeeded(session, 500, "small-model", "openai", config(true, 0));

        ArgumentCaptor<HookEvent> captor = ArgumentCaptor.forClass(HookEvent.class);
        verify(hookEngine).dispatch(captor.capture(), any());
        PreCompactPayload payload = (PreCompactPayload) captor.getValue().payload();
        assertEquals("auto", payload.trigger());
        assertEquals(600, payload.budgetUsed());
        assertEquals(1000, payload.threshold());
        assertEquals(3, payload.turnCount());
    }

    @Test
    void shouldDeferWhenNothingToCompact() {
        Session session = sessionWithTurns(1, 900);

        assertEquals(CompactionService.Result.DEFERRED,
                service.compactIfNeeded(session, 500, "small-model", "openai", config(true, 1)));
        verify(hookEngine, never()).dispatch(any(), any());
        verify(sessionService, never()).recordEvent(anyString(), anyString(), any());
    }
}
