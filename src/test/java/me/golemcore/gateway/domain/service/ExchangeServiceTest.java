package me.golemcore.gateway.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.gateway.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.gateway.domain.model.CanonicalRequest;
import me.golemcore.gateway.domain.model.CanonicalResponse;
import me.golemcore.gateway.domain.model.GatewayConfig;
import me.golemcore.gateway.domain.model.Message;
import me.golemcore.gateway.domain.model.ReasoningSegment;
import me.golemcore.gateway.domain.model.RecentSession;
import me.golemcore.gateway.domain.model.Role;
import me.golemcore.gateway.domain.model.Session;
import me.golemcore.gateway.domain.model.SessionStatus;
import me.golemcore.gateway.domain.model.StreamDelta;
import me.golemcore.gateway.domain.model.TextSegment;
import me.golemcore.gateway.domain.model.TokenUsage;
import me.golemcore.gateway.domain.model.ToolCallSegment;
import me.golemcore.gateway.domain.model.UpstreamException;
import me.golemcore.gateway.domain.model.guardrail.GuardrailAction;
import me.golemcore.gateway.domain.model.hook.HookEvent;
import me.golemcore.gateway.domain.model.hook.HookEventKind;
import me.golemcore.gateway.domain.model.hook.HookResolution;
import me.golemcore.gateway.domain.model.hook.StopPayload;
import me.golemcore.gateway.domain.system.SizeEstimator;
import me.golemcore.gateway.infrastructure.config.AutoConfiguration;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.inbound.ExchangeCommand;
import me.golemcore.gateway.port.inbound.ExchangeOutcome;
import me.golemcore.gateway.port.outbound.AttachmentResolverPort;
import me.golemcore.gateway.port.outbound.LlmPort;
import me.golemcore.gateway.port.outbound.MemoryPort;
import me.golemcore.gateway.port.outbound.QualityGatePort;
import me.golemcore.gateway.port.outbound.RulesPort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ExchangeServiceTest {

    @TempDir
    Path workspace;

    private final Map<HookEventKind, HookResolution> hookAnswers = new EnumMap<>(HookEventKind.class);
    private final List<HookEvent> firedEvents = new ArrayList<>();

    private SessionService sessionService;
    private HookEngine hookEngine;
    private CompactionService compactionService;
    private LlmPort llmPort;
    private MemoryPort memoryPort;
    private ExecutorService contextExecutor;
    private GuardrailService guardrailService;
    private ExchangeService service;

    @BeforeEach
    void setUp() {
        GatewayProperties properties = new GatewayProperties();
        properties.getStorage().setBasePath(workspace.toString());
        properties.getSession().setLockTimeoutMs(2000);
        ObjectMapper objectMapper = AutoConfiguration.objectMapper();
        Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();
        sessionService = new SessionService(storage, objectMapper, clock, properties);

        hookEngine = mock(HookEngine.class);
        when(hookEngine.dispatch(any(), any())).thenAnswer(inv -> {
            HookEvent event = inv.getArgument(0);
            firedEvents.add(event);
            return hookAnswers.getOrDefault(event.kind(), HookResolution.empty(event.kind()));
        });
        compactionService = mock(CompactionService.class);
        llmPort = mock(LlmPort.class);
        memoryPort = mock(MemoryPort.class);
        RulesPort rulesPort = mock(RulesPort.class);
        contextExecutor = Executors.newCachedThreadPool();
        ContextInjector contextInjector = new ContextInjector(rulesPort, memoryPort,
                mock(AttachmentResolverPort.class), contextExecutor);

        GatewayConfig.CompactionSettings compaction = new GatewayConfig.CompactionSettings(
                true, 0.85, 128000, Map.of(), 0, Duration.ofSeconds(30), 1024, null);
        GatewayConfig config = new GatewayConfig("anthropic", "claude-test", 50, compaction,
                new GatewayConfig.ContextSettings(Duration.ofSeconds(2), 5, workspace.toString()),
                GatewayConfig.HookSettings.disabled());
        ConfigSnapshotHolder configHolder = new ConfigSnapshotHolder(() -> config);
        guardrailService = new GuardrailService(mock(QualityGatePort.class));

        service = new ExchangeService(configHolder, sessionService, hookEngine, compactionService, contextInjector,
                new ToolUseGate(hookEngine, guardrailService), guardrailService, llmPort, memoryPort,
                new SizeEstimator(4.0, 0), objectMapper, properties, clock);
    }

    @AfterEach
    void tearDown() {
        contextExecutor.shutdownNow();
    }

    private static ExchangeCommand command(String sessionId, String prompt) {
        return ExchangeCommand.builder().sessionId(sessionId).incomingMessage(Message.user(prompt)).build();
    }

    private static CanonicalResponse reply(String text) {
        return CanonicalResponse.builder()
                .id("resp_1")
                .model("claude-test")
                .message(Message.assistant(text))
                .finishReason(CanonicalResponse.FINISH_STOP)
                .usage(TokenUsage.of(12, 3))
                .build();
    }

    private List<HookEventKind> firedKinds() {
        return firedEvents.stream().map(HookEvent::kind).toList();
    }

    // ===== non-streaming =====

    @Test
    void shouldAppendExchangeAsSingleTurn() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(reply("Hello back")));

        ExchangeOutcome outcome = service.exchange(command("s1", "Hello"));

        ExchangeOutcome.Completed completed = assertInstanceOf(ExchangeOutcome.Completed.class, outcome);
        assertEquals("Hello back", completed.response().getMessage().getText());
        Session session = sessionService.get("s1").orElseThrow();
        assertEquals(1, session.getTurns().size());
        List<Message> messages = session.getTurns().get(0).getMessages();
        assertEquals(List.of(Role.USER, Role.ASSISTANT), messages.stream().map(Message::getRole).toList());
        assertEquals("Hello back", messages.get(1).getText());
        assertEquals(15, session.getUsage().getTotalTokens());
        assertEquals(List.of(HookEventKind.SESSION_START, HookEventKind.USER_PROMPT_SUBMIT, HookEventKind.STOP),
                firedKinds());
    }

    @Test
    void shouldSendHistoryOnNextExchange() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(reply("first answer")));
        service.exchange(command("s1", "first"));

        service.exchange(command("s1", "second"));

        ArgumentCaptor<CanonicalRequest> captor = ArgumentCaptor.forClass(CanonicalRequest.class);
        verify(llmPort, times(2)).chat(captor.capture());
        CanonicalRequest request = captor.getAllValues().get(1);
        assertEquals(List.of("first", "first answer", "second"),
                request.getMessages().stream().map(Message::getText).toList());
        assertEquals("anthropic", request.getProviderId());
        assertEquals("claude-test", request.getModel());
        assertEquals(1, firedKinds().stream().filter(k -> k == HookEventKind.SESSION_START).count());
    }

    @Test
    void shouldUndoAndRedoWholeExchange() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(reply("answer")));
        service.exchange(command("s1", "question"));

        sessionService.undo("s1");

        assertTrue(sessionService.get("s1").orElseThrow().getTurns().isEmpty());

        sessionService.redo("s1");

        List<Message> restored = sessionService.get("s1").orElseThrow().getTurns().get(0).getMessages();
        assertEquals(List.of("question", "answer"), restored.stream().map(Message::getText).toList());
    }

    @Test
    void shouldNotCallUpstreamWhenPromptBlocked() {
        hookAnswers.put(HookEventKind.USER_PROMPT_SUBMIT, HookResolution.builder()
                .kind(HookEventKind.USER_PROMPT_SUBMIT).blocked(true).blockReason("secrets in prompt").build());

        ExchangeOutcome outcome = service.exchange(command("s1", "my password is hunter2"));

        ExchangeOutcome.Blocked blocked = assertInstanceOf(ExchangeOutcome.Blocked.class, outcome);
        assertEquals("secrets in prompt", blocked.reason());
        verify(llmPort, never()).chat(any());
        assertTrue(sessionService.get("s1").orElseThrow().getTurns().isEmpty());
    }

    @Test
    void shouldSendRewrittenPromptAndHookContext() {
        hookAnswers.put(HookEventKind.SESSION_START, HookResolution.builder()
                .kind(HookEventKind.SESSION_START).systemMessage("branch is main").build());
        hookAnswers.put(HookEventKind.USER_PROMPT_SUBMIT, HookResolution.builder()
                .kind(HookEventKind.USER_PROMPT_SUBMIT).updatedPrompt("rewritten prompt").build());
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(reply("ok")));

        service.exchange(command("s1", "original prompt"));

        ArgumentCaptor<CanonicalRequest> captor = ArgumentCaptor.forClass(CanonicalRequest.class);
        verify(llmPort).chat(captor.capture());
        List<Message> messages = captor.getValue().getMessages();
        assertEquals(Role.SYSTEM, messages.get(0).getRole());
        assertTrue(messages.get(0).getText().contains("<system-reminder>\nbranch is main\n</system-reminder>"));
        assertEquals("rewritten prompt", messages.get(messages.size() - 1).getText());
        assertEquals("rewritten prompt",
                sessionService.get("s1").orElseThrow().getTurns().get(0).getMessages().get(0).getText());
    }

    @Test
    void shouldAppendNothingWhenUpstreamFails() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.failedFuture(
                new UpstreamException("anthropic", 503, "{\"error\":\"unavailable\"}")));

        UpstreamException ex = assertThrows(UpstreamException.class, () -> service.exchange(command("s1", "hi")));

        assertEquals(503, ex.getStatus());
        assertTrue(sessionService.get("s1").orElseThrow().getTurns().isEmpty());
        HookEvent stop = firedEvents.get(firedEvents.size() - 1);
        assertEquals(HookEventKind.STOP, stop.kind());
        assertNotNull(((StopPayload) stop.payload()).failureReason());
    }

    @Test
    void shouldRejectEmptyIncoming() {
        ExchangeCommand empty = ExchangeCommand.builder().sessionId("s1").build();

        assertThrows(IllegalArgumentException.class, () -> service.exchange(empty));
    }

    @Test
    void shouldRejectEndedSession() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(reply("ok")));
        service.exchange(command("s1", "hi"));
        service.sessionEnd("s1", "logout");

        assertThrows(IllegalStateException.class, () -> service.exchange(command("s1", "again")));
    }

    @Test
    void shouldRunCompactionCheckBeforeUpstreamCall() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(reply("ok")));

        service.exchange(command("s1", "hello"));

        InOrder order = inOrder(compactionService, llmPort);
        order.verify(compactionService).compactIfNeeded(any(), anyInt(), eq("claude-test"), eq("anthropic"), any());
        order.verify(llmPort).chat(any());
    }

    // ===== streaming =====

    @Test
    void shouldStreamTextLiveAndHoldToolCallsUntilEnd() {
        when(llmPort.chatStream(any())).thenReturn(Flux.just(
                StreamDelta.text("Hel"),
                StreamDelta.text("lo"),
                StreamDelta.toolCall(0, "call_1", "Read", "{\"path\":"),
                StreamDelta.toolCall(0, null, null, "\"a.txt\"}"),
                StreamDelta.finish(CanonicalResponse.FINISH_TOOL_CALLS)));

        ExchangeOutcome.Streaming streaming = assertInstanceOf(ExchangeOutcome.Streaming.class,
                service.exchangeStream(command("s1", "read it")));

        StepVerifier.create(streaming.deltas())
                .expectNext(StreamDelta.text("Hel"))
                .expectNext(StreamDelta.text("lo"))
                .expectNext(StreamDelta.toolCall(0, "call_1", "Read", "{\"path\":\"a.txt\"}"))
                .expectNext(StreamDelta.finish(CanonicalResponse.FINISH_TOOL_CALLS))
                .verifyComplete();

        Session session = sessionService.get("s1").orElseThrow();
        assertEquals(1, session.getTurns().size());
        Message assistant = session.getTurns().get(0).getMessages().get(1);
        assertEquals("Hello", assistant.getText());
        assertEquals(List.of(new ToolCallSegment("call_1", "Read", Map.of("path", "a.txt"))),
                assistant.getToolCalls());
    }

    @Test
    void shouldAppendIncompleteStream() {
        when(llmPort.chatStream(any())).thenReturn(Flux.just(StreamDelta.text("partial")));

        ExchangeOutcome.Streaming streaming = (ExchangeOutcome.Streaming) service
                .exchangeStream(command("s1", "go"));

        StepVerifier.create(streaming.deltas())
                .expectNext(StreamDelta.text("partial"))
                .expectNext(StreamDelta.finish(CanonicalResponse.FINISH_INCOMPLETE))
                .verifyComplete();
        Message assistant = sessionService.get("s1").orElseThrow().getTurns().get(0).getMessages().get(1);
        assertEquals(List.of(new TextSegment("partial")), assistant.getContent());
    }

    @Test
    void shouldKeepStreamedSignatureAndIdentity() {
        when(llmPort.chatStream(any())).thenReturn(Flux.just(
                StreamDelta.meta("msg_9", "claude-test"),
                StreamDelta.reasoning("thinking it over"),
                StreamDelta.signature("SIG"),
                StreamDelta.text("Done"),
                StreamDelta.finish(CanonicalResponse.FINISH_STOP)));

        ExchangeOutcome.Streaming streaming = (ExchangeOutcome.Streaming) service
                .exchangeStream(command("s1", "think"));

        StepVerifier.create(streaming.deltas())
                .expectNext(StreamDelta.reasoning("thinking it over"))
                .expectNext(StreamDelta.text("Done"))
                .expectNext(StreamDelta.finish(CanonicalResponse.FINISH_STOP))
                .verifyComplete();
        Message assistant = sessionService.get("s1").orElseThrow().getTurns().get(0).getMessages().get(1);
        assertEquals(new ReasoningSegment("thinking it over", "SIG"), assistant.getReasoning().get(0));
    }

    @Test
    void shouldEmitBlockedDeltaForRefusedStreamingPrompt() {
        hookAnswers.put(HookEventKind.USER_PROMPT_SUBMIT, HookResolution.builder()
                .kind(HookEventKind.USER_PROMPT_SUBMIT).blocked(true).blockReason("no").build());

        ExchangeOutcome.Streaming streaming = (ExchangeOutcome.Streaming) service
                .exchangeStream(command("s1", "forbidden"));

        StepVerifier.create(streaming.deltas())
                .expectNext(StreamDelta.blocked("no"))
                .verifyComplete();
        verify(llmPort, never()).chatStream(any());
        assertFalse(sessionService.getLocks().isLocked("s1"));
    }

    @Test
    void shouldNotLockSessionUntilStreamIsSubscribed() {
        when(llmPort.chatStream(any())).thenReturn(Flux.just(StreamDelta.text("x"),
                StreamDelta.finish(CanonicalResponse.FINISH_STOP)));
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(reply("ok")));

        ExchangeOutcome.Streaming abandoned = (ExchangeOutcome.Streaming) service
                .exchangeStream(command("s1", "never read"));

        assertFalse(sessionService.getLocks().isLocked("s1"));
        assertInstanceOf(ExchangeOutcome.Completed.class, service.exchange(command("s1", "next")));
        verify(llmPort, never()).chatStream(any());
        assertNotNull(abandoned.deltas());
    }

    @Test
    void shouldRejectStreamForEndedSessionBeforeSubscription() {
        sessionService.getOrCreate("s1");
        service.sessionEnd("s1", "logout");

        assertThrows(IllegalStateException.class, () -> service.exchangeStream(command("s1", "again")));
    }

    @Test
    void shouldAppendNothingWhenStreamFails() {
        when(llmPort.chatStream(any())).thenReturn(Flux.just(StreamDelta.text("par"))
                .concatWith(Flux.error(new UpstreamException("anthropic", 500, "boom"))));

        ExchangeOutcome.Streaming streaming = (ExchangeOutcome.Streaming) service
                .exchangeStream(command("s1", "go"));

        StepVerifier.create(streaming.deltas())
                .expectNext(StreamDelta.text("par"))
                .verifyError(UpstreamException.class);
        assertTrue(sessionService.get("s1").orElseThrow().getTurns().isEmpty());
    }

    @Test
    void shouldReleaseSessionAfterCancelledStream() {
        when(llmPort.chatStream(any())).thenReturn(Flux.just(StreamDelta.text("a"), StreamDelta.text("b"))
                .concatWith(Flux.never()));
        ExchangeOutcome.Streaming streaming = (ExchangeOutcome.Streaming) service
                .exchangeStream(command("s1", "go"));

        StepVerifier.create(streaming.deltas())
                .expectNext(StreamDelta.text("a"), StreamDelta.text("b"))
                .thenCancel()
                .verify(Duration.ofSeconds(5));

        assertTrue(sessionService.get("s1").orElseThrow().getTurns().isEmpty());
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(reply("ok")));
        assertInstanceOf(ExchangeOutcome.Completed.class, service.exchange(command("s1", "next")));
    }

    // ===== lifecycle =====

    @Test
    void shouldEndSessionAndSaveRecentSummary() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(reply("done")));
        when(memoryPort.getFilesModified("s1")).thenReturn(List.of("Parser.java"));
        service.exchange(command("s1", "fix the parser"));

        Session ended = service.sessionEnd("s1", "clear");

        assertEquals(SessionStatus.ENDED, ended.getStatus());
        ArgumentCaptor<RecentSession> captor = ArgumentCaptor.forClass(RecentSession.class);
        verify(memoryPort).saveRecentSession(captor.capture());
        assertEquals("s1", captor.getValue().getSessionId());
        assertEquals(List.of("Parser.java"), captor.getValue().getFilesModified());
        assertTrue(firedKinds().contains(HookEventKind.SESSION_END));
    }

    @Test
    void shouldNotEndSessionTwice() {
        sessionService.getOrCreate("s1");
        service.sessionEnd("s1", "clear");

        service.sessionEnd("s1", "clear");

        assertEquals(1, firedKinds().stream().filter(k -> k == HookEventKind.SESSION_END).count());
    }

    @Test
    void shouldRejectEndOfUnknownSession() {
        assertThrows(IllegalArgumentException.class, () -> service.sessionEnd("ghost", "clear"));
    }

    @Test
    void shouldFireSessionStartWithGivenSource() {
        service.sessionStart("s1", "resume");

        assertEquals(HookEventKind.SESSION_START, firedEvents.get(0).kind());
        assertTrue(sessionService.get("s1").isPresent());
    }

    // ===== handoff =====

    @Test
    void shouldRenderHandoffFromHistoryActivityAndNotes() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(reply("done")));
        when(memoryPort.getFilesModified("s1")).thenReturn(List.of("Parser.java"));
        when(memoryPort.getIssuesWorked("s1")).thenReturn(List.of("#42"));
        service.exchange(command("s1", "fix the parser\nit drops trailing commas"));
        sessionService.updateHandoffNotes("s1", "  Check the lexer next.  ");

        String handoff = service.handoff("s1");

        assertTrue(handoff.startsWith("## Session Handoff\n\nPrevious Session: s1\nStatus: ACTIVE\n"));
        assertTrue(handoff.contains("Duration: 2026-03-01 10:00 UTC to 2026-03-01 10:00 UTC"));
        assertTrue(handoff.contains("### Requests\n- fix the parser\n\n"));
        assertTrue(handoff.contains("### Issues Worked\n- #42\n"));
        assertTrue(handoff.contains("### Files Modified\n- Parser.java\n"));
        assertTrue(handoff.contains("### Notes for Next Session\nCheck the lexer next.\n"));
        assertTrue(handoff.contains("- Input: 12 tokens\n- Output: 3 tokens\n- Turns: 1\n"));
    }

    @Test
    void shouldListGuardedWritesInHandoffUntilSessionEnds() {
        sessionService.getOrCreate("s1");
        GatewayConfig monitored = new GatewayConfig("anthropic", "claude-test", 50, null,
                new GatewayConfig.ContextSettings(Duration.ofSeconds(2), 5, workspace.toString()), null,
                new GatewayConfig.GuardrailSettings(null,
                        new GatewayConfig.DiffMonitor(true, 0, 0, GuardrailAction.WARN), null));
        guardrailService.openTurn("s1", monitored).record(new ToolCallSegment("call_1", "Write",
                Map.of("file_path", workspace.resolve("src/App.java").toString(), "content", "class App {}")));

        assertTrue(service.handoff("s1").contains("### Files Modified\n- src/App.java\n"));

        service.sessionEnd("s1", "clear");

        assertEquals(0, guardrailService.diffStats("s1").filesChanged());
    }

    @Test
    void shouldOmitEmptyHandoffSections() {
        sessionService.getOrCreate("s1");

        String handoff = service.handoff("s1");

        assertFalse(handoff.contains("### "));
    }

    @Test
    void shouldRejectHandoffOfUnknownSession() {
        assertThrows(IllegalArgumentException.class, () -> service.handoff("ghost"));
    }
}
