package me.golemcore.logai.domain.system.toolloop;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import me.golemcore.logai.domain.exception.InvalidRequestException;
import me.golemcore.logai.domain.exception.ProviderUnavailableException;
import me.golemcore.logai.domain.exception.ScopeNotFoundException;
import me.golemcore.logai.domain.model.LlmChunk;
import me.golemcore.logai.domain.model.LlmRequest;
import me.golemcore.logai.domain.model.LogEvent;
import me.golemcore.logai.domain.model.Message;
import me.golemcore.logai.domain.model.ModelSelection;
import me.golemcore.logai.domain.model.TerminationReason;
import me.golemcore.logai.domain.model.TimeWindow;
import me.golemcore.logai.domain.model.ToolCallRecord;
import me.golemcore.logai.domain.model.ToolCallStatus;
import me.golemcore.logai.domain.model.ToolLoopStats;
import me.golemcore.logai.domain.model.TurnResult;
import me.golemcore.logai.domain.model.TurnState;
import me.golemcore.logai.domain.service.IntentDetector;
import me.golemcore.logai.domain.service.IntentRuleSet;
import me.golemcore.logai.domain.service.LogGroupCatalogService;
import me.golemcore.logai.domain.service.LogRetrievalService;
import me.golemcore.logai.domain.service.RequestCanonicalizer;
import me.golemcore.logai.domain.service.SystemPromptBuilder;
import me.golemcore.logai.infrastructure.config.LogAiProperties;
import me.golemcore.logai.port.outbound.LlmPort;
import me.golemcore.logai.port.outbound.LogStorePort;
import me.golemcore.logai.port.outbound.ResultCachePort;
import me.golemcore.logai.security.LogRedactor;
import me.golemcore.logai.tools.FetchLogsTool;
import me.golemcore.logai.tools.ListLogGroupsTool;
import me.golemcore.logai.tools.SearchLogsTool;
import me.golemcore.logai.tools.ToolCatalog;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DefaultTurnOrchestratorTest {

    private static final Instant NOW = Instant.parse("2026-02-14T00:00:00Z");
    private static final String GROUP = "/aws/lambda/orders";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Clock clock = Clock.fixed(NOW, ZoneId.of("UTC"));

    private LlmPort llmPort;
    private LogStorePort logStore;
    private ResultCachePort cache;
    private LogAiProperties properties;
    private ExecutorService toolExecutor;
    private ExecutorService turnExecutor;
    private DefaultTurnOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        llmPort = mock(LlmPort.class);
        logStore = mock(LogStorePort.class);
        cache = mock(ResultCachePort.class);
        when(cache.peek(any())).thenReturn(Optional.empty());
        properties = new LogAiProperties();
        properties.getTools().getRateLimit().setFirstBackoff(Duration.ofMillis(1));
        toolExecutor = Executors.newCachedThreadPool();
        turnExecutor = Executors.newSingleThreadExecutor();
        orchestrator = newOrchestrator();
    }

    @AfterEach
    void tearDown() {
        toolExecutor.shutdownNow();
        turnExecutor.shutdownNow();
    }

    private DefaultTurnOrchestrator newOrchestrator() {
        LogRedactor redactor = new LogRedactor(LogRedactor.DEFAULT_RULES, true);
        RequestCanonicalizer canonicalizer = new RequestCanonicalizer(true);
        LogRetrievalService retrieval = new LogRetrievalService(logStore, cache, redactor, canonicalizer, properties,
                Runnable::run);
        ToolCatalog toolCatalog = new ToolCatalog(List.of(
                new ListLogGroupsTool(retrieval, redactor, objectMapper, toolExecutor, clock, properties),
                new FetchLogsTool(retrieval, redactor, objectMapper, toolExecutor, clock, properties),
                new SearchLogsTool(retrieval, redactor, objectMapper, toolExecutor, clock, properties)));
        LogGroupCatalogService groupCatalog = mock(LogGroupCatalogService.class);
        when(groupCatalog.formatForPrompt()).thenReturn("## Available Log Groups\n\n- " + GROUP + "\n");

        return new DefaultTurnOrchestrator("conv-1", llmPort, new ModelSelection("openai", "gpt-4o-mini", 0.2),
                toolCatalog, cache, canonicalizer, new DefaultHistoryWriter(clock),
                new SystemPromptBuilder(groupCatalog, clock),
                new IntentDetector(IntentRuleSet.defaults(), properties.getAgent().getIntentConfidenceThreshold()),
                new EmptyResultRetryPolicy(properties.getAgent()), properties.getAgent(), clock,
                new ToolLoopMetrics(new SimpleMeterRegistry(), "conv-1"));
    }

    // ==================== helpers ====================

    private static Flux<LlmChunk> text(String... parts) {
        List<LlmChunk> chunks = new ArrayList<>();
        for (String part : parts) {
            chunks.add(LlmChunk.builder().text(part).build());
        }
        chunks.add(LlmChunk.builder().done(true).finishReason("STOP").build());
        return Flux.fromIterable(chunks);
    }

    private static Flux<LlmChunk> tools(Message.ToolCall... calls) {
        return Flux.just(LlmChunk.builder().done(true).toolCalls(List.of(calls)).finishReason("TOOL_EXECUTION")
                .build());
    }

    private static Message.ToolCall fetchCall(String id, String group, String startTime) {
        return Message.ToolCall.builder()
                .id(id)
                .name("fetch_logs")
                .arguments(Map.of("log_group", group, "start_time", startTime, "filter_pattern", "ERROR"))
                .build();
    }

    private static LogEvent event(String message) {
        return LogEvent.builder()
                .timestamp(NOW.minusSeconds(120).toEpochMilli())
                .logGroup(GROUP)
                .logStream("2026/02/13/[$LATEST]abc")
                .eventId("e-" + message.hashCode())
                .message(message)
                .build();
    }

    private List<LlmRequest> capturedRequests(int calls) {
        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort, times(calls)).chatStream(captor.capture());
        return captor.getAllValues();
    }

    private static List<String> roles(List<Message> messages) {
        return messages.stream().map(Message::getRole).toList();
    }

    // ==================== answers ====================

    @Test
    void shouldAnswerWithoutTools() {
        List<String> fragments = new CopyOnWriteArrayList<>();
        orchestrator.answerFragments().subscribe(fragments::add);
        when(llmPort.chatStream(any())).thenReturn(text("Hello", ", how can I help?"));

        TurnResult result = orchestrator.processTurn("hi");

        assertTrue(result.isAnswered());
        assertEquals("Hello, how can I help?", result.answer());
        assertEquals(1, result.llmCalls());
        assertEquals(0, result.toolCalls());
        assertEquals(List.of("Hello", ", how can I help?"), fragments);
        assertEquals(List.of("user", "assistant"), roles(orchestrator.history()));
        assertEquals(TurnState.IDLE, orchestrator.getState());
    }

    @Test
    void shouldSendSystemPromptAndToolDefinitions() {
        when(llmPort.chatStream(any())).thenReturn(text("ok"));

        orchestrator.processTurn("hi");

        LlmRequest request = capturedRequests(1).get(0);
        assertTrue(request.getSystemPrompt().contains("- " + GROUP));
        assertEquals(List.of("list_log_groups", "fetch_logs", "search_logs"),
                request.getTools().stream().map(t -> t.getName()).toList());
        assertEquals("gpt-4o-mini", request.getModel());
        assertEquals("conv-1", request.getConversationId());
    }

    @Test
    void shouldReplaceBlankAnswer() {
        when(llmPort.chatStream(any())).thenReturn(text());

        TurnResult result = orchestrator.processTurn("hi");

        assertTrue(result.isAnswered());
        assertTrue(result.answer().contains("empty answer"));
    }

    @Test
    void shouldExecuteToolAndFeedResultBack() {
        when(logStore.fetchEvents(eq(GROUP), any(), eq("ERROR"), anyInt()))
                .thenReturn(List.of(event("ERROR timeout calling payments"), event("ERROR retry failed")));
        when(llmPort.chatStream(any()))
                .thenReturn(tools(fetchCall("call-1", GROUP, "1h ago")))
                .thenReturn(text("Two timeouts in the last hour."));

        TurnResult result = orchestrator.processTurn("any errors in orders?");

        assertTrue(result.isAnswered());
        assertEquals(2, result.llmCalls());
        assertEquals(1, result.toolCalls());
        assertEquals(List.of("user", "assistant", "tool", "assistant"), roles(orchestrator.history()));
        Message toolMessage = orchestrator.history().get(2);
        assertEquals("call-1", toolMessage.getToolCallId());
        assertTrue(toolMessage.getContent().contains("ERROR timeout calling payments"));

        List<LlmRequest> requests = capturedRequests(2);
        assertEquals(List.of("user", "assistant", "tool"), roles(requests.get(1).getMessages()));

        List<ToolCallRecord> records = orchestrator.toolCallSnapshot();
        assertEquals(1, records.size());
        assertEquals(ToolCallStatus.SUCCEEDED, records.get(0).getStatus());
        assertEquals("2 events from " + GROUP, records.get(0).getResultSummary());
        verify(cache, times(1)).store(any(), any());
    }

    @Test
    void shouldRedactLogDataBeforeModelSeesIt() {
        when(logStore.fetchEvents(any(), any(), any(), anyInt()))
                .thenReturn(List.of(event("ERROR payment declined for dave@example.com")));
        when(llmPort.chatStream(any()))
                .thenReturn(tools(fetchCall("call-1", GROUP, "1h ago")))
                .thenReturn(text("One declined payment."));

        orchestrator.processTurn("declined payments?");

        String toolContent = orchestrator.history().get(2).getContent();
        assertTrue(toolContent.contains("[EMAIL_REDACTED]"));
        assertFalse(toolContent.contains("dave@example.com"));
    }

    @Test
    void shouldDispatchParallelToolCalls() {
        when(logStore.fetchEvents(any(), any(), any(), anyInt())).thenReturn(List.of(event("ERROR x")));
        when(llmPort.chatStream(any()))
                .thenReturn(tools(fetchCall("call-1", GROUP, "1h ago"), fetchCall("call-2", "/ecs/api", "1h ago")))
                .thenReturn(text("done"));

        TurnResult result = orchestrator.processTurn("compare");

        assertEquals(2, result.toolCalls());
        List<Message> history = orchestrator.history();
        assertEquals(List.of("user", "assistant", "tool", "tool", "assistant"), roles(history));
        assertEquals("call-1", history.get(2).getToolCallId());
        assertEquals("call-2", history.get(3).getToolCallId());
    }

    // ==================== automatic retry ====================

    @Test
    void shouldWidenWindowUntilAttemptsExhausted() {
        when(logStore.fetchEvents(any(), any(), any(), anyInt())).thenReturn(List.of());
        when(llmPort.chatStream(any())).thenReturn(tools(fetchCall("call-1", GROUP, "1h ago")));

        TurnResult result = orchestrator.processTurn("errors in the last hour?");

        assertEquals(TerminationReason.RETRY_ATTEMPTS_EXHAUSTED, result.reason());
        assertEquals(1, result.llmCalls());
        assertEquals(4, result.toolCalls());
        assertTrue(result.answer().contains("(1h)"));
        assertTrue(result.answer().contains("(4h)"));
        assertTrue(result.answer().contains("(16h)"));
        assertTrue(result.answer().contains("(64h)"));
        verify(logStore, times(4)).fetchEvents(any(), any(), any(), anyInt());

        List<ToolCallRecord> records = orchestrator.toolCallSnapshot();
        assertEquals(List.of(0, 1, 2, 3), records.stream().map(ToolCallRecord::getRetryAttempt).toList());
        assertTrue(records.stream().allMatch(r -> "call-1".equals(r.getSourceToolCallId())));

        List<Message> history = orchestrator.history();
        assertEquals(List.of("user", "assistant", "tool", "assistant", "tool", "assistant", "tool", "assistant",
                "tool", "assistant"), roles(history));
        Message firstRetry = history.get(3);
        assertEquals("call-1-retry-1", firstRetry.getToolCalls().get(0).getId());
        assertEquals("2026-02-13T20:00:00Z", firstRetry.getToolCalls().get(0).getArguments().get("start_time"));
        assertEquals("call-1-retry-1", history.get(4).getToolCallId());
        assertEquals(result.answer(), history.get(history.size() - 1).getContent());
        assertEquals(new ToolLoopStats(3, 1, 0, 0, 0), orchestrator.toolLoopStats());
    }

    @Test
    void shouldDispatchIdenticalCallsOnce() {
        when(logStore.fetchEvents(any(), any(), any(), anyInt())).thenReturn(List.of());
        when(llmPort.chatStream(any()))
                .thenReturn(tools(fetchCall("call-1", GROUP, "1h ago"), fetchCall("call-2", GROUP, "1h ago")));

        TurnResult result = orchestrator.processTurn("errors in the last hour?");

        assertEquals(TerminationReason.RETRY_ATTEMPTS_EXHAUSTED, result.reason());
        assertEquals(4, result.toolCalls());
        ArgumentCaptor<TimeWindow> windows = ArgumentCaptor.forClass(TimeWindow.class);
        verify(logStore, times(4)).fetchEvents(eq(GROUP), windows.capture(), eq("ERROR"), anyInt());
        assertEquals(List.of(Duration.ofHours(1), Duration.ofHours(4), Duration.ofHours(16), Duration.ofHours(64)),
                windows.getAllValues().stream().map(TimeWindow::duration).toList());

        List<Message> history = orchestrator.history();
        assertEquals("call-1", history.get(2).getToolCallId());
        assertEquals("call-2", history.get(3).getToolCallId());
        assertEquals(history.get(2).getContent(), history.get(3).getContent());
        assertEquals(1, history.stream().filter(m -> "call-2".equals(m.getToolCallId())).count());

        List<ToolCallRecord> records = orchestrator.toolCallSnapshot();
        assertEquals(5, records.size());
        assertTrue(records.stream().noneMatch(r -> r.getStatus() == ToolCallStatus.RUNNING));
        assertEquals(1, orchestrator.toolLoopStats().mergedCalls());
    }

    @Test
    void shouldReturnToModelOnceRetryFindsData() {
        when(logStore.fetchEvents(any(), any(), any(), anyInt()))
                .thenReturn(List.of())
                .thenReturn(List.of(event("ERROR found earlier")));
        when(llmPort.chatStream(any()))
                .thenReturn(tools(fetchCall("call-1", GROUP, "1h ago")))
                .thenReturn(text("Found one error three hours ago."));

        TurnResult result = orchestrator.processTurn("errors?");

        assertTrue(result.isAnswered());
        assertEquals(2, result.toolCalls());
        List<Message> secondRequest = capturedRequests(2).get(1).getMessages();
        assertEquals(List.of("user", "assistant", "tool", "assistant", "tool"), roles(secondRequest));
        assertEquals(DefaultHistoryWriter.KIND_AUTO_RETRY,
                secondRequest.get(3).getMetadata().get(DefaultHistoryWriter.META_KIND));
        assertTrue(secondRequest.get(4).getContent().contains("ERROR found earlier"));
    }

    @Test
    void shouldNotRetryWhenAutoRetryDisabled() {
        properties.getAgent().setAutoRetryEnabled(false);
        orchestrator = newOrchestrator();
        when(logStore.fetchEvents(any(), any(), any(), anyInt())).thenReturn(List.of());
        when(llmPort.chatStream(any()))
                .thenReturn(tools(fetchCall("call-1", GROUP, "1h ago")))
                .thenReturn(text("Nothing found."));

        TurnResult result = orchestrator.processTurn("errors?");

        assertTrue(result.isAnswered());
        assertEquals(1, result.toolCalls());
    }

    // ==================== iteration cap ====================

    @Test
    void shouldStopAtIterationCap() {
        properties.getAgent().setMaxToolIterations(2);
        orchestrator = newOrchestrator();
        when(logStore.fetchEvents(any(), any(), any(), anyInt())).thenReturn(List.of(event("ERROR x")));
        when(llmPort.chatStream(any())).thenReturn(tools(fetchCall("call-1", "/a", "1h ago"),
                fetchCall("call-2", "/b", "1h ago"), fetchCall("call-3", "/c", "1h ago")));

        TurnResult result = orchestrator.processTurn("check everything");

        assertEquals(TerminationReason.ITERATION_CAP_EXCEEDED, result.reason());
        assertEquals(2, result.toolCalls());
        assertEquals(1, result.llmCalls());
        assertTrue(result.answer().contains("1 call was not executed"));
        Message skipped = orchestrator.history().get(4);
        assertEquals("call-3", skipped.getToolCallId());
        assertTrue(skipped.getContent().startsWith("Error (NOT_EXECUTED)"));
        verify(logStore, times(2)).fetchEvents(any(), any(), any(), anyInt());
        assertEquals(1, orchestrator.toolLoopStats().capHits());
    }

    @Test
    void shouldStopWhenModelKeepsCallingTools() {
        properties.getAgent().setMaxToolIterations(3);
        orchestrator = newOrchestrator();
        AtomicInteger sequence = new AtomicInteger();
        when(logStore.fetchEvents(any(), any(), any(), anyInt())).thenReturn(List.of(event("ERROR x")));
        when(llmPort.chatStream(any())).thenAnswer(invocation -> tools(
                fetchCall("call-" + sequence.incrementAndGet(), GROUP, sequence.get() + "h ago")));

        TurnResult result = orchestrator.processTurn("loop forever");

        assertEquals(TerminationReason.ITERATION_CAP_EXCEEDED, result.reason());
        assertEquals(3, result.toolCalls());
        assertEquals(4, result.llmCalls());
    }

    @Test
    void shouldCountRetriesAgainstCap() {
        properties.getAgent().setMaxToolIterations(2);
        orchestrator = newOrchestrator();
        when(logStore.fetchEvents(any(), any(), any(), anyInt())).thenReturn(List.of());
        when(llmPort.chatStream(any())).thenReturn(tools(fetchCall("call-1", GROUP, "1h ago")));

        TurnResult result = orchestrator.processTurn("errors?");

        assertEquals(TerminationReason.ITERATION_CAP_EXCEEDED, result.reason());
        assertEquals(2, result.toolCalls());
    }

    // ==================== intent nudge ====================

    @Test
    void shouldNudgeModelThatAnnouncesWithoutCalling() {
        when(logStore.fetchEvents(any(), any(), any(), anyInt())).thenReturn(List.of(event("ERROR x")));
        when(llmPort.chatStream(any()))
                .thenReturn(text("Let me search the orders logs for errors."))
                .thenReturn(tools(fetchCall("call-1", GROUP, "1h ago")))
                .thenReturn(text("One error."));

        TurnResult result = orchestrator.processTurn("errors?");

        assertTrue(result.isAnswered());
        assertEquals(3, result.llmCalls());
        List<Message> nudged = capturedRequests(3).get(1).getMessages();
        Message nudge = nudged.get(nudged.size() - 1);
        assertEquals("system", nudge.getRole());
        assertTrue(nudge.getContent().contains("Use fetch_logs or search_logs. Call the tool now"));
        assertEquals(List.of("user", "assistant", "system", "assistant", "tool", "assistant"),
                roles(orchestrator.history()));
        assertEquals(1, orchestrator.toolLoopStats().nudges());
    }

    @Test
    void shouldNudgeOnlyOncePerIteration() {
        when(llmPort.chatStream(any())).thenReturn(text("Let me check the logs."));

        TurnResult result = orchestrator.processTurn("errors?");

        assertTrue(result.isAnswered());
        assertEquals("Let me check the logs.", result.answer());
        assertEquals(2, result.llmCalls());
    }

    // ==================== tool errors ====================

    @Test
    void shouldReportUnknownToolToModel() {
        when(llmPort.chatStream(any()))
                .thenReturn(tools(Message.ToolCall.builder().id("call-1").name("delete_logs").arguments(Map.of())
                        .build()))
                .thenReturn(text("I cannot delete logs."));

        TurnResult result = orchestrator.processTurn("delete everything");

        assertTrue(result.isAnswered());
        Message toolMessage = orchestrator.history().get(2);
        assertEquals("Error (INVALID_PARAMETERS): Unknown tool 'delete_logs'. Available tools: list_log_groups, "
                + "fetch_logs, search_logs", toolMessage.getContent());
        assertEquals(ToolCallStatus.FAILED, orchestrator.toolCallSnapshot().get(0).getStatus());
    }

    @Test
    void shouldReportInvalidArgumentsToModel() {
        when(llmPort.chatStream(any()))
                .thenReturn(tools(Message.ToolCall.builder().id("call-1").name("fetch_logs")
                        .arguments(Map.of("start_time", "1h ago")).build()))
                .thenReturn(text("Which log group?"));

        orchestrator.processTurn("errors?");

        assertTrue(orchestrator.history().get(2).getContent().contains("Missing required parameter 'log_group'"));
        verify(logStore, never()).fetchEvents(any(), any(), any(), anyInt());
    }

    @Test
    void shouldPassStoreFailureToModel() {
        when(logStore.fetchEvents(any(), any(), any(), anyInt()))
                .thenThrow(new ScopeNotFoundException("Log group not found: /missing"));
        when(llmPort.chatStream(any()))
                .thenReturn(tools(fetchCall("call-1", "/missing", "1h ago")))
                .thenReturn(text("That log group does not exist."));

        TurnResult result = orchestrator.processTurn("errors in /missing?");

        assertTrue(result.isAnswered());
        assertEquals(1, result.toolCalls());
        assertTrue(orchestrator.history().get(2).getContent().contains("SCOPE_NOT_FOUND"));
    }

    // ==================== fatal errors ====================

    @Test
    void shouldFailWhenProviderUnavailable() {
        when(llmPort.chatStream(any())).thenReturn(Flux.error(
                new ProviderUnavailableException("openai call failed: connect timed out", null)));

        TurnResult result = orchestrator.processTurn("hi");

        assertEquals(TerminationReason.FATAL_ERROR, result.reason());
        assertEquals(TurnResult.PROVIDER_UNAVAILABLE, result.subReason());
        assertTrue(result.answer().contains("connect timed out"));
        assertEquals(List.of("user"), roles(orchestrator.history()));
    }

    @Test
    void shouldFailWhenRequestRejected() {
        when(llmPort.chatStream(any())).thenReturn(Flux.error(
                new InvalidRequestException("context length exceeded", null)));

        TurnResult result = orchestrator.processTurn("hi");

        assertEquals(TurnResult.INVALID_REQUEST, result.subReason());
        assertTrue(result.answer().startsWith("The language model rejected the request"));
    }

    @Test
    void shouldDropStepWhenModelFailsMidTurn() {
        when(logStore.fetchEvents(any(), any(), any(), anyInt())).thenReturn(List.of(event("ERROR x")));
        when(llmPort.chatStream(any()))
                .thenReturn(tools(fetchCall("call-1", GROUP, "1h ago")))
                .thenReturn(Flux.error(new ProviderUnavailableException("Rate limited by openai", null)));

        TurnResult result = orchestrator.processTurn("errors?");

        assertEquals(TurnResult.PROVIDER_UNAVAILABLE, result.subReason());
        assertEquals(List.of("user", "assistant", "tool"), roles(orchestrator.history()));
    }

    // ==================== cancellation ====================

    @Test
    void shouldLeaveNoTraceWhenCancelledDuringRetrieval() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(logStore.fetchEvents(any(), any(), any(), anyInt())).thenAnswer(invocation -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return List.of(event("ERROR late"));
        });
        when(llmPort.chatStream(any())).thenReturn(tools(fetchCall("call-1", GROUP, "1h ago")));

        CompletableFuture<TurnResult> turn = CompletableFuture.supplyAsync(
                () -> orchestrator.processTurn("errors?"), turnExecutor);
        assertTrue(started.await(5, TimeUnit.SECONDS));
        orchestrator.cancelTurn();
        TurnResult result = turn.get(5, TimeUnit.SECONDS);
        release.countDown();
        toolExecutor.shutdown();
        assertTrue(toolExecutor.awaitTermination(5, TimeUnit.SECONDS));

        assertTrue(result.isCancelled());
        assertEquals(List.of("user"), roles(orchestrator.history()));
        verify(cache, never()).store(any(), any());
        verify(cache, never()).recordAccess(any(), anyBoolean());
        verify(cache, never()).lookup(any());
        ToolCallRecord record = orchestrator.toolCallSnapshot().get(0);
        assertEquals(ToolCallStatus.FAILED, record.getStatus());
        assertEquals("Cancelled by user", record.getFailureCause());
    }

    @Test
    void shouldDiscardFinishedBranchesWhenSearchCancelled() throws Exception {
        CountDownLatch blocked = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(logStore.searchEvents(any(), any(), any(), anyInt())).thenAnswer(invocation -> {
            List<String> scopes = invocation.getArgument(0);
            if (scopes.contains("/ecs/")) {
                blocked.countDown();
                release.await(5, TimeUnit.SECONDS);
            }
            return List.of(event("ERROR " + scopes.get(0)));
        });
        Message.ToolCall search = Message.ToolCall.builder()
                .id("call-1")
                .name("search_logs")
                .arguments(Map.of("log_group_patterns", List.of("/aws/lambda/", "/aws/rds/", "/ecs/"),
                        "search_pattern", "ERROR", "start_time", "1h ago"))
                .build();
        when(llmPort.chatStream(any())).thenReturn(tools(search));

        CompletableFuture<TurnResult> turn = CompletableFuture.supplyAsync(
                () -> orchestrator.processTurn("errors anywhere?"), turnExecutor);
        assertTrue(blocked.await(5, TimeUnit.SECONDS));
        orchestrator.cancelTurn();
        TurnResult result = turn.get(5, TimeUnit.SECONDS);
        release.countDown();
        toolExecutor.shutdown();
        assertTrue(toolExecutor.awaitTermination(5, TimeUnit.SECONDS));

        assertTrue(result.isCancelled());
        assertEquals(List.of("user"), roles(orchestrator.history()));
        verify(cache, never()).store(any(), any());
        verify(cache, never()).recordAccess(any(), anyBoolean());
    }

    @Test
    void shouldRejectConcurrentTurn() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        when(llmPort.chatStream(any())).thenReturn(Flux.defer(() -> {
            started.countDown();
            return Flux.<LlmChunk>never();
        }));

        CompletableFuture<TurnResult> first = CompletableFuture.supplyAsync(
                () -> orchestrator.processTurn("first"), turnExecutor);
        assertTrue(started.await(5, TimeUnit.SECONDS));

        TurnResult second = orchestrator.processTurn("second");
        assertThrows(IllegalStateException.class, orchestrator::clearHistory);
        orchestrator.cancelTurn();
        TurnResult firstResult = first.get(5, TimeUnit.SECONDS);

        assertEquals(TurnResult.TURN_IN_PROGRESS, second.subReason());
        assertTrue(firstResult.isCancelled());
        assertEquals(List.of("first"), orchestrator.history().stream().map(Message::getContent).toList());
    }

    // ==================== context and history ====================

    @Test
    void shouldDeliverContextUpdateOnce() {
        when(llmPort.chatStream(any())).thenReturn(text("ok"));
        orchestrator.injectContextUpdate("The log group catalog was refreshed and now lists 3 log groups.");

        orchestrator.processTurn("first");
        orchestrator.processTurn("second");

        List<LlmRequest> requests = capturedRequests(2);
        assertEquals(List.of("user", "system"), roles(requests.get(0).getMessages()));
        assertEquals(DefaultHistoryWriter.KIND_CONTEXT,
                requests.get(0).getMessages().get(1).getMetadata().get(DefaultHistoryWriter.META_KIND));
        assertEquals(List.of("user", "assistant", "user"), roles(requests.get(1).getMessages()));
        assertTrue(orchestrator.history().stream().noneMatch(Message::isSystemMessage));
    }

    @Test
    void shouldClearHistoryAndJournalBetweenTurns() {
        when(logStore.fetchEvents(any(), any(), any(), anyInt())).thenReturn(List.of(event("ERROR x")));
        when(llmPort.chatStream(any()))
                .thenReturn(tools(fetchCall("call-1", GROUP, "1h ago")))
                .thenReturn(text("done"));
        orchestrator.processTurn("errors?");

        orchestrator.clearHistory();

        assertTrue(orchestrator.history().isEmpty());
        assertTrue(orchestrator.toolCallSnapshot().isEmpty());
    }

    @Test
    void shouldFormatDurations() {
        assertEquals("1h", DefaultTurnOrchestrator.formatDuration(Duration.ofHours(1)));
        assertEquals("2d", DefaultTurnOrchestrator.formatDuration(Duration.ofDays(2)));
        assertEquals("64h", DefaultTurnOrchestrator.formatDuration(Duration.ofHours(64)));
        assertEquals("90m", DefaultTurnOrchestrator.formatDuration(Duration.ofMinutes(90)));
        assertEquals("45s", DefaultTurnOrchestrator.formatDuration(Duration.ofSeconds(45)));
    }
}
