package me.golemcore.logai.domain.system.toolloop;

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

import me.golemcore.logai.domain.component.ToolComponent;
import me.golemcore.logai.domain.exception.InvalidParametersException;
import me.golemcore.logai.domain.exception.InvalidRequestException;
import me.golemcore.logai.domain.model.CacheStats;
import me.golemcore.logai.domain.model.DetectedIntent;
import me.golemcore.logai.domain.model.LlmChunk;
import me.golemcore.logai.domain.model.LlmRequest;
import me.golemcore.logai.domain.model.LlmResponse;
import me.golemcore.logai.domain.model.Message;
import me.golemcore.logai.domain.model.ModelSelection;
import me.golemcore.logai.domain.model.RetrievalRequest;
import me.golemcore.logai.domain.model.TerminationReason;
import me.golemcore.logai.domain.model.TimeWindow;
import me.golemcore.logai.domain.model.ToolCallRecord;
import me.golemcore.logai.domain.model.ToolFailureKind;
import me.golemcore.logai.domain.model.ToolLoopStats;
import me.golemcore.logai.domain.model.ToolResult;
import me.golemcore.logai.domain.model.TurnResult;
import me.golemcore.logai.domain.model.TurnState;
import me.golemcore.logai.domain.service.IntentDetector;
import me.golemcore.logai.domain.service.RequestCanonicalizer;
import me.golemcore.logai.domain.service.RetrievalScope;
import me.golemcore.logai.domain.service.SystemPromptBuilder;
import me.golemcore.logai.infrastructure.config.LogAiProperties;
import me.golemcore.logai.port.outbound.LlmPort;
import me.golemcore.logai.port.outbound.ResultCachePort;
import me.golemcore.logai.tools.ToolCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Tool loop orchestrator of one conversation.
 *
 * <p>
 * Each iteration calls the model once (twice when a nudge is needed) and
 * dispatches the requested tool calls concurrently. Messages of an iteration
 * are buffered and committed to history together with the staged cache writes
 * of its retrievals; a cancelled iteration commits neither.
 *
 * <p>
 * Empty results over a bounded window are re-dispatched with a wider window
 * without going back to the model. Every dispatch, retries included, counts
 * against the iteration cap of the turn. Identical calls within one step are
 * dispatched once and the result answers each of their ids.
 */
public class DefaultTurnOrchestrator implements TurnOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DefaultTurnOrchestrator.class);

    static final String RETRY_ID_SEPARATOR = "-retry-";
    private static final String CANCELLED_CAUSE = "Cancelled by user";
    private static final String EMPTY_ANSWER = "The model returned an empty answer. Please rephrase the question.";

    private final String conversationId;
    private final LlmPort llmPort;
    private final ModelSelection selection;
    private final ToolCatalog toolCatalog;
    private final ResultCachePort cache;
    private final RequestCanonicalizer canonicalizer;
    private final HistoryWriter historyWriter;
    private final SystemPromptBuilder promptBuilder;
    private final IntentDetector intentDetector;
    private final EmptyResultRetryPolicy retryPolicy;
    private final LogAiProperties.AgentProperties settings;
    private final ToolLoopMetrics metrics;

    private final List<Message> history = new ArrayList<>();
    private final Object historyLock = new Object();
    private final ReentrantLock turnLock = new ReentrantLock();
    private final ToolCallJournal journal;
    private final Sinks.Many<String> fragments = Sinks.many().multicast().directBestEffort();
    private final Object fragmentLock = new Object();
    private final AtomicReference<String> pendingContextUpdate = new AtomicReference<>();

    private volatile ActiveTurn activeTurn;
    private volatile TurnState state = TurnState.IDLE;

    public DefaultTurnOrchestrator(String conversationId, LlmPort llmPort, ModelSelection selection,
            ToolCatalog toolCatalog, ResultCachePort cache, RequestCanonicalizer canonicalizer,
            HistoryWriter historyWriter, SystemPromptBuilder promptBuilder, IntentDetector intentDetector,
            EmptyResultRetryPolicy retryPolicy, LogAiProperties.AgentProperties settings, Clock clock,
            ToolLoopMetrics metrics) {
        this.conversationId = conversationId;
        this.llmPort = llmPort;
        this.selection = selection;
        this.toolCatalog = toolCatalog;
        this.cache = cache;
        this.canonicalizer = canonicalizer;
        this.historyWriter = historyWriter;
        this.promptBuilder = promptBuilder;
        this.intentDetector = intentDetector;
        this.retryPolicy = retryPolicy;
        this.settings = settings;
        this.metrics = metrics;
        this.journal = new ToolCallJournal(clock);
    }

    @Override
    public String getConversationId() {
        return conversationId;
    }

    @Override
    public TurnResult processTurn(String utterance) {
        if (!turnLock.tryLock()) {
            log.warn("[ToolLoop] Turn rejected in {}: another turn is in progress", conversationId);
            return TurnResult.fatal(TurnResult.TURN_IN_PROGRESS,
                    "Another request is still being processed in this conversation.", 0, 0);
        }
        ActiveTurn turn = new ActiveTurn(new TurnBudget(settings.getMaxToolIterations()));
        activeTurn = turn;
        try {
            TurnResult result = runTurn(utterance, turn);
            log.info("[ToolLoop] Turn finished in {}: {}{} (llm calls: {}, tool calls: {})", conversationId,
                    result.reason(), result.subReason() != null ? "/" + result.subReason() : "",
                    result.llmCalls(), result.toolCalls());
            return result;
        } finally {
            activeTurn = null;
            state = TurnState.IDLE;
            turnLock.unlock();
        }
    }

    @Override
    public void cancelTurn() {
        ActiveTurn turn = activeTurn;
        if (turn == null) {
            return;
        }
        synchronized (historyLock) {
            turn.cancelled = true;
        }
        turn.abort();
        log.info("[ToolLoop] Turn cancellation requested in {}", conversationId);
    }

    @Override
    public TurnState getState() {
        return state;
    }

    @Override
    public Flux<String> answerFragments() {
        return fragments.asFlux();
    }

    @Override
    public Flux<ToolCallRecord> toolCallRecords() {
        return journal.stream();
    }

    @Override
    public List<ToolCallRecord> toolCallSnapshot() {
        return journal.snapshot();
    }

    @Override
    public List<Message> history() {
        synchronized (historyLock) {
            return List.copyOf(history);
        }
    }

    @Override
    public void clearHistory() {
        if (turnLock.isLocked()) {
            throw new IllegalStateException("Cannot clear history while a turn is in progress");
        }
        synchronized (historyLock) {
            history.clear();
        }
        journal.clear();
        log.info("[ToolLoop] History cleared in {}", conversationId);
    }

    @Override
    public void injectContextUpdate(String text) {
        if (text != null && !text.isBlank()) {
            pendingContextUpdate.set(text);
        }
    }

    @Override
    public CacheStats cacheStats() {
        return cache.stats();
    }

    @Override
    public ToolLoopStats toolLoopStats() {
        return metrics.snapshot();
    }

    // ==================== TURN LOOP ====================

    private TurnResult runTurn(String utterance, ActiveTurn turn) {
        log.info("[ToolLoop] Turn started in {} ({} chars)", conversationId, utterance.length());
        synchronized (historyLock) {
            historyWriter.appendUserMessage(history, utterance);
        }
        TurnBudget budget = turn.budget;

        while (true) {
            if (turn.cancelled) {
                return cancelled(turn);
            }
            List<Message> step = new ArrayList<>();
            LlmResponse response;
            try {
                response = respond(step, turn);
            } catch (CancellationException e) {
                return cancelled(turn);
            } catch (InvalidRequestException e) {
                log.warn("[ToolLoop] Model rejected the request: {}", e.getMessage());
                return fatal(turn, TurnResult.INVALID_REQUEST,
                        "The language model rejected the request: " + e.getMessage());
            } catch (RuntimeException e) {
                if (turn.cancelled) {
                    return cancelled(turn);
                }
                log.warn("[ToolLoop] Model call failed: {}", e.getMessage(), e);
                return fatal(turn, TurnResult.PROVIDER_UNAVAILABLE,
                        "The language model provider is unavailable (" + e.getMessage()
                                + "). Please try again in a moment.");
            }

            if (!response.hasToolCalls()) {
                state = TurnState.FINAL_ANSWER;
                String answer = response.getContent() == null || response.getContent().isBlank()
                        ? EMPTY_ANSWER
                        : response.getContent();
                historyWriter.appendFinalAssistantAnswer(step, answer);
                if (!commit(turn, step, null)) {
                    return cancelled(turn);
                }
                return TurnResult.answered(answer, budget.llmCalls(), budget.dispatches());
            }

            state = TurnState.TOOL_REQUESTED;
            historyWriter.appendAssistantToolCalls(step, response.getContent(), response.getToolCalls());
            StepOutcome outcome;
            try {
                outcome = executeStep(response.getToolCalls(), turn, step);
            } catch (CancellationException e) {
                return cancelled(turn);
            }

            TerminationReason stop = null;
            String explanation = null;
            if (outcome.capExceeded()) {
                metrics.capHit();
                stop = TerminationReason.ITERATION_CAP_EXCEEDED;
                explanation = capExplanation(budget, outcome.notExecuted());
            } else if (!outcome.exhausted().isEmpty()) {
                stop = TerminationReason.RETRY_ATTEMPTS_EXHAUSTED;
                explanation = exhaustedExplanation(outcome.exhausted());
            }
            if (stop != null) {
                historyWriter.appendFinalAssistantAnswer(step, explanation);
            }
            if (!commit(turn, step, outcome.scope())) {
                return cancelled(turn);
            }
            if (stop != null) {
                state = TurnState.TERMINATED;
                emitFragment(explanation);
                log.info("[ToolLoop] Turn stopped: {}", stop);
                return new TurnResult(stop, null, explanation, budget.llmCalls(), budget.dispatches());
            }
        }
    }

    /**
     * Calls the model; when the reply announces a retrieval without a tool call,
     * adds a nudge to the step and calls it once more.
     */
    private LlmResponse respond(List<Message> step, ActiveTurn turn) {
        LlmResponse response = callModel(step, turn);
        if (response.hasToolCalls() || !settings.isIntentDetectionEnabled()) {
            return response;
        }
        Optional<DetectedIntent> intent = intentDetector.detect(response.getContent());
        if (intent.isEmpty()) {
            return response;
        }
        log.info("[ToolLoop] Model announced {} without a tool call, nudging", intent.get().type());
        metrics.nudge(intent.get().type());
        historyWriter.appendAssistantText(step, response.getContent());
        historyWriter.appendSystemNudge(step, nudge(intent.get()));
        return callModel(step, turn);
    }

    private LlmResponse callModel(List<Message> step, ActiveTurn turn) {
        state = TurnState.AWAITING_MODEL;
        LlmRequest request = buildRequest(step);
        StringBuilder text = new StringBuilder();
        List<Message.ToolCall> toolCalls = new ArrayList<>();
        AtomicReference<String> finishReason = new AtomicReference<>();

        CompletableFuture<LlmResponse> future = llmPort.chatStream(request)
                .doOnNext(chunk -> accumulate(chunk, text, toolCalls, finishReason))
                .then(Mono.fromSupplier(() -> LlmResponse.builder()
                        .content(text.toString())
                        .toolCalls(toolCalls.isEmpty() ? null : List.copyOf(toolCalls))
                        .model(selection.model())
                        .finishReason(finishReason.get())
                        .build()))
                .toFuture();
        turn.track(future);
        turn.budget.recordLlmCall();
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof CancellationException cancellation) {
                throw cancellation;
            }
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw e;
        }
    }

    private void accumulate(LlmChunk chunk, StringBuilder text, List<Message.ToolCall> toolCalls,
            AtomicReference<String> finishReason) {
        if (chunk.getText() != null && !chunk.getText().isEmpty()) {
            text.append(chunk.getText());
            emitFragment(chunk.getText());
        }
        if (chunk.getToolCalls() != null) {
            toolCalls.addAll(chunk.getToolCalls());
        }
        if (chunk.getFinishReason() != null) {
            finishReason.set(chunk.getFinishReason());
        }
    }

    private LlmRequest buildRequest(List<Message> step) {
        List<Message> messages;
        synchronized (historyLock) {
            messages = new ArrayList<>(history);
        }
        String contextUpdate = pendingContextUpdate.getAndSet(null);
        if (contextUpdate != null) {
            // Delivered once, kept out of committed history
            historyWriter.appendSystemContext(messages, contextUpdate);
        }
        messages.addAll(step);
        return LlmRequest.builder()
                .model(selection.model())
                .systemPrompt(promptBuilder.build())
                .messages(messages)
                .tools(toolCatalog.definitions())
                .temperature(selection.temperature())
                .conversationId(conversationId)
                .build();
    }

    // ==================== TOOL DISPATCH ====================

    private StepOutcome executeStep(List<Message.ToolCall> toolCalls, ActiveTurn turn, List<Message> step) {
        RetrievalScope scope = new RetrievalScope();
        turn.scope(scope);

        List<CallChain> chains = new ArrayList<>();
        List<Answer> answers = new ArrayList<>();
        Map<String, CallChain> bySignature = new HashMap<>();
        List<Message.ToolCall> notExecuted = new ArrayList<>();
        for (Message.ToolCall call : toolCalls) {
            if (!notExecuted.isEmpty()) {
                notExecuted.add(call);
                continue;
            }
            PreparedCall prepared = prepare(call);
            CallChain leader = prepared.signature() != null ? bySignature.get(prepared.signature()) : null;
            if (leader != null) {
                log.debug("[ToolLoop] Call {} duplicates {}, answering from one dispatch", call.getId(),
                        leader.original.getId());
                metrics.mergedCall();
                ToolCallRecord record = journal.markRunning(openRecord(call, prepared.tool()));
                answers.add(new Answer(call, leader, record));
                continue;
            }
            if (!turn.budget.tryReserveDispatch()) {
                notExecuted.add(call);
                continue;
            }
            CallChain chain = dispatch(call, prepared, turn.budget, scope);
            chains.add(chain);
            answers.add(new Answer(call, chain, null));
            if (prepared.signature() != null) {
                bySignature.put(prepared.signature(), chain);
            }
        }

        CompletableFuture<Void> all = CompletableFuture.allOf(chains.stream()
                .map(CallChain::completion)
                .toArray(CompletableFuture[]::new));
        turn.track(all);
        try {
            all.join();
        } catch (CancellationException | CompletionException e) {
            log.debug("[ToolLoop] Step interrupted: {}", e.getMessage());
            throw new CancellationException("Step cancelled");
        }
        if (turn.cancelled) {
            throw new CancellationException("Step cancelled");
        }

        for (Answer answer : answers) {
            historyWriter.appendToolResult(step, answer.outcome(journal));
        }
        for (Message.ToolCall call : notExecuted) {
            historyWriter.appendToolResult(step, ToolExecutionOutcome.synthetic(call, ToolFailureKind.NOT_EXECUTED,
                    "Not executed: the limit of " + turn.budget.maxDispatches()
                            + " tool calls for this request was reached"));
        }
        for (CallChain chain : chains) {
            List<Attempt> attempts = chain.attempts();
            for (Attempt retry : attempts.subList(1, attempts.size())) {
                historyWriter.appendAutoRetryCall(step, retryNote(retry), retry.toolCall());
                historyWriter.appendToolResult(step, retry.outcome());
            }
        }

        boolean capExceeded = !notExecuted.isEmpty() || chains.stream().anyMatch(CallChain::isCapHit);
        List<CallChain> exhausted = chains.stream().filter(CallChain::isExhausted).toList();
        return new StepOutcome(scope, capExceeded, notExecuted.size(), exhausted);
    }

    private PreparedCall prepare(Message.ToolCall call) {
        Optional<ToolComponent> resolved = toolCatalog.resolve(call.getName());
        if (resolved.isEmpty()) {
            return new PreparedCall(null, null, null, "Unknown tool '" + call.getName() + "'. Available tools: "
                    + toolCatalog.definitions().stream().map(d -> d.getName()).collect(Collectors.joining(", ")));
        }
        ToolComponent tool = resolved.get();
        try {
            RetrievalRequest request = tool.parseRequest(arguments(call));
            return new PreparedCall(tool, request, canonicalizer.signature(request), null);
        } catch (InvalidParametersException e) {
            return new PreparedCall(tool, null, null, e.getMessage());
        }
    }

    private CallChain dispatch(Message.ToolCall call, PreparedCall prepared, TurnBudget budget,
            RetrievalScope scope) {
        ToolCallRecord record = openRecord(call, prepared.tool());
        if (prepared.error() != null) {
            return CallChain.rejected(call, record, prepared.error(), journal);
        }
        CallChain chain = new CallChain(call, prepared.tool(), prepared.signature());
        chain.completion = attempt(chain, call, prepared.request(), record, budget, scope);
        return chain;
    }

    private ToolCallRecord openRecord(Message.ToolCall call, ToolComponent tool) {
        return journal.open(call.getId(), call.getName(), tool != null ? tool.getKind() : null, arguments(call), 0);
    }

    private static Map<String, Object> arguments(Message.ToolCall call) {
        return call.getArguments() != null ? call.getArguments() : Map.of();
    }

    private CompletableFuture<Void> attempt(CallChain chain, Message.ToolCall toolCall, RetrievalRequest request,
            ToolCallRecord record, TurnBudget budget, RetrievalScope scope) {
        ToolCallRecord running = journal.markRunning(record);
        return scope.register(chain.tool.execute(request, scope))
                .handle((result, error) -> complete(chain, toolCall, request, running, result, error))
                .thenCompose(result -> {
                    if (!retryPolicy.qualifies(request, result)) {
                        return CompletableFuture.<Void>completedFuture(null);
                    }
                    int attemptNumber = budget.tryReserveRetry(chain.signature, retryPolicy.maxAttempts());
                    if (attemptNumber == 0) {
                        chain.exhausted = true;
                        metrics.retriesExhausted();
                        return CompletableFuture.<Void>completedFuture(null);
                    }
                    if (!budget.tryReserveDispatch()) {
                        chain.capHit = true;
                        return CompletableFuture.<Void>completedFuture(null);
                    }
                    metrics.retry();
                    RetrievalRequest expanded = retryPolicy.expand(request);
                    Message.ToolCall retryCall = Message.ToolCall.builder()
                            .id(chain.original.getId() + RETRY_ID_SEPARATOR + attemptNumber)
                            .name(chain.original.getName())
                            .arguments(chain.tool.toArguments(expanded))
                            .build();
                    log.info("[ToolLoop] Empty result for {}, retrying with {} window (attempt {}/{})",
                            chain.original.getName(), formatDuration(expanded.getWindow().duration()),
                            attemptNumber, retryPolicy.maxAttempts());
                    ToolCallRecord next = journal.open(chain.original.getId(), retryCall.getName(),
                            chain.tool.getKind(), retryCall.getArguments(), attemptNumber);
                    return attempt(chain, retryCall, expanded, next, budget, scope);
                });
    }

    private ToolResult complete(CallChain chain, Message.ToolCall toolCall, RetrievalRequest request,
            ToolCallRecord record, ToolResult result, Throwable error) {
        if (error != null) {
            Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause()
                    : error;
            if (cause instanceof CancellationException cancellation) {
                journal.markFailed(record, CANCELLED_CAUSE);
                throw cancellation;
            }
            log.warn("[ToolLoop] Tool {} failed unexpectedly: {}", toolCall.getName(), cause.getMessage(), cause);
            result = ToolResult.failure(ToolFailureKind.EXECUTION_FAILED,
                    "Tool execution failed: " + cause.getMessage());
        }
        if (result.isSuccess()) {
            journal.markSucceeded(record, result.getSummary());
        } else {
            journal.markFailed(record, result.getError());
        }
        chain.attempts.add(new Attempt(toolCall, request, ToolExecutionOutcome.of(toolCall.getId(),
                toolCall.getName(), result)));
        return result;
    }

    // ==================== TERMINATION ====================

    private boolean commit(ActiveTurn turn, List<Message> step, RetrievalScope scope) {
        synchronized (historyLock) {
            if (turn.cancelled) {
                return false;
            }
            if (scope != null && !scope.commit(access -> cache.recordAccess(access.request(), access.hit()),
                    write -> cache.store(write.request(), write.payload()))) {
                return false;
            }
            history.addAll(step);
            return true;
        }
    }

    private TurnResult cancelled(ActiveTurn turn) {
        int failed = journal.failUnfinished(CANCELLED_CAUSE);
        state = TurnState.TERMINATED;
        log.info("[ToolLoop] Turn cancelled in {} ({} tool calls interrupted)", conversationId, failed);
        return TurnResult.fatal(TurnResult.CANCELLED, "Request cancelled.", turn.budget.llmCalls(),
                turn.budget.dispatches());
    }

    private TurnResult fatal(ActiveTurn turn, String subReason, String answer) {
        journal.failUnfinished("Turn aborted: " + subReason);
        state = TurnState.TERMINATED;
        emitFragment(answer);
        return TurnResult.fatal(subReason, answer, turn.budget.llmCalls(), turn.budget.dispatches());
    }

    private String capExplanation(TurnBudget budget, int notExecuted) {
        StringBuilder sb = new StringBuilder();
        sb.append("I stopped after ").append(budget.dispatches())
                .append(" tool calls, the limit for a single request.");
        if (notExecuted > 0) {
            sb.append(' ').append(notExecuted).append(notExecuted == 1 ? " call was" : " calls were")
                    .append(" not executed.");
        }
        sb.append(" The results gathered so far are in the conversation. Ask a narrower question or continue"
                + " with a follow-up request.");
        return sb.toString();
    }

    private String exhaustedExplanation(List<CallChain> exhausted) {
        StringBuilder sb = new StringBuilder("No matching log events were found, even after widening the time"
                + " window automatically.");
        for (CallChain chain : exhausted) {
            sb.append("\n\n").append(chain.original.getName()).append(" searched:");
            for (Attempt attempt : chain.attempts()) {
                TimeWindow window = attempt.request().getWindow();
                sb.append("\n- ").append(window.start()).append(" to ").append(window.end())
                        .append(" (").append(formatDuration(window.duration())).append(')');
            }
        }
        sb.append("\n\nThe events may be older than the widest window, in a different log group, or the filter"
                + " may be too narrow.");
        return sb.toString();
    }

    private String retryNote(Attempt retry) {
        return "No results in the previous window. Retrying automatically with a "
                + formatDuration(retry.request().getWindow().duration()) + " window.";
    }

    private String nudge(DetectedIntent intent) {
        return "You said \"" + intent.triggerPhrase() + "\" but did not call a tool. " + intent.suggestedAction()
                + ". Call the tool now, or give your final answer if no retrieval is needed.";
    }

    private void emitFragment(String text) {
        synchronized (fragmentLock) {
            fragments.tryEmitNext(text);
        }
    }

    static String formatDuration(Duration duration) {
        long seconds = duration.getSeconds();
        if (seconds % 86_400 == 0 && seconds >= 86_400) {
            return seconds / 86_400 + "d";
        }
        if (seconds % 3600 == 0 && seconds >= 3600) {
            return seconds / 3600 + "h";
        }
        if (seconds % 60 == 0 && seconds >= 60) {
            return seconds / 60 + "m";
        }
        return seconds + "s";
    }

    // ==================== STATE ====================

    private record StepOutcome(RetrievalScope scope, boolean capExceeded, int notExecuted,
            List<CallChain> exhausted) {
    }

    private record Attempt(Message.ToolCall toolCall, RetrievalRequest request, ToolExecutionOutcome outcome) {
    }

    private record PreparedCall(ToolComponent tool, RetrievalRequest request, String signature, String error) {
    }

    /**
     * Tool result owed to one model call id. A merged call carries its own
     * journal record and reuses the first result of the chain it duplicates.
     */
    private record Answer(Message.ToolCall call, CallChain chain, ToolCallRecord mergedRecord) {

        ToolExecutionOutcome outcome(ToolCallJournal journal) {
            ToolExecutionOutcome first = chain.attempts().get(0).outcome();
            if (mergedRecord == null) {
                return first;
            }
            ToolResult result = first.toolResult();
            if (result.isSuccess()) {
                journal.markSucceeded(mergedRecord, result.getSummary());
            } else {
                journal.markFailed(mergedRecord, result.getError());
            }
            return ToolExecutionOutcome.of(call.getId(), call.getName(), result);
        }
    }

    /**
     * One model tool call and the automatic retries issued for it.
     */
    private static final class CallChain {

        private final Message.ToolCall original;
        private final ToolComponent tool;
        private final String signature;
        private final List<Attempt> attempts = Collections.synchronizedList(new ArrayList<>());
        private volatile CompletableFuture<Void> completion;
        private volatile boolean exhausted;
        private volatile boolean capHit;

        private CallChain(Message.ToolCall original, ToolComponent tool, String signature) {
            this.original = original;
            this.tool = tool;
            this.signature = signature;
        }

        static CallChain rejected(Message.ToolCall call, ToolCallRecord record, String error,
                ToolCallJournal journal) {
            journal.markFailed(journal.markRunning(record), error);
            CallChain chain = new CallChain(call, null, null);
            chain.attempts.add(new Attempt(call, null, ToolExecutionOutcome.of(call.getId(), call.getName(),
                    ToolResult.failure(ToolFailureKind.INVALID_PARAMETERS, error))));
            chain.completion = CompletableFuture.completedFuture(null);
            return chain;
        }

        CompletableFuture<Void> completion() {
            return completion;
        }

        List<Attempt> attempts() {
            synchronized (attempts) {
                return List.copyOf(attempts);
            }
        }

        boolean isExhausted() {
            return exhausted;
        }

        boolean isCapHit() {
            return capHit;
        }
    }

    /**
     * Handles to everything a running turn may be waiting on.
     */
    private static final class ActiveTurn {

        private final TurnBudget budget;
        private final List<CompletableFuture<?>> waits = Collections.synchronizedList(new ArrayList<>());
        private volatile RetrievalScope scope;
        private volatile boolean cancelled;

        private ActiveTurn(TurnBudget budget) {
            this.budget = budget;
        }

        void track(CompletableFuture<?> future) {
            waits.add(future);
            if (cancelled) {
                future.cancel(true);
            }
        }

        void scope(RetrievalScope next) {
            this.scope = next;
            if (cancelled) {
                next.cancel();
            }
        }

        void abort() {
            RetrievalScope current = scope;
            if (current != null) {
                current.cancel();
            }
            List<CompletableFuture<?>> pending;
            synchronized (waits) {
                pending = new ArrayList<>(waits);
            }
            pending.forEach(future -> future.cancel(true));
        }
    }
}
