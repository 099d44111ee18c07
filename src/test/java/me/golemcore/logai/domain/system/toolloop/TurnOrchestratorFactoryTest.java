package me.golemcore.logai.domain.system.toolloop;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import me.golemcore.logai.domain.model.ModelSelection;
import me.golemcore.logai.domain.model.ToolLoopStats;
import me.golemcore.logai.domain.service.IntentDetector;
import me.golemcore.logai.domain.service.IntentRuleSet;
import me.golemcore.logai.domain.service.LogGroupCatalogService;
import me.golemcore.logai.domain.service.RequestCanonicalizer;
import me.golemcore.logai.domain.service.SystemPromptBuilder;
import me.golemcore.logai.infrastructure.config.LogAiProperties;
import me.golemcore.logai.port.outbound.LlmPort;
import me.golemcore.logai.port.outbound.LlmPortFactory;
import me.golemcore.logai.port.outbound.ResultCachePort;
import me.golemcore.logai.tools.ToolCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TurnOrchestratorFactoryTest {

    private LlmPortFactory llmPortFactory;
    private TurnOrchestratorFactory factory;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-02-14T00:00:00Z"), ZoneId.of("UTC"));
        LogAiProperties properties = new LogAiProperties();
        llmPortFactory = mock(LlmPortFactory.class);
        when(llmPortFactory.create(org.mockito.ArgumentMatchers.any())).thenReturn(mock(LlmPort.class));
        factory = new TurnOrchestratorFactory(llmPortFactory, mock(ToolCatalog.class), mock(ResultCachePort.class),
                new RequestCanonicalizer(true), new DefaultHistoryWriter(clock),
                new SystemPromptBuilder(mock(LogGroupCatalogService.class), clock),
                new IntentDetector(IntentRuleSet.defaults(), 0.8),
                new EmptyResultRetryPolicy(properties.getAgent()), properties.getAgent(), clock,
                new SimpleMeterRegistry());
    }

    @Test
    void shouldBindEachConversationToItsModel() {
        ModelSelection openai = new ModelSelection("openai", "gpt-4o-mini", 0.2);
        ModelSelection ollama = new ModelSelection("ollama", "llama3.1", null);

        TurnOrchestrator first = factory.create("conv-1", openai);
        TurnOrchestrator second = factory.create("conv-2", ollama);

        verify(llmPortFactory).create(openai);
        verify(llmPortFactory).create(ollama);
        assertNotSame(first, second);
        assertEquals("conv-1", first.getConversationId());
        assertEquals("conv-2", second.getConversationId());
        assertEquals(new ToolLoopStats(0, 0, 0, 0, 0), first.toolLoopStats());
    }

    @Test
    void shouldStartWithEmptyHistory() {
        TurnOrchestrator orchestrator = factory.create("conv-1", new ModelSelection("openai", "gpt-4o", null));

        assertTrue(orchestrator.history().isEmpty());
        assertTrue(orchestrator.toolCallSnapshot().isEmpty());
    }
}
