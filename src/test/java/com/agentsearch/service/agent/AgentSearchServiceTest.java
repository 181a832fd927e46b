package com.agentsearch.service.agent;

import com.agentsearch.config.AgentSearchProperties;
import com.agentsearch.dto.internal.BackendType;
import com.agentsearch.dto.internal.ConversationTurn;
import com.agentsearch.dto.internal.FailureKind;
import com.agentsearch.dto.internal.ModelInfo;
import com.agentsearch.dto.internal.PipelineStage;
import com.agentsearch.dto.internal.RetrievalResult;
import com.agentsearch.dto.internal.SearchStrategy;
import com.agentsearch.dto.internal.StageFailure;
import com.agentsearch.dto.request.AgentSearchRequest;
import com.agentsearch.dto.response.PipelineResult;
import com.agentsearch.exception.BackendConfigurationException;
import com.agentsearch.exception.CompletionException;
import com.agentsearch.service.agent.FanOutExecutorTest.StubBackend;
import com.agentsearch.service.llm.Completion;
import com.agentsearch.service.llm.CompletionProvider;
import com.agentsearch.service.monitoring.PerformanceMonitorService;
import com.agentsearch.service.retrieval.RetrievalBackend;
import com.agentsearch.service.retrieval.RetrievalBackendFactory;
import com.agentsearch.util.PromptBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AgentSearchServiceTest {

    private static final String QUERY = "Compare X and Y impact on Z";

    private static final String THREE_SUBQUERIES =
        "- What is X's impact on Z?\n- What is Y's impact on Z?\n- How do X and Y compare?";

    @Mock
    private CompletionProvider completionProvider;

    @Mock
    private RetrievalBackendFactory backendFactory;

    private PerformanceMonitorService performanceMonitor;

    private AgentSearchService service;

    @BeforeEach
    void setUp() {
        AgentSearchProperties properties = new AgentSearchProperties();
        PromptBuilder promptBuilder = new PromptBuilder();
        ContextAggregator aggregator = new ContextAggregator();
        performanceMonitor = new PerformanceMonitorService(properties);

        service = new AgentSearchService(
            new ConversationFormatter(),
            new QueryDecomposer(completionProvider, promptBuilder, aggregator, properties),
            new FanOutExecutor(aggregator),
            new AnswerSynthesizer(completionProvider, promptBuilder, aggregator, properties),
            completionProvider,
            backendFactory,
            performanceMonitor);
    }

    /**
     * Routes completion calls by prompt: decomposition, informed follow-ups, synthesis
     */
    private void model(Function<String, Completion> synthesis) {
        when(completionProvider.describe()).thenReturn(new ModelInfo("Ollama", "llama3.2"));
        when(completionProvider.generate(anyString(), anyInt())).thenAnswer(invocation -> {
            String prompt = invocation.getArgument(0);
            if (prompt.startsWith("### TASK")) {
                return synthesis.apply(prompt);
            }
            if (prompt.contains("Based on what was found so far")) {
                return Completion.of("- What is Y's long-term impact on Z?\n- Which studies cover X?");
            }
            return Completion.of(THREE_SUBQUERIES);
        });
    }

    @Nested
    @DisplayName("Blind strategy")
    class Blind {

        @Test
        @DisplayName("End to end: three subqueries, all contexts, a final answer")
        void endToEnd() {
            // Given
            model(prompt -> Completion.of("X raises Z while Y lowers it."));
            StubBackend backend = new StubBackend(2);

            // When
            PipelineResult result = service.run(QUERY, List.of(), backend, SearchStrategy.BLIND, 3);

            // Then
            assertThat(result.getQuery()).isEqualTo(QUERY);
            assertThat(result.getSubqueries()).hasSize(3)
                .containsExactly("What is X's impact on Z?", "What is Y's impact on Z?", "How do X and Y compare?");
            assertThat(result.getIntermediateResults()).hasSize(3);
            assertThat(result.getContexts()).hasSize(6);
            assertThat(result.getAnswer()).isEqualTo("X raises Z while Y lowers it.");
            assertThat(result.getStrategy()).isEqualTo(SearchStrategy.BLIND);
            assertThat(result.getBackend()).isEqualTo(BackendType.DOCUMENT);
            assertThat(result.getModelInfo().model()).isEqualTo("llama3.2");
            assertThat(result.getFailures()).isEmpty();
            assertThat(result.getStages()).containsExactly(
                PipelineStage.INIT, PipelineStage.DECOMPOSE, PipelineStage.FAN_OUT,
                PipelineStage.AGGREGATE, PipelineStage.SYNTHESIZE, PipelineStage.DONE);
            assertThat(result.getTiming().getStepDurations()).containsKeys("DECOMPOSE", "SYNTHESIZE", "DONE");
        }

        @Test
        @DisplayName("A failing synthesis still completes with a diagnostic answer")
        void synthesisFails() {
            // Given
            model(prompt -> {
                throw new CompletionException("model down");
            });

            // When
            PipelineResult result = service.run(QUERY, List.of(), new StubBackend(1), SearchStrategy.BLIND, 3);

            // Then
            assertThat(result.getAnswer()).isNotBlank().contains("model down");
            assertThat(result.getContexts()).hasSize(3);
            assertThat(result.getFailures()).extracting(StageFailure::kind).containsExactly(FailureKind.SYNTHESIS);
            assertThat(result.getStages()).last().isEqualTo(PipelineStage.DONE);
        }

        @Test
        @DisplayName("A backend that always fails gives empty contexts and still an answer")
        void backendAlwaysFails() {
            // Given
            model(prompt -> Completion.of("There is no relevant context."));
            RetrievalBackend broken = new StubBackend(0) {
                @Override
                public RetrievalResult retrieve(String subquery, int maxResults) {
                    throw new IllegalStateException("connection refused");
                }
            };

            // When
            PipelineResult result = service.run(QUERY, List.of(), broken, SearchStrategy.BLIND, 3);

            // Then
            assertThat(result.getSubqueries()).hasSize(3);
            assertThat(result.getContexts()).isEmpty();
            assertThat(result.getAnswer()).isEqualTo("There is no relevant context.");
            assertThat(result.getFailures()).hasSize(3)
                .allSatisfy(f -> assertThat(f.kind()).isEqualTo(FailureKind.RETRIEVAL));
            assertThat(result.getStages()).last().isEqualTo(PipelineStage.DONE);
        }

        @Test
        @DisplayName("Malformed decomposition output falls back to the query itself")
        void decompositionFallback() {
            when(completionProvider.describe()).thenReturn(new ModelInfo("Ollama", "llama3.2"));
            when(completionProvider.generate(anyString(), anyInt())).thenAnswer(invocation -> {
                String prompt = invocation.getArgument(0);
                return prompt.startsWith("### TASK") ? Completion.of("answer") : Completion.of("\n\n");
            });

            PipelineResult result = service.run(QUERY, List.of(), new StubBackend(1), SearchStrategy.BLIND, 3);

            assertThat(result.getSubqueries()).containsExactly(QUERY);
            assertThat(result.getFailures()).extracting(StageFailure::kind).containsExactly(FailureKind.DECOMPOSITION);
        }

        @Test
        @DisplayName("Prior turns are folded into the query that gets decomposed")
        void conversationFolded() {
            model(prompt -> Completion.of("answer"));
            StubBackend backend = new StubBackend(1);
            List<ConversationTurn> history = List.of(
                ConversationTurn.builder().role("user").content("Tell me about X.").build());

            PipelineResult result = service.run("And Y?", history, backend, SearchStrategy.BLIND, 3);

            assertThat(result.getQuery()).isEqualTo("And Y?");
            assertThat(result.getSubqueries()).hasSize(3);
        }
    }

    @Nested
    @DisplayName("Informed strategy")
    class Informed {

        @Test
        @DisplayName("Initial retrieval feeds the results but is not a reported subquery")
        void initialEntry() {
            // Given
            model(prompt -> Completion.of("final"));
            StubBackend backend = new StubBackend(2);

            // When
            PipelineResult result = service.run(QUERY, List.of(), backend, SearchStrategy.INFORMED, 3);

            // Then
            assertThat(backend.calls).hasSize(3).first().isEqualTo(QUERY);
            assertThat(result.getSubqueries())
                .containsExactly("What is Y's long-term impact on Z?", "Which studies cover X?");
            assertThat(result.getIntermediateResults()).hasSize(3);
            assertThat(result.getIntermediateResults().get(0).isInitial()).isTrue();
            assertThat(result.getContexts()).hasSize(6);
            assertThat(result.getStages()).containsExactly(
                PipelineStage.INIT, PipelineStage.INITIAL_RETRIEVAL, PipelineStage.DECOMPOSE,
                PipelineStage.FAN_OUT, PipelineStage.AGGREGATE, PipelineStage.SYNTHESIZE, PipelineStage.DONE);
        }
    }

    @Nested
    @DisplayName("Single strategy")
    class Single {

        @Test
        @DisplayName("One retrieval for the whole query answers it without decomposition or synthesis")
        void singleRetrieval() {
            // Given
            when(completionProvider.describe()).thenReturn(new ModelInfo("Ollama", "llama3.2"));
            StubBackend backend = new StubBackend(2);

            // When
            PipelineResult result = service.run(QUERY, List.of(), backend, SearchStrategy.SINGLE, 3);

            // Then
            assertThat(backend.calls).containsExactly(QUERY);
            assertThat(result.getSubqueries()).containsExactly(QUERY);
            assertThat(result.getIntermediateResults()).singleElement()
                .satisfies(r -> assertThat(r.isInitial()).isFalse());
            assertThat(result.getContexts()).hasSize(2);
            assertThat(result.getAnswer()).isEqualTo("answer to " + QUERY);
            assertThat(result.getStrategy()).isEqualTo(SearchStrategy.SINGLE);
            assertThat(result.getFailures()).isEmpty();
            assertThat(result.getStages()).containsExactly(
                PipelineStage.INIT, PipelineStage.FAN_OUT, PipelineStage.AGGREGATE, PipelineStage.DONE);
            verify(completionProvider, never()).generate(anyString(), anyInt());
        }

        @Test
        @DisplayName("A failing backend gives a diagnostic answer and a retrieval failure")
        void singleRetrievalFails() {
            // Given
            when(completionProvider.describe()).thenReturn(new ModelInfo("Ollama", "llama3.2"));
            RetrievalBackend broken = new StubBackend(0) {
                @Override
                public RetrievalResult retrieve(String subquery, int maxResults) {
                    throw new IllegalStateException("connection refused");
                }
            };

            // When
            PipelineResult result = service.run(QUERY, List.of(), broken, SearchStrategy.SINGLE, 3);

            // Then
            assertThat(result.getSubqueries()).containsExactly(QUERY);
            assertThat(result.getContexts()).isEmpty();
            assertThat(result.getAnswer()).contains("connection refused");
            assertThat(result.getFailures()).singleElement().satisfies(f -> {
                assertThat(f.kind()).isEqualTo(FailureKind.RETRIEVAL);
                assertThat(f.stage()).isEqualTo(PipelineStage.FAN_OUT);
            });
            assertThat(result.getStages()).last().isEqualTo(PipelineStage.DONE);
        }
    }

    @Nested
    @DisplayName("Degraded runs")
    class Degraded {

        @Test
        @DisplayName("An error while folding the conversation still reports the query as the subquery")
        void formattingFails() {
            // Given
            when(completionProvider.describe()).thenReturn(new ModelInfo("Ollama", "llama3.2"));
            ConversationTurn turn = mock(ConversationTurn.class);
            when(turn.getRole()).thenThrow(new IllegalStateException("bad turn"));
            StubBackend backend = new StubBackend(1);

            // When
            PipelineResult result = service.run(QUERY, List.of(turn), backend, SearchStrategy.BLIND, 3);

            // Then
            assertThat(result.getSubqueries()).containsExactly(QUERY);
            assertThat(result.getAnswer()).contains("bad turn");
            assertThat(result.getFailures()).extracting(StageFailure::kind).containsExactly(FailureKind.DECOMPOSITION);
            assertThat(result.getStages()).containsExactly(PipelineStage.DONE);
            assertThat(backend.calls).isEmpty();
        }

        @Test
        @DisplayName("A fan-out error keeps the decomposed subqueries with placeholder answers")
        void fanOutFails() {
            // Given
            model(prompt -> Completion.of("final"));
            RetrievalBackend malformed = new StubBackend(0) {
                @Override
                public RetrievalResult retrieve(String subquery, int maxResults) {
                    return RetrievalResult.builder().answer("partial").context(null).build();
                }
            };

            // When
            PipelineResult result = service.run(QUERY, List.of(), malformed, SearchStrategy.BLIND, 3);

            // Then
            assertThat(result.getSubqueries())
                .containsExactly("What is X's impact on Z?", "What is Y's impact on Z?", "How do X and Y compare?");
            assertThat(result.getIntermediateResults()).hasSize(3)
                .allSatisfy(r -> assertThat(r.getAnswer()).startsWith("Error retrieving information"));
            assertThat(result.getContexts()).isEmpty();
            assertThat(result.getFailures()).singleElement()
                .satisfies(f -> assertThat(f.stage()).isEqualTo(PipelineStage.FAN_OUT));
            assertThat(result.getAnswer()).isEqualTo("final");
            assertThat(result.getStages()).last().isEqualTo(PipelineStage.DONE);
        }
    }

    @Nested
    @DisplayName("Requests and monitoring")
    class Requests {

        @Test
        @DisplayName("Backend misconfiguration is thrown before the run starts")
        void misconfiguredBackend() {
            when(backendFactory.create(any(), any()))
                .thenThrow(new BackendConfigurationException("Document search requires a collection id"));

            AgentSearchRequest request = AgentSearchRequest.builder().query(QUERY).build();

            assertThatThrownBy(() -> service.search(request))
                .isInstanceOf(BackendConfigurationException.class);
            verifyNoInteractions(completionProvider);
            assertThat(performanceMonitor.getRunHistory()).isEmpty();
        }

        @Test
        @DisplayName("A request uses the backend default result count")
        void requestDefaults() {
            model(prompt -> Completion.of("final"));
            StubBackend backend = new StubBackend(1);
            when(backendFactory.create(BackendType.DOCUMENT, "legal")).thenReturn(backend);
            when(backendFactory.defaultMaxResults(BackendType.DOCUMENT)).thenReturn(3);

            AgentSearchRequest request = AgentSearchRequest.builder().query(QUERY).collectionId("legal").build();
            PipelineResult result = service.search(request);

            assertThat(result.getSubqueries()).hasSize(3);
            assertThat(performanceMonitor.getRunHistory()).singleElement()
                .satisfies(run -> assertThat(run.strategy()).isEqualTo("blind"));
        }
    }
}
