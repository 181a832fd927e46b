package com.agentsearch.service.agent;

import com.agentsearch.config.AgentSearchProperties;
import com.agentsearch.dto.internal.Context;
import com.agentsearch.dto.internal.RetrievalResult;
import com.agentsearch.dto.internal.SearchStrategy;
import com.agentsearch.dto.internal.SourceType;
import com.agentsearch.dto.internal.Subquery;
import com.agentsearch.exception.CompletionException;
import com.agentsearch.service.agent.QueryDecomposer.Decomposition;
import com.agentsearch.service.llm.Completion;
import com.agentsearch.service.llm.CompletionProvider;
import com.agentsearch.util.PromptBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class QueryDecomposerTest {

    private static final String QUERY = "Compare X and Y impact on Z";

    @Mock
    private CompletionProvider completionProvider;

    private QueryDecomposer decomposer;

    @BeforeEach
    void setUp() {
        decomposer = new QueryDecomposer(
            completionProvider, new PromptBuilder(), new ContextAggregator(), new AgentSearchProperties());
    }

    private void modelReturns(String text) {
        when(completionProvider.generate(anyString(), anyInt())).thenReturn(Completion.of(text));
    }

    @Nested
    @DisplayName("Blind decomposition")
    class Blind {

        @Test
        @DisplayName("Bullet and numbered markers are stripped")
        void stripsMarkers() {
            // Given
            modelReturns("- What is X's impact on Z?\n* What is Y's impact on Z?\n\n• How do X and Y differ?\n");

            // When
            Decomposition result = decomposer.decompose(QUERY, false);

            // Then
            assertThat(result.fallback()).isFalse();
            assertThat(result.texts()).containsExactly(
                "What is X's impact on Z?", "What is Y's impact on Z?", "How do X and Y differ?");
            assertThat(result.subqueries()).extracting(Subquery::origin).containsOnly(SearchStrategy.BLIND);
        }

        @Test
        @DisplayName("Duplicates are removed and at most four subqueries are kept")
        void dedupsAndCaps() {
            modelReturns("1. A\n2) A\n3. B\n4. C\n5. D\n6. E");

            assertThat(decomposer.decompose(QUERY, false).texts()).containsExactly("A", "B", "C", "D");
        }

        @Test
        @DisplayName("Empty model output falls back to the original query")
        void emptyOutput() {
            modelReturns("  \n - \n");

            Decomposition result = decomposer.decompose(QUERY, true);

            assertThat(result.fallback()).isTrue();
            assertThat(result.texts()).containsExactly(QUERY);
        }

        @Test
        @DisplayName("A failed completion falls back instead of parsing the diagnostic")
        void failedCompletion() {
            when(completionProvider.generate(anyString(), anyInt()))
                .thenReturn(Completion.failure("Error generating response: connection refused"));

            assertThat(decomposer.decompose(QUERY, false).texts()).containsExactly(QUERY);
        }

        @Test
        @DisplayName("A throwing provider falls back to the original query")
        void providerThrows() {
            when(completionProvider.generate(anyString(), anyInt()))
                .thenThrow(new CompletionException("model down"));

            assertThat(decomposer.decompose(QUERY, false).texts()).containsExactly(QUERY);
        }

        @Test
        @DisplayName("Web backends get search-query wording")
        void webWording() {
            modelReturns("- X Z impact");

            decomposer.decompose(QUERY, true);

            ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
            verify(completionProvider).generate(prompt.capture(), eq(500));
            assertThat(prompt.getValue()).contains("web search queries", QUERY);
        }
    }

    @Nested
    @DisplayName("Informed decomposition")
    class Informed {

        private RetrievalResult initial() {
            RetrievalResult.RetrievalResultBuilder builder = RetrievalResult.builder().answer("X raises Z.");
            for (String title : List.of("Alpha", "Beta", "Gamma", "Delta")) {
                builder.context(Context.builder()
                    .sourceId(title)
                    .title(title)
                    .content("x".repeat(1000))
                    .relevanceScore(0.8)
                    .sourceType(SourceType.DOCUMENT)
                    .build());
            }
            return builder.build();
        }

        @Test
        @DisplayName("Prompt holds the first three contexts, each truncated")
        void promptContext() {
            // Given
            modelReturns("- What about Y?");

            // When
            decomposer.decomposeInformed(QUERY, initial(), false);

            // Then
            ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
            verify(completionProvider).generate(prompt.capture(), anyInt());
            assertThat(prompt.getValue())
                .contains("X raises Z.", "Alpha", "Beta", "Gamma", "x".repeat(500) + "...")
                .doesNotContain("Delta", "x".repeat(501));
        }

        @Test
        @DisplayName("At most three follow-ups are kept")
        void capsAtThree() {
            modelReturns("- A\n- B\n- C\n- D");

            Decomposition result = decomposer.decomposeInformed(QUERY, initial(), false);

            assertThat(result.texts()).containsExactly("A", "B", "C");
            assertThat(result.subqueries()).extracting(Subquery::origin).containsOnly(SearchStrategy.INFORMED);
        }

        @Test
        @DisplayName("Document fallback asks for details and perspectives")
        void documentFallback() {
            modelReturns("");

            Decomposition result = decomposer.decomposeInformed(QUERY, initial(), false);

            assertThat(result.fallback()).isTrue();
            assertThat(result.texts()).containsExactly(
                "What additional details can be found about " + QUERY + "?",
                "Are there any alternative perspectives on " + QUERY + "?");
        }

        @Test
        @DisplayName("Web fallback uses keyword-style follow-ups")
        void webFallback() {
            when(completionProvider.generate(anyString(), anyInt())).thenThrow(new CompletionException("down"));

            assertThat(decomposer.decomposeInformed(QUERY, RetrievalResult.empty("nothing"), true).texts())
                .containsExactly(QUERY + " latest information", QUERY + " alternative perspectives");
        }
    }
}
