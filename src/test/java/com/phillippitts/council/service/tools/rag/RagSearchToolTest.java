package com.phillippitts.council.service.tools.rag;

import com.phillippitts.council.config.properties.ToolProperties;
import com.phillippitts.council.domain.ToolFailureKind;
import com.phillippitts.council.service.tools.ToolFailureException;
import com.phillippitts.council.service.tools.ToolResult;
import com.phillippitts.council.service.workspace.RagCollaborator;
import com.phillippitts.council.service.workspace.RagPassage;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.support.StaticListableBeanFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RagSearchToolTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);

    private final ToolProperties properties = new ToolProperties();
    private final RagCollaborator rag = mock(RagCollaborator.class);

    @Test
    void shouldListPassagesBestFirstWithSourceAndScore() {
        when(rag.semanticSearch("Wooster", "house style?", 2, 0.5)).thenReturn(List.of(
                new RagPassage("Prefer active voice.", 0.91, "style-guide.md"),
                new RagPassage("Avoid jargon.", 0.74, "editorial.md")));

        ToolResult result = tool(rag).invoke(
                Map.of("query", "house style?", "workspace", "Wooster", "k", 2, "min_score", 0.5), TIMEOUT);

        assertThat(result.content()).isEqualTo("""
                [1] style-guide.md (score 0.91)
                Prefer active voice.

                [2] editorial.md (score 0.74)
                Avoid jargon.""");
    }

    @Test
    void shouldFallBackToConfiguredSearchSettings() {
        when(rag.semanticSearch(anyString(), anyString(), anyInt(), anyDouble())).thenReturn(List.of());

        tool(rag).invoke(Map.of("query", "q", "workspace", "Wooster"), TIMEOUT);

        verify(rag).semanticSearch("Wooster", "q", 5, 0.3);
    }

    @Test
    void shouldTruncateLongPassages() {
        properties.getRag().setMaxPassageChars(10);
        when(rag.semanticSearch(anyString(), anyString(), anyInt(), anyDouble()))
                .thenReturn(List.of(new RagPassage("0123456789ABCDEF", 0.8, "doc")));

        ToolResult result = tool(rag).invoke(Map.of("query", "q", "workspace", "Wooster"), TIMEOUT);

        assertThat(result.content()).endsWith("0123456789").doesNotContain("ABCDEF");
    }

    @Test
    void shouldReportNoDocumentsFound() {
        when(rag.semanticSearch(anyString(), anyString(), anyInt(), anyDouble())).thenReturn(List.of());

        assertThat(tool(rag).invoke(Map.of("query", "q", "workspace", "Wooster"), TIMEOUT).content())
                .isEqualTo("No relevant documents found in workspace Wooster.");
    }

    @Test
    void shouldFailAsUnavailableWithoutCollaborator() {
        RagSearchTool tool = new RagSearchTool(new StaticListableBeanFactory().getBeanProvider(RagCollaborator.class),
                properties);

        assertThatThrownBy(() -> tool.invoke(Map.of("query", "q", "workspace", "Wooster"), TIMEOUT))
                .isInstanceOf(ToolFailureException.class)
                .satisfies(e -> assertThat(((ToolFailureException) e).getKind()).isEqualTo(ToolFailureKind.UNAVAILABLE));
    }

    @Test
    void shouldRejectMissingQuery() {
        assertThatThrownBy(() -> tool(rag).invoke(Map.of("workspace", "Wooster"), TIMEOUT))
                .isInstanceOf(ToolFailureException.class)
                .satisfies(e -> assertThat(((ToolFailureException) e).getKind())
                        .isEqualTo(ToolFailureKind.INVALID_PARAMS));
    }

    @Test
    void shouldWrapSearchErrors() {
        when(rag.semanticSearch(anyString(), anyString(), anyInt(), anyDouble()))
                .thenThrow(new IllegalStateException("index offline"));

        assertThatThrownBy(() -> tool(rag).invoke(Map.of("query", "q", "workspace", "Wooster"), TIMEOUT))
                .isInstanceOf(ToolFailureException.class)
                .hasCauseInstanceOf(IllegalStateException.class)
                .satisfies(e -> assertThat(((ToolFailureException) e).getKind()).isEqualTo(ToolFailureKind.ERROR));
    }

    private RagSearchTool tool(RagCollaborator collaborator) {
        StaticListableBeanFactory beans = new StaticListableBeanFactory(Map.<String, Object>of("rag", collaborator));
        ObjectProvider<RagCollaborator> provider = beans.getBeanProvider(RagCollaborator.class);
        return new RagSearchTool(provider, properties);
    }
}
