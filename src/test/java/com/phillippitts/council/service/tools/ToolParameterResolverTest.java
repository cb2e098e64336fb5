package com.phillippitts.council.service.tools;

import com.phillippitts.council.config.properties.ToolProperties;
import com.phillippitts.council.domain.Query;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ToolParameterResolverTest {

    private final ToolParameterResolver resolver = new ToolParameterResolver(new ToolProperties());

    @Test
    void shouldAddRagSettingsForRagSearch() {
        Map<String, Object> params = resolver.resolve("rag_search", Query.of("house style?", "Wooster"));

        assertThat(params).containsEntry("query", "house style?")
                .containsEntry("workspace", "Wooster")
                .containsEntry("k", 5)
                .containsEntry("min_score", 0.3);
    }

    @Test
    void shouldPassTrimmedExpressionToCalculator() {
        assertThat(resolver.resolve("calculator", Query.of("  17 * 23 ", null)))
                .containsEntry("expression", "17 * 23")
                .containsEntry("workspace", Query.DEFAULT_WORKSPACE);
    }

    @Test
    void shouldBuildOneRequestPerTool() {
        List<ToolRequest> requests = resolver.requestsFor(List.of("web_search", "calculator"), Query.of("1+1", null));

        assertThat(requests).extracting(ToolRequest::toolId).containsExactly("web_search", "calculator");
        assertThat(requests.get(0).params()).doesNotContainKey("expression");
    }
}
