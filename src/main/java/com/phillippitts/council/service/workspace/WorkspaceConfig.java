package com.phillippitts.council.service.workspace;

import com.phillippitts.council.domain.TokenTier;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolved per-workspace settings. Absent values mean "use the global setting".
 *
 * @param name               workspace name as requested
 * @param backends           pinned backend set; empty to route by complexity
 * @param tools              allowed tool ids; empty to allow every registered tool
 * @param tokenTier          synthesis tier override, or null
 * @param synthesizerBackend synthesizer override, or null
 * @param style              style instructions appended to synthesis prompts, or null
 * @param highStakes         whether answers in this workspace always warrant a judge
 * @param ragEnabled         whether {@code rag_search} runs for every query
 */
public record WorkspaceConfig(
        String name,
        List<String> backends,
        List<String> tools,
        TokenTier tokenTier,
        String synthesizerBackend,
        String style,
        boolean highStakes,
        boolean ragEnabled
) {

    public WorkspaceConfig {
        Objects.requireNonNull(name, "name");
        backends = backends == null ? List.of() : List.copyOf(backends);
        tools = tools == null ? List.of() : List.copyOf(tools);
    }

    public static WorkspaceConfig defaults(String name) {
        return new WorkspaceConfig(name, List.of(), List.of(), null, null, null, false, false);
    }

    public Optional<TokenTier> tokenTierOverride() {
        return Optional.ofNullable(tokenTier);
    }

    public Optional<String> synthesizerOverride() {
        return Optional.ofNullable(synthesizerBackend).filter(s -> !s.isBlank());
    }

    public boolean allowsTool(String toolId) {
        return tools.isEmpty() || tools.contains(toolId);
    }
}
