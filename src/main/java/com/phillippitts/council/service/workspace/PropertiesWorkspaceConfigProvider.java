package com.phillippitts.council.service.workspace;

import com.phillippitts.council.config.properties.CouncilProperties;
import com.phillippitts.council.config.properties.CouncilProperties.WorkspaceProperties;
import com.phillippitts.council.domain.TokenTier;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * Reads workspace presets from {@code council.workspaces.*}. Lookup ignores case.
 */
@Component
public class PropertiesWorkspaceConfigProvider implements WorkspaceConfigProvider {

    private final CouncilProperties properties;

    public PropertiesWorkspaceConfigProvider(CouncilProperties properties) {
        this.properties = properties;
    }

    @Override
    public WorkspaceConfig forWorkspace(String workspace) {
        if (workspace == null) {
            return WorkspaceConfig.defaults("");
        }
        WorkspaceProperties preset = find(workspace);
        if (preset == null) {
            return WorkspaceConfig.defaults(workspace);
        }
        TokenTier tier = TokenTier.fromLabel(preset.getTokenTier()).orElse(null);
        return new WorkspaceConfig(workspace,
                preset.getBackends(),
                preset.getTools(),
                tier,
                preset.getSynthesizerBackend(),
                preset.getStyle(),
                preset.isHighStakes(),
                preset.isRagEnabled());
    }

    private WorkspaceProperties find(String workspace) {
        String wanted = workspace.trim().toLowerCase(Locale.ROOT);
        for (Map.Entry<String, WorkspaceProperties> e : properties.getWorkspaces().entrySet()) {
            if (e.getKey().toLowerCase(Locale.ROOT).equals(wanted)) {
                return e.getValue();
            }
        }
        return null;
    }
}
