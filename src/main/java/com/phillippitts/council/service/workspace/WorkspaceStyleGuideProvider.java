package com.phillippitts.council.service.workspace;

import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Style guide backed by the {@code style} field of workspace presets.
 */
@Component
public class WorkspaceStyleGuideProvider implements StyleGuideProvider {

    private final WorkspaceConfigProvider workspaces;

    public WorkspaceStyleGuideProvider(WorkspaceConfigProvider workspaces) {
        this.workspaces = workspaces;
    }

    @Override
    public Optional<String> getStyle(String workspace) {
        return Optional.ofNullable(workspaces.forWorkspace(workspace).style())
                .filter(s -> !s.isBlank());
    }
}
