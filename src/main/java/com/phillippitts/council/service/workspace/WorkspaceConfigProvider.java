package com.phillippitts.council.service.workspace;

/**
 * Lookup of per-workspace configuration, keyed by workspace name.
 */
public interface WorkspaceConfigProvider {

    /**
     * Returns the configuration for the workspace, or defaults if none is configured.
     * Never returns null.
     */
    WorkspaceConfig forWorkspace(String workspace);
}
