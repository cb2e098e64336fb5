package com.phillippitts.council.service.workspace;

import java.util.Optional;

/**
 * Supplies workspace-specific writing instructions for synthesis prompts.
 */
public interface StyleGuideProvider {

    Optional<String> getStyle(String workspace);
}
