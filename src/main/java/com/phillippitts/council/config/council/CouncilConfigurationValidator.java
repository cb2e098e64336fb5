package com.phillippitts.council.config.council;

import com.phillippitts.council.config.properties.CouncilProperties;
import com.phillippitts.council.config.properties.CouncilProperties.WorkspaceProperties;
import com.phillippitts.council.exception.ConfigurationException;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates backend references in {@link CouncilProperties} at startup to fail fast with
 * actionable messages. Every id used for routing, defaults, roles or workspace presets must
 * have pricing in {@code council.backends}.
 */
@Component
class CouncilConfigurationValidator {

    private static final Logger LOG = LogManager.getLogger(CouncilConfigurationValidator.class);

    private final CouncilProperties props;

    CouncilConfigurationValidator(CouncilProperties props) {
        this.props = props;
    }

    @PostConstruct
    void validate() {
        Set<String> known = props.getBackends().keySet();
        if (known.isEmpty()) {
            throw new ConfigurationException("council.backends", "at least one backend must be configured");
        }
        if (props.getDefaultBackends() == null || props.getDefaultBackends().isEmpty()) {
            throw new ConfigurationException("council.default-backends", "must not be empty");
        }
        requireKnown("council.default-backends", props.getDefaultBackends(), known);

        CouncilProperties.Routing routing = props.getRouting();
        requireKnown("council.routing.simple", routing.getSimple(), known);
        requireKnown("council.routing.moderate", routing.getModerate(), known);
        requireKnown("council.routing.complex", routing.getComplex(), known);
        requireKnown("council.routing.expert", routing.getExpert(), known);

        requireKnown("council.classifier-backend", props.getClassifierBackend(), known);
        requireKnown("council.summarizer-backend", props.getSummarizerBackend(), known);
        requireKnown("council.synthesizer-backend", props.getSynthesizerBackend(), known);
        requireKnown("council.judge-backend", props.getJudgeBackend(), known);
        requireDistinct("council.judge-backend", props.getJudgeBackend(), props.getSynthesizerBackend());

        for (Map.Entry<String, WorkspaceProperties> e : props.getWorkspaces().entrySet()) {
            String prefix = "council.workspaces." + e.getKey();
            WorkspaceProperties ws = e.getValue();
            requireKnown(prefix + ".backends", ws.getBackends(), known);
            requireKnown(prefix + ".synthesizer-backend", ws.getSynthesizerBackend(), known);
            requireDistinct(prefix + ".synthesizer-backend", props.getJudgeBackend(), ws.getSynthesizerBackend());
        }
        LOG.info("Council configuration valid: {} backends, {} workspaces", known.size(),
                props.getWorkspaces().size());
    }

    private static void requireKnown(String property, List<String> ids, Set<String> known) {
        if (ids == null) {
            return;
        }
        for (String id : ids) {
            requireKnown(property, id, known);
        }
    }

    private static void requireKnown(String property, String id, Set<String> known) {
        if (id != null && !id.isBlank() && !known.contains(id)) {
            throw new ConfigurationException(property, "unknown backend '" + id + "'. Known: " + known);
        }
    }

    private static void requireDistinct(String property, String judge, String synthesizer) {
        if (judge != null && !judge.isBlank() && judge.equals(synthesizer)) {
            throw new ConfigurationException(property,
                    "judge backend '" + judge + "' must differ from the synthesizer");
        }
    }
}
