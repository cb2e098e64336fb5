package com.phillippitts.council.config.council;

import com.phillippitts.council.config.properties.CouncilProperties;
import com.phillippitts.council.exception.ConfigurationException;
import com.phillippitts.council.testutil.CouncilFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.phillippitts.council.testutil.CouncilFixtures.CLAUDE;
import static com.phillippitts.council.testutil.CouncilFixtures.GPT;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CouncilConfigurationValidatorTest {

    @Test
    void shouldAcceptDefaultFixture() {
        CouncilProperties props = CouncilFixtures.councilProperties();

        assertThatCode(() -> new CouncilConfigurationValidator(props).validate()).doesNotThrowAnyException();
    }

    @Test
    void shouldRejectEmptyBackendCatalog() {
        CouncilProperties props = CouncilFixtures.councilProperties();
        props.setBackends(Map.of());

        assertThatThrownBy(() -> new CouncilConfigurationValidator(props).validate())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("council.backends");
    }

    @Test
    void shouldRejectUnknownRoutingBackend() {
        CouncilProperties props = CouncilFixtures.councilProperties();
        props.getRouting().setComplex(List.of(CLAUDE, "llama-9"));

        assertThatThrownBy(() -> new CouncilConfigurationValidator(props).validate())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("council.routing.complex")
                .hasMessageContaining("llama-9");
    }

    @Test
    void shouldRejectJudgeEqualToSynthesizer() {
        CouncilProperties props = CouncilFixtures.councilProperties();
        props.setJudgeBackend(props.getSynthesizerBackend());

        assertThatThrownBy(() -> new CouncilConfigurationValidator(props).validate())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("council.judge-backend");
    }

    @Test
    void shouldRejectWorkspaceSynthesizerMatchingJudge() {
        CouncilProperties props = CouncilFixtures.councilProperties();
        CouncilProperties.WorkspaceProperties ws = CouncilFixtures.workspace(List.of(GPT));
        ws.setSynthesizerBackend(CLAUDE);
        props.setWorkspaces(Map.of("Bellcourt", ws));

        assertThatThrownBy(() -> new CouncilConfigurationValidator(props).validate())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("council.workspaces.Bellcourt.synthesizer-backend");
    }

    @Test
    void shouldRejectUnknownWorkspaceBackend() {
        CouncilProperties props = CouncilFixtures.councilProperties();
        props.setWorkspaces(Map.of("Lab", CouncilFixtures.workspace(List.of("mystery-model"))));

        assertThatThrownBy(() -> new CouncilConfigurationValidator(props).validate())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("council.workspaces.Lab.backends");
    }
}
