package com.phillippitts.council.presentation.exception;

import com.phillippitts.council.domain.BudgetScope;
import com.phillippitts.council.exception.AdmissionDeniedException;
import com.phillippitts.council.exception.ConfigurationException;
import com.phillippitts.council.exception.PipelineFailureException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void verifiesAdmissionDeniedReturns429() {
        AdmissionDeniedException ex = new AdmissionDeniedException(BudgetScope.DAY, 99.5, 1.0, 100.0);

        ResponseEntity<GlobalExceptionHandler.ApiError> response = handler.handleAdmissionDenied(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().errorCode()).isEqualTo("AdmissionDeniedException");
        assertThat(response.getBody().message()).isEqualTo("DAY budget exhausted");
        assertThat(response.getBody().timestamp()).isNotNull();
    }

    @Test
    void verifiesConfigurationErrorReturns503WithoutPropertyDetails() {
        ConfigurationException ex = new ConfigurationException("council.judge-backend", "must differ from synthesizer");

        ResponseEntity<GlobalExceptionHandler.ApiError> response = handler.handleConfiguration(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().toString()).doesNotContain("council.judge-backend");
        assertThat(response.getBody().details()).contains("Contact administrator");
    }

    @Test
    void verifiesPipelineFailureReturns502WithAttemptCount() {
        PipelineFailureException ex = new PipelineFailureException("q-1",
                List.of("gpt-5.1", "claude-sonnet-4.5", "gemini-3-pro"));

        ResponseEntity<GlobalExceptionHandler.ApiError> response = handler.handlePipelineFailure(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().details()).contains("Attempted 3 backends");
        assertThat(response.getBody().toString()).doesNotContain("gpt-5.1");
    }

    @Test
    void verifiesIllegalArgumentReturns400() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleInvalidParameter(new IllegalArgumentException("days must be positive"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().errorCode()).isEqualTo("ValidationError");
        assertThat(response.getBody().details()).isEqualTo("days must be positive");
    }

    @Test
    void verifiesUnexpectedErrorDoesNotLeakMessage() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleUnexpected(new IllegalStateException("api key sk-secret rejected"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().toString()).doesNotContain("sk-secret");
    }
}
