package com.phillippitts.council.config.logging;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.matches;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MdcFilterTest {

    private static final String UUID_PATTERN =
            "[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}";

    private MdcFilter filter;
    private HttpServletRequest request;
    private HttpServletResponse response;
    private FilterChain chain;
    private final Map<String, String> seen = new HashMap<>();

    @BeforeEach
    void setUp() throws ServletException, IOException {
        filter = new MdcFilter();
        request = mock(HttpServletRequest.class);
        response = mock(HttpServletResponse.class);
        chain = mock(FilterChain.class);
        when(request.getMethod()).thenReturn("POST");
        when(request.getRequestURI()).thenReturn("/api/council/queries");
        doAnswer(invocation -> {
            seen.putAll(ThreadContext.getContext());
            return null;
        }).when(chain).doFilter(any(), any());
        ThreadContext.clearAll();
    }

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void labelsRequestWithWorkspaceHeader() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn("req-xyz");
        when(request.getHeader("X-Workspace")).thenReturn("  Bellcourt ");

        filter.doFilter(request, response, chain);

        assertThat(seen)
                .containsEntry("requestId", "req-xyz")
                .containsEntry("workspace", "Bellcourt")
                .containsEntry("route", "POST /api/council/queries")
                .doesNotContainKey("queryId");
        verify(response).setHeader("X-Request-ID", "req-xyz");
    }

    @Test
    void generatesRequestIdWhenHeaderIsMissingOrBlank() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn("   ");

        filter.doFilter(request, response, chain);

        assertThat(seen.get("requestId")).matches(UUID_PATTERN);
        verify(response).setHeader(eq("X-Request-ID"), matches(UUID_PATTERN));
    }

    @Test
    void omitsWorkspaceWhenHeaderIsAbsent() throws ServletException, IOException {
        filter.doFilter(request, response, chain);

        assertThat(seen).doesNotContainKey("workspace");
    }

    @Test
    void dropsWorkspaceHeaderThatCouldForgeLogLines() throws ServletException, IOException {
        when(request.getHeader("X-Workspace")).thenReturn("Bellcourt\n2025-11-20 INFO forged");

        filter.doFilter(request, response, chain);

        assertThat(seen).doesNotContainKey("workspace");
    }

    @Test
    void dropsOverlongWorkspaceHeader() {
        assertThat(MdcFilter.workspaceLabel("w".repeat(101))).isNull();
        assertThat(MdcFilter.workspaceLabel("w".repeat(100))).hasSize(100);
    }

    @Test
    void restoresPreviousContextEvenWhenChainThrows() throws ServletException, IOException {
        ThreadContext.put("workspace", "outer");
        when(request.getHeader("X-Workspace")).thenReturn("Bellcourt");
        doThrow(new ServletException("Test exception")).when(chain).doFilter(request, response);

        assertThatThrownBy(() -> filter.doFilter(request, response, chain))
                .isInstanceOf(ServletException.class)
                .hasMessage("Test exception");

        assertThat(ThreadContext.getContext()).containsOnly(Map.entry("workspace", "outer"));
    }

    @Test
    void passesNonHttpRequestThroughUntouched() throws ServletException, IOException {
        ServletRequest nonHttpRequest = mock(ServletRequest.class);

        filter.doFilter(nonHttpRequest, response, chain);

        verify(chain).doFilter(nonHttpRequest, response);
        assertThat(seen).isEmpty();
    }
}
