package com.phillippitts.council.config.logging;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Map;
import java.util.UUID;

/**
 * Labels every log line of an HTTP request with the keys the log pattern prints.
 *
 * <ul>
 *   <li>{@code requestId}: the X-Request-ID header or a fresh UUID, echoed on the response so
 *       a client can quote it when reporting a failed deliberation</li>
 *   <li>{@code workspace}: the X-Workspace header, so request handling before the pipeline
 *       starts (validation, admission errors) is attributed to the caller's workspace. The
 *       pipeline replaces it with the resolved workspace for the duration of a query.</li>
 *   <li>{@code route}: method and path</li>
 * </ul>
 *
 * <p>{@code queryId} is not set here; it exists only once the pipeline has created the query.
 * The thread's previous context is restored after the request.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter implements Filter {

    public static final String REQUEST_ID_HEADER = "X-Request-ID";
    public static final String WORKSPACE_HEADER = "X-Workspace";

    static final String REQUEST_ID = "requestId";
    static final String WORKSPACE = "workspace";
    static final String ROUTE = "route";

    /** Same bound as the request body's workspace field. */
    static final int MAX_WORKSPACE_LENGTH = 100;

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        if (!(request instanceof HttpServletRequest http)) {
            chain.doFilter(request, response);
            return;
        }
        Map<String, String> previous = ThreadContext.getImmutableContext();
        try {
            String requestId = http.getHeader(REQUEST_ID_HEADER);
            if (requestId == null || requestId.isBlank()) {
                requestId = UUID.randomUUID().toString();
            }
            ThreadContext.put(REQUEST_ID, requestId);
            if (response instanceof HttpServletResponse httpResponse) {
                httpResponse.setHeader(REQUEST_ID_HEADER, requestId);
            }

            String workspace = workspaceLabel(http.getHeader(WORKSPACE_HEADER));
            if (workspace != null) {
                ThreadContext.put(WORKSPACE, workspace);
            }
            ThreadContext.put(ROUTE, http.getMethod() + " " + http.getRequestURI());

            chain.doFilter(request, response);
        } finally {
            ThreadContext.clearMap();
            ThreadContext.putAll(previous);
        }
    }

    /**
     * Header value usable as a log label, or null. Values with control characters could
     * forge log lines and are dropped.
     */
    public static String workspaceLabel(String header) {
        if (header == null) {
            return null;
        }
        String trimmed = header.strip();
        if (trimmed.isEmpty() || trimmed.length() > MAX_WORKSPACE_LENGTH) {
            return null;
        }
        for (int i = 0; i < trimmed.length(); i++) {
            if (Character.isISOControl(trimmed.charAt(i))) {
                return null;
            }
        }
        return trimmed;
    }
}
