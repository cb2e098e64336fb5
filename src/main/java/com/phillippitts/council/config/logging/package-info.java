/**
 * Logging infrastructure and MDC (Mapped Diagnostic Context) configuration.
 *
 * <p>MDC Keys:
 * <ul>
 *   <li>{@code requestId}, {@code route} and, from the X-Workspace header, {@code workspace} -
 *       set per HTTP request by {@link com.phillippitts.council.config.logging.MdcFilter}</li>
 *   <li>{@code queryId}, {@code workspace} - set by the deliberation pipeline for one run,
 *       overriding the request's workspace label</li>
 * </ul>
 *
 * <p>Executors copy the MDC to worker threads, so backend and tool calls log with the
 * same keys as the request that started them.
 *
 * <p>Log Format:
 * <pre>
 * 2025-11-20 15:42:32.529 [council-pool-3] [requestId] [queryId] [workspace] LEVEL logger.name - message
 * </pre>
 */
package com.phillippitts.council.config.logging;
