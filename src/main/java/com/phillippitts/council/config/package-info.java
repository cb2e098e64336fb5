/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.council.config.ThreadPoolConfig} - council, tool and event
 *       executors with MDC propagation</li>
 *   <li>{@link com.phillippitts.council.config.ThreadPoolMetricsConfig} - Micrometer gauges
 *       for the council executor</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - typed {@code @ConfigurationProperties}</li>
 *   <li>{@code config.council} - governor beans and startup validation</li>
 *   <li>{@code config.logging} - MDC filter</li>
 * </ul>
 */
package com.phillippitts.council.config;
