/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>This package contains the HTTP/REST boundary of the application, following a
 * 3-tier architecture where presentation depends on service but not vice versa.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - REST endpoints under {@code /api/council}</li>
 *   <li>{@code presentation.exception} - Global exception handling for HTTP responses</li>
 * </ul>
 *
 * <p>Controllers are thin adapters: the deliberation logic lives in
 * {@link com.phillippitts.council.service.pipeline}, and exception handlers map council
 * exceptions to HTTP status codes.
 */
package com.phillippitts.council.presentation;
