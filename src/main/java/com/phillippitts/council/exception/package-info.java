/**
 * Council exception hierarchy.
 *
 * <ul>
 *   <li>{@link com.phillippitts.council.exception.CouncilException} - base for all council errors</li>
 *   <li>{@link com.phillippitts.council.exception.AdmissionDeniedException} - a priced call would
 *       exceed the daily or per-query budget; nothing was dispatched</li>
 *   <li>{@link com.phillippitts.council.exception.BackendFailureException} - one backend call
 *       failed; recorded and excluded, fatal only when it empties Stage1</li>
 *   <li>{@link com.phillippitts.council.exception.ParseFailureException} - malformed model output;
 *       always handled inside the stage that parsed it</li>
 *   <li>{@link com.phillippitts.council.exception.PipelineFailureException} - Stage1 produced no
 *       successful response</li>
 *   <li>{@link com.phillippitts.council.exception.ConfigurationException} - invalid configuration
 *       or missing collaborator, raised before any priced call</li>
 * </ul>
 *
 * @see com.phillippitts.council.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.council.exception;
