/**
 * Immutable domain model of one deliberation.
 *
 * <p>A {@link com.phillippitts.council.domain.Query} receives exactly one
 * {@link com.phillippitts.council.domain.IntentDecision}, at most one tool batch, between one and
 * five {@link com.phillippitts.council.domain.ModelResponse}s, any number of
 * {@link com.phillippitts.council.domain.PeerRanking}s and at most one synthesis and one verdict.
 * All types validate themselves in their constructors.
 */
package com.phillippitts.council.domain;
