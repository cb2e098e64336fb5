/**
 * Cost governance for every priced backend call.
 *
 * <p>{@link com.phillippitts.council.service.governor.CostGovernor} wraps each call with a
 * response-cache lookup, a pre-flight budget reservation against the
 * {@link com.phillippitts.council.service.governor.CostLedger}, the gateway call itself and an
 * atomic ledger append. Budget decisions are computed from the ledger's entries under the
 * ledger lock; the lock is never held across a gateway call.
 */
package com.phillippitts.council.service.governor;
