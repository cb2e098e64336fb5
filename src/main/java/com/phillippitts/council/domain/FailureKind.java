package com.phillippitts.council.domain;

/**
 * Why a single priced backend call produced no usable response.
 */
public enum FailureKind {
    /** The gateway gave up waiting for the provider. */
    TIMEOUT,
    /** The call did not complete before the stage deadline. */
    STAGE_DEADLINE,
    PROVIDER_ERROR,
    RATE_LIMITED,
    /** The provider answered with an empty or malformed payload. */
    INVALID_RESPONSE,
    /** The cost governor refused the call before dispatch. */
    ADMISSION_DENIED,
    /** The council executor was saturated and refused the task; nothing was dispatched. */
    REJECTED,
    UNKNOWN
}
