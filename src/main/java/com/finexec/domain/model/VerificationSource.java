package com.finexec.domain.model;

/**
 * Origin of a balance verification outcome
 */
public enum VerificationSource {
    /** External verification service. */
    REMOTE,
    /** Local derived values, verification service disabled. */
    LOCAL,
    /** Service failed; assumed balanced. */
    FALLBACK
}
