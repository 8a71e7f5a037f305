package com.propertyintel.epc.model;

/**
 * Why a pagination session stopped.
 */
public enum TerminationReason {

    /** The API reported no further pages. Results are complete. */
    EXHAUSTED,

    /** A request failed after retries. Results are partial. */
    UPSTREAM_ERROR,

    /** The caller cancelled the session between pages. */
    CANCELLED
}
