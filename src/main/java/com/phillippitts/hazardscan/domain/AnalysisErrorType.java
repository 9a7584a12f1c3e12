package com.phillippitts.hazardscan.domain;

/** Categories of user-visible analysis failure. */
public enum AnalysisErrorType {
    /** Input refused by security validation (oversized or malformed). */
    INPUT_REJECTED,
    /** A local model artifact failed its digest check. */
    MODEL_INTEGRITY_VIOLATION,
    /** No backend produced any result. */
    ALL_BACKENDS_FAILED,
    /** The orchestration pool is saturated; the caller may retry later. */
    OVERLOADED,
    /** The caller cancelled the request. */
    CANCELLED,
    /** Unexpected internal error. */
    INTERNAL
}
