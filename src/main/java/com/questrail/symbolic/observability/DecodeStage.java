package com.questrail.symbolic.observability;

/**
 * Decode steps that emit verbose traces.
 */
public enum DecodeStage {
    SIMPLE_VECTOR,
    SIMPLE_MATRIX,
    HASH_MAP,
    FUNCTION
}
