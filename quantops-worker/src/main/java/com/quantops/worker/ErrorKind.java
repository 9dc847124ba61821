package com.quantops.worker;

/**
 * Closed set of domain failure categories an operation function can raise.
 */
public enum ErrorKind {
    TRAINING_DATA,
    BACKTEST_DATA,
    MODEL_LOAD,
    INVALID_REQUEST,
    QUALITY_GATE,
    PHASE_FAILED,
    INTERNAL
}
