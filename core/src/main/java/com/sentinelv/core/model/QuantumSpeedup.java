package com.sentinelv.core.model;

public enum QuantumSpeedup {
    EXPONENTIAL,
    QUADRATIC,
    NONE
}
