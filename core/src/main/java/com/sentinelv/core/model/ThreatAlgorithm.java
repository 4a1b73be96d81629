package com.sentinelv.core.model;

/** 해당 암호 계열을 위협하는 양자 알고리즘 */
public enum ThreatAlgorithm {
    SHOR,
    GROVER,
    NONE
}
