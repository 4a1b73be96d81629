package com.sentinelv.core.model;

/** 자산 중요도 티어 (호스트 이름 휴리스틱으로 산출) */
public enum Criticality {
    CRITICAL,
    HIGH,
    MODERATE
}
