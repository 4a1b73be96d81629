package com.sentinelv.core.model;

/** 양자 대응 긴급도. 선언 순서 = 긴급한 순서 */
public enum Urgency {
    IMMEDIATE,
    URGENT,
    HIGH,
    MODERATE;

    /** PQC 마이그레이션 조치가 필요한 티어인지 */
    public boolean requiresMigration() {
        return this == IMMEDIATE || this == URGENT;
    }
}
