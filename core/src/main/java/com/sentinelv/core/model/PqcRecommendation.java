package com.sentinelv.core.model;

/** 중요도 티어별 PQC 전환 권고 */
public record PqcRecommendation(
        Criticality criticality,
        String kemSuite,
        String signatureSuite,
        String hashSuite,
        String migrationPriority,
        String timeline,
        String hybridMode,
        String nistStandard
) {}
