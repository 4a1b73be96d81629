package com.sentinelv.core.model;

/**
 * 스캔 모드(프리셋). 실제 설정값은 {@link com.sentinelv.core.config.ScanModeMatrix} 한 곳에서 관리한다.
 */
public enum ScanMode {
    /** 빠른 개요: 양자 분석 없음 */
    STANDARD_RECON,
    /** 양자 위협 평가 + PQC 권고 */
    DEEP_QUANTUM,
    /** 요청 간 지연(3s), 패시브 OSINT(CT 로그)만 */
    STEALTH,
    /** 확장 워드리스트 + 전체 분석 */
    COMPREHENSIVE
}
