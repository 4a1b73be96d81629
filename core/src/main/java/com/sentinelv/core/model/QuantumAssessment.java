package com.sentinelv.core.model;

/**
 * (암호 계열, 키 길이, 기준 연도)의 순수 함수 결과.
 * 모든 수치는 설정 가능한 휴리스틱 상수이며 측정값이 아니다.
 */
public record QuantumAssessment(
        CryptoFamily cryptoFamily,
        int keySize,
        ThreatAlgorithm threatAlgorithm,
        QuantumSpeedup quantumSpeedup,
        int vulnerabilityYear,
        int yearsUntilVulnerable,
        Urgency urgency,
        int quantumRiskScore,
        boolean harvestNowThreat
) {}
