package com.sentinelv.core.model;

/** 종합 위험 등급. 점수 → 등급 매핑은 {@link #fromScore(int)} 하나뿐이다. */
public enum RiskLevel {
    LOW("Low"),
    MODERATE("Moderate"),
    HIGH("High - Quantum Vulnerable"),
    CRITICAL("Critical (HNDL)");

    private final String label;

    RiskLevel(String label) { this.label = label; }

    /** 대시보드/리포트 표기용 라벨 */
    public String label() { return label; }

    /** ≥80 CRITICAL, ≥60 HIGH, ≥40 MODERATE, 그 외 LOW */
    public static RiskLevel fromScore(int score) {
        if (score >= 80) return CRITICAL;
        if (score >= 60) return HIGH;
        if (score >= 40) return MODERATE;
        return LOW;
    }
}
