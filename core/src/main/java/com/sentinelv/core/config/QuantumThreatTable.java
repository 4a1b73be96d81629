package com.sentinelv.core.config;

import com.sentinelv.core.model.CryptoFamily;
import com.sentinelv.core.model.QuantumSpeedup;
import com.sentinelv.core.model.ThreatAlgorithm;
import com.sentinelv.core.model.Urgency;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * 양자 위협 상수 테이블 (불변).
 *
 * 붕괴 연도/긴급도 임계값/점수는 모두 예시용 휴리스틱 상수다. 어떤 표준에서 온 값이 아니므로
 * 컴플라이언스 보증으로 해석하면 안 된다. 전부 Builder/YAML로 바꿀 수 있다.
 *
 * 기본값:
 *  RSA  → SHOR,   ≤2048bit 2030 / 초과 2032
 *  ECC  → SHOR,   2030
 *  AES  → GROVER, 2040
 *  SHA  → GROVER, 2040
 *  PQC  → NONE,   기준 연도 + pqcHorizonYears
 *  긴급도: ≤3 IMMEDIATE(95), ≤5 URGENT(85), ≤7 HIGH(70), 그 외 MODERATE(50)
 */
public final class QuantumThreatTable {

    /** 계열별 위협 항목 */
    public record Entry(ThreatAlgorithm algorithm, QuantumSpeedup speedup, int breakYear) {}

    private final Map<CryptoFamily, Entry> entries;
    private final int rsaLargeKeyThreshold;
    private final int rsaLargeKeyBreakYear;
    private final int immediateMaxYears;
    private final int urgentMaxYears;
    private final int highMaxYears;
    private final Map<Urgency, Integer> riskScores;
    private final int hndlWindowYears;
    private final int pqcHorizonYears;

    private QuantumThreatTable(Builder b) {
        this.entries = Map.copyOf(b.entries);
        this.rsaLargeKeyThreshold = b.rsaLargeKeyThreshold;
        this.rsaLargeKeyBreakYear = b.rsaLargeKeyBreakYear;
        this.immediateMaxYears = b.immediateMaxYears;
        this.urgentMaxYears = b.urgentMaxYears;
        this.highMaxYears = b.highMaxYears;
        this.riskScores = Map.copyOf(b.riskScores);
        this.hndlWindowYears = b.hndlWindowYears;
        this.pqcHorizonYears = b.pqcHorizonYears;
    }

    private static final QuantumThreatTable DEFAULTS = builder().build();

    public static QuantumThreatTable defaults() { return DEFAULTS; }

    /** 모르는 계열(null)은 RSA로 간주 */
    public Entry entry(CryptoFamily family) {
        return entries.get(family == null ? CryptoFamily.RSA : family);
    }

    /** 키 길이를 반영한 붕괴 예상 연도. PQC는 currentYear + horizon */
    public int breakYear(CryptoFamily family, int keySize, int currentYear) {
        CryptoFamily f = (family == null ? CryptoFamily.RSA : family);
        if (f == CryptoFamily.PQC) return currentYear + pqcHorizonYears;
        if (f == CryptoFamily.RSA && keySize > rsaLargeKeyThreshold) return rsaLargeKeyBreakYear;
        return entry(f).breakYear();
    }

    /** 경계 포함: 하한 쪽(더 긴급한 티어)으로 귀속 */
    public Urgency urgencyFor(int yearsUntilVulnerable) {
        if (yearsUntilVulnerable <= immediateMaxYears) return Urgency.IMMEDIATE;
        if (yearsUntilVulnerable <= urgentMaxYears) return Urgency.URGENT;
        if (yearsUntilVulnerable <= highMaxYears) return Urgency.HIGH;
        return Urgency.MODERATE;
    }

    public int riskScore(Urgency urgency) { return riskScores.get(urgency); }

    public int getHndlWindowYears() { return hndlWindowYears; }
    public int getPqcHorizonYears() { return pqcHorizonYears; }
    public int getImmediateMaxYears() { return immediateMaxYears; }
    public int getUrgentMaxYears() { return urgentMaxYears; }
    public int getHighMaxYears() { return highMaxYears; }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.entries.putAll(entries);
        b.rsaLargeKeyThreshold = rsaLargeKeyThreshold;
        b.rsaLargeKeyBreakYear = rsaLargeKeyBreakYear;
        b.immediateMaxYears = immediateMaxYears;
        b.urgentMaxYears = urgentMaxYears;
        b.highMaxYears = highMaxYears;
        b.riskScores.putAll(riskScores);
        b.hndlWindowYears = hndlWindowYears;
        b.pqcHorizonYears = pqcHorizonYears;
        return b;
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private final Map<CryptoFamily, Entry> entries = new EnumMap<>(CryptoFamily.class);
        private int rsaLargeKeyThreshold = 2048;
        private int rsaLargeKeyBreakYear = 2032;
        private int immediateMaxYears = 3;
        private int urgentMaxYears = 5;
        private int highMaxYears = 7;
        private final Map<Urgency, Integer> riskScores = new EnumMap<>(Urgency.class);
        private int hndlWindowYears = 10;
        private int pqcHorizonYears = 50;

        private Builder() {
            entries.put(CryptoFamily.RSA, new Entry(ThreatAlgorithm.SHOR, QuantumSpeedup.EXPONENTIAL, 2030));
            entries.put(CryptoFamily.ECC, new Entry(ThreatAlgorithm.SHOR, QuantumSpeedup.EXPONENTIAL, 2030));
            entries.put(CryptoFamily.AES, new Entry(ThreatAlgorithm.GROVER, QuantumSpeedup.QUADRATIC, 2040));
            entries.put(CryptoFamily.SHA, new Entry(ThreatAlgorithm.GROVER, QuantumSpeedup.QUADRATIC, 2040));
            entries.put(CryptoFamily.PQC, new Entry(ThreatAlgorithm.NONE, QuantumSpeedup.NONE, 0));
            riskScores.put(Urgency.IMMEDIATE, 95);
            riskScores.put(Urgency.URGENT, 85);
            riskScores.put(Urgency.HIGH, 70);
            riskScores.put(Urgency.MODERATE, 50);
        }

        /** 계열 기본 붕괴 연도 변경 (알고리즘/가속 유형은 유지) */
        public Builder breakYear(CryptoFamily family, int year) {
            Objects.requireNonNull(family, "family");
            Entry e = entries.get(family);
            entries.put(family, new Entry(e.algorithm(), e.speedup(), year));
            return this;
        }
        public Builder rsaLargeKey(int thresholdBits, int breakYear) {
            this.rsaLargeKeyThreshold = thresholdBits;
            this.rsaLargeKeyBreakYear = breakYear;
            return this;
        }
        public Builder urgencyThresholds(int immediateMax, int urgentMax, int highMax) {
            this.immediateMaxYears = immediateMax;
            this.urgentMaxYears = urgentMax;
            this.highMaxYears = highMax;
            return this;
        }
        public Builder riskScore(Urgency urgency, int score) {
            riskScores.put(Objects.requireNonNull(urgency, "urgency"), score);
            return this;
        }
        public Builder hndlWindowYears(int years) { this.hndlWindowYears = years; return this; }
        public Builder pqcHorizonYears(int years) { this.pqcHorizonYears = years; return this; }

        public QuantumThreatTable build() {
            if (immediateMaxYears < 0 || immediateMaxYears > urgentMaxYears || urgentMaxYears > highMaxYears) {
                throw new IllegalArgumentException("urgency thresholds must satisfy 0 <= immediate <= urgent <= high");
            }
            for (Map.Entry<Urgency, Integer> e : riskScores.entrySet()) {
                if (e.getValue() < 0 || e.getValue() > 100) {
                    throw new IllegalArgumentException("riskScore for " + e.getKey() + " must be within 0..100");
                }
            }
            if (hndlWindowYears < 0) throw new IllegalArgumentException("hndlWindowYears must be >= 0");
            if (pqcHorizonYears < 0) throw new IllegalArgumentException("pqcHorizonYears must be >= 0");
            return new QuantumThreatTable(this);
        }
    }
}
