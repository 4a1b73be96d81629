package com.sentinelv.core.quantum;

import com.sentinelv.core.config.QuantumThreatTable;
import com.sentinelv.core.model.CryptoFamily;
import com.sentinelv.core.model.QuantumAssessment;
import com.sentinelv.core.model.ThreatAlgorithm;
import com.sentinelv.core.model.Urgency;

import java.util.Objects;

/**
 * (암호 계열, 키 길이, 기준 연도) → 양자 위협 평가. 순수 함수, 네트워크/시계 접근 없음.
 *
 * years = max(0, 붕괴 예상 연도 - 기준 연도), 긴급도 경계는 포함(≤3 IMMEDIATE, ≤5 URGENT, ≤7 HIGH).
 * 수치는 QuantumThreatTable 의 휴리스틱 상수다.
 * 위협 알고리즘이 NONE 인 계열(PQC)은 긴급도와 무관하게 양자 위험 점수 0.
 */
public final class QuantumVulnerabilityAssessor {

    private final QuantumThreatTable table;

    public QuantumVulnerabilityAssessor(QuantumThreatTable table) {
        this.table = Objects.requireNonNull(table, "table");
    }

    public QuantumAssessment assess(CryptoFamily family, int keySize, int currentYear) {
        CryptoFamily f = (family == null ? CryptoFamily.RSA : family);
        QuantumThreatTable.Entry e = table.entry(f);

        int breakYear = table.breakYear(f, keySize, currentYear);
        int years = Math.max(0, breakYear - currentYear);
        Urgency urgency = table.urgencyFor(years);
        int score = (e.algorithm() == ThreatAlgorithm.NONE) ? 0 : table.riskScore(urgency);

        return new QuantumAssessment(
                f, keySize,
                e.algorithm(), e.speedup(),
                breakYear, years,
                urgency, score,
                years <= table.getHndlWindowYears());
    }

    public QuantumThreatTable getTable() { return table; }
}
