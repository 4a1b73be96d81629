package com.sentinelv.core.risk;

import com.sentinelv.core.config.QuantumThreatTable;
import com.sentinelv.core.model.Asset;
import com.sentinelv.core.model.AssetReport;
import com.sentinelv.core.model.Criticality;
import com.sentinelv.core.model.CryptoFamily;
import com.sentinelv.core.model.GeoRecord;
import com.sentinelv.core.model.QuantumAssessment;
import com.sentinelv.core.model.RiskLevel;
import com.sentinelv.core.model.TlsRecord;
import com.sentinelv.core.quantum.PqcRecommendationEngine;
import com.sentinelv.core.quantum.QuantumVulnerabilityAssessor;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * p95 정의 가정: index = floor(0.95 * (n - 1))  (0-based)
 */
class RiskSummaryTest {

    private static final QuantumVulnerabilityAssessor ASSESSOR =
            new QuantumVulnerabilityAssessor(QuantumThreatTable.defaults());

    private static List<AssetReport> reports(QuantumAssessment q, int... scores) {
        List<AssetReport> out = new ArrayList<>();
        int i = 0;
        for (int s : scores) {
            out.add(AssetReport.builder()
                    .asset(new Asset("h" + (i++) + ".example.com", Criticality.HIGH))
                    .geo(GeoRecord.disabled("10.0.0.1"))
                    .tls(TlsRecord.notChecked())
                    .quantum(q)
                    .pqc(new PqcRecommendationEngine().recommend(Criticality.HIGH))
                    .riskScore(s)
                    .riskLevel(RiskLevel.fromScore(s))
                    .remediation("x")
                    .build());
        }
        return out;
    }

    @Test
    void avg_p95_max() {
        // 10개: 10,20,...,100 → p95 = 정렬[8] = 90
        RiskSummary rs = RiskSummary.of(reports(ASSESSOR.assess(CryptoFamily.AES, 256, 2026),
                10, 20, 30, 40, 50, 60, 70, 80, 90, 100));
        assertEquals(10, rs.count());
        assertEquals(55, rs.avg());
        assertEquals(90, rs.p95());
        assertEquals(100, rs.max());
        assertEquals(3, rs.count(RiskLevel.CRITICAL));
        assertEquals(2, rs.count(RiskLevel.HIGH));
        assertEquals(2, rs.count(RiskLevel.MODERATE));
        assertEquals(3, rs.count(RiskLevel.LOW));
        assertEquals(0, rs.quantumVulnerableSoon());
        assertEquals(0, rs.harvestNowThreats());
    }

    @Test
    void heavy_tail() {
        // p95 = floor(0.95*4) = 3 → 10
        RiskSummary rs = RiskSummary.of(reports(ASSESSOR.assess(CryptoFamily.AES, 256, 2026), 10, 10, 10, 10, 90));
        assertEquals(26, rs.avg());
        assertEquals(10, rs.p95());
        assertEquals(90, rs.max());
    }

    @Test
    void quantum_counters() {
        RiskSummary rs = RiskSummary.of(reports(ASSESSOR.assess(CryptoFamily.RSA, 2048, 2026), 68, 83));
        assertEquals(2, rs.quantumVulnerableSoon());
        assertEquals(2, rs.harvestNowThreats());
    }

    @Test
    void empty_input() {
        assertSame(RiskSummary.EMPTY, RiskSummary.of(List.of()));
        assertSame(RiskSummary.EMPTY, RiskSummary.of(null));
        assertEquals(0, RiskSummary.EMPTY.count(RiskLevel.CRITICAL));
    }
}
