package com.sentinelv.core.risk;

import com.sentinelv.core.model.Asset;
import com.sentinelv.core.model.AssetReport;
import com.sentinelv.core.model.GeoRecord;
import com.sentinelv.core.model.PqcRecommendation;
import com.sentinelv.core.model.QuantumAssessment;
import com.sentinelv.core.model.RiskLevel;
import com.sentinelv.core.model.ScanConfig;
import com.sentinelv.core.model.TlsRecord;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 자산 1건의 관찰값 → 0..100 위험 점수, 등급, 조치 문구.
 *
 * 가산 항목:
 *  - 중요도: CRITICAL 40 / HIGH 25 / MODERATE 15
 *  - TLS (점검 시): 무효 20, 유효하지만 PQC 아님 15
 *  - 양자 (활성 시): min(30, quantumRiskScore / 3)
 *  - 지리 (활성 시): 미해석 +10
 * 같은 입력이면 항상 같은 결과(assessedAt 제외).
 */
public final class RiskAggregator {

    public static final String CLAUSE_SEPARATOR = " | ";
    public static final String DEFAULT_REMEDIATION = "Maintain quarterly security audits and monitoring";
    public static final String DEPLOY_CERTIFICATE = "Deploy valid SSL/TLS certificate";
    public static final String ENABLE_HYBRID = "Enable hybrid classical-PQC mode";
    public static final String QUANTUM_THREAT_PREFIX = "QUANTUM THREAT: Migrate to ";

    static final int TLS_INVALID_POINTS = 20;
    static final int TLS_CLASSICAL_POINTS = 15;
    static final int QUANTUM_CAP = 30;
    static final int GEO_UNKNOWN_POINTS = 10;

    public AssetReport score(Asset asset, GeoRecord geo, TlsRecord tls,
                             QuantumAssessment quantum, PqcRecommendation pqc,
                             ScanConfig config, Instant assessedAt) {
        Objects.requireNonNull(asset, "asset");
        Objects.requireNonNull(geo, "geo");
        Objects.requireNonNull(tls, "tls");
        Objects.requireNonNull(quantum, "quantum");
        Objects.requireNonNull(pqc, "pqc");
        Objects.requireNonNull(config, "config");

        int score = criticalityPoints(asset);

        if (config.isEnableTlsCheck()) {
            if (!tls.valid()) score += TLS_INVALID_POINTS;
            else if (!tls.quantumSafe()) score += TLS_CLASSICAL_POINTS;
        }
        if (config.isEnableQuantum()) {
            score += Math.min(QUANTUM_CAP, quantum.quantumRiskScore() / 3);
        }
        if (config.isEnableGeo() && !geo.resolved()) {
            score += GEO_UNKNOWN_POINTS;
        }
        score = Math.max(0, Math.min(100, score));

        return AssetReport.builder()
                .asset(asset)
                .geo(geo)
                .tls(tls)
                .quantum(quantum)
                .pqc(pqc)
                .riskScore(score)
                .riskLevel(RiskLevel.fromScore(score))
                .remediation(remediation(tls, quantum, pqc, config))
                .assessedAt(assessedAt)
                .build();
    }

    private static int criticalityPoints(Asset asset) {
        switch (asset.getCriticality()) {
            case CRITICAL: return 40;
            case HIGH:     return 25;
            case MODERATE: return 15;
            default: throw new IllegalStateException("unhandled criticality " + asset.getCriticality());
        }
    }

    static String remediation(TlsRecord tls, QuantumAssessment quantum, PqcRecommendation pqc, ScanConfig config) {
        List<String> clauses = new ArrayList<>(3);
        if (config.isEnableQuantum() && quantum.urgency().requiresMigration()) {
            clauses.add(QUANTUM_THREAT_PREFIX + pqc.kemSuite());
        }
        if (config.isEnableTlsCheck()) {
            if (!tls.valid()) clauses.add(DEPLOY_CERTIFICATE);
            if (!tls.quantumSafe()) clauses.add(ENABLE_HYBRID);
        }
        return clauses.isEmpty() ? DEFAULT_REMEDIATION : String.join(CLAUSE_SEPARATOR, clauses);
    }
}
