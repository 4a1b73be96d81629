package com.sentinelv.core.model;

import java.time.Instant;
import java.util.Objects;

/** 자산 단위 최종 결과. 생성 후 불변, 모든 필드가 채워진 상태로만 만들어진다. */
public final class AssetReport {
    private final Asset asset;
    private final GeoRecord geo;
    private final TlsRecord tls;
    private final QuantumAssessment quantum;
    private final PqcRecommendation pqc;
    private final int riskScore;          // 0..100
    private final RiskLevel riskLevel;
    private final String remediation;     // 비어 있지 않음
    private final Instant assessedAt;

    private AssetReport(Builder b) {
        this.asset = b.asset;
        this.geo = b.geo;
        this.tls = b.tls;
        this.quantum = b.quantum;
        this.pqc = b.pqc;
        this.riskScore = b.riskScore;
        this.riskLevel = b.riskLevel;
        this.remediation = b.remediation;
        this.assessedAt = (b.assessedAt == null ? Instant.now() : b.assessedAt);
    }

    public Asset getAsset() { return asset; }
    public String getHostname() { return asset.getHostname(); }
    public GeoRecord getGeo() { return geo; }
    public TlsRecord getTls() { return tls; }
    public QuantumAssessment getQuantum() { return quantum; }
    public PqcRecommendation getPqc() { return pqc; }
    public int getRiskScore() { return riskScore; }
    public RiskLevel getRiskLevel() { return riskLevel; }
    public String getRiskLabel() { return riskLevel.label(); }
    public String getRemediation() { return remediation; }
    public Instant getAssessedAt() { return assessedAt; }

    @Override public String toString() {
        return "AssetReport{" + asset.getHostname() + " score=" + riskScore + " level=" + riskLevel + "}";
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private Asset asset;
        private GeoRecord geo;
        private TlsRecord tls;
        private QuantumAssessment quantum;
        private PqcRecommendation pqc;
        private int riskScore;
        private RiskLevel riskLevel;
        private String remediation;
        private Instant assessedAt;

        public Builder asset(Asset asset) { this.asset = asset; return this; }
        public Builder geo(GeoRecord geo) { this.geo = geo; return this; }
        public Builder tls(TlsRecord tls) { this.tls = tls; return this; }
        public Builder quantum(QuantumAssessment quantum) { this.quantum = quantum; return this; }
        public Builder pqc(PqcRecommendation pqc) { this.pqc = pqc; return this; }
        public Builder riskScore(int riskScore) { this.riskScore = riskScore; return this; }
        public Builder riskLevel(RiskLevel riskLevel) { this.riskLevel = riskLevel; return this; }
        public Builder remediation(String remediation) { this.remediation = remediation; return this; }
        public Builder assessedAt(Instant assessedAt) { this.assessedAt = assessedAt; return this; }

        public AssetReport build() {
            Objects.requireNonNull(asset, "asset");
            Objects.requireNonNull(geo, "geo");
            Objects.requireNonNull(tls, "tls");
            Objects.requireNonNull(quantum, "quantum");
            Objects.requireNonNull(pqc, "pqc");
            Objects.requireNonNull(riskLevel, "riskLevel");
            if (riskScore < 0 || riskScore > 100) {
                throw new IllegalArgumentException("riskScore must be within 0..100: " + riskScore);
            }
            if (remediation == null || remediation.isBlank()) {
                throw new IllegalArgumentException("remediation must not be empty");
            }
            return new AssetReport(this);
        }
    }
}
