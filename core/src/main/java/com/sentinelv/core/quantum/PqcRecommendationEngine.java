package com.sentinelv.core.quantum;

import com.sentinelv.core.model.Criticality;
import com.sentinelv.core.model.PqcRecommendation;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/** 중요도 티어 → NIST PQC 스위트 (FIPS 203 ML-KEM, FIPS 204 ML-DSA). 양자 평가와 독립. */
public final class PqcRecommendationEngine {

    public static final String HYBRID_NOTE = "Combine with classical crypto during transition";
    public static final String NIST_STANDARDS = "FIPS 203, 204, 205";

    private static final Map<Criticality, PqcRecommendation> TABLE = new EnumMap<>(Criticality.class);

    static {
        put(Criticality.CRITICAL, "ML-KEM-1024", "ML-DSA-87", "SHA-3-512", "P0 - Immediate", "0-3 months");
        put(Criticality.HIGH,     "ML-KEM-768",  "ML-DSA-65", "SHA-3-256", "P1 - Urgent",    "3-6 months");
        put(Criticality.MODERATE, "ML-KEM-512",  "ML-DSA-44", "SHA-3-256", "P2 - Standard",  "6-12 months");
    }

    private static void put(Criticality c, String kem, String sig, String hash, String priority, String timeline) {
        TABLE.put(c, new PqcRecommendation(c, kem, sig, hash, priority, timeline, HYBRID_NOTE, NIST_STANDARDS));
    }

    public PqcRecommendation recommend(Criticality criticality) {
        return TABLE.get(Objects.requireNonNull(criticality, "criticality"));
    }
}
