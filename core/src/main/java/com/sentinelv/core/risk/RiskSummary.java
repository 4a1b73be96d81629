package com.sentinelv.core.risk;

import com.sentinelv.core.model.AssetReport;
import com.sentinelv.core.model.RiskLevel;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 결과 테이블 요약 (리포트/CLI 하단 표기용).
 * p95 정의: 정렬 후 index = floor(0.95 * (n - 1)), 0-based.
 */
public record RiskSummary(
        int count,
        int avg,
        int p95,
        int max,
        Map<RiskLevel, Integer> byLevel,
        int quantumVulnerableSoon,
        int harvestNowThreats
) {
    /** "곧 양자 취약" 기준: 붕괴까지 5년 이하 */
    public static final int SOON_YEARS = 5;

    public static final RiskSummary EMPTY = new RiskSummary(0, 0, 0, 0, emptyLevels(), 0, 0);

    public RiskSummary {
        Map<RiskLevel, Integer> copy = new EnumMap<>(RiskLevel.class);
        copy.putAll(Objects.requireNonNull(byLevel, "byLevel"));
        byLevel = Collections.unmodifiableMap(copy);
    }

    public static RiskSummary of(Collection<AssetReport> reports) {
        if (reports == null || reports.isEmpty()) return EMPTY;

        List<Integer> scores = new ArrayList<>(reports.size());
        Map<RiskLevel, Integer> levels = emptyLevels();
        int soon = 0;
        int hndl = 0;
        for (AssetReport r : reports) {
            if (r == null) continue;
            scores.add(r.getRiskScore());
            levels.merge(r.getRiskLevel(), 1, Integer::sum);
            if (r.getQuantum().yearsUntilVulnerable() <= SOON_YEARS) soon++;
            if (r.getQuantum().harvestNowThreat()) hndl++;
        }
        if (scores.isEmpty()) return EMPTY;

        Collections.sort(scores);
        int n = scores.size();
        long sum = 0;
        for (int s : scores) sum += s;
        int avg = (int) Math.round(sum / (double) n);
        int idx = (int) Math.floor(0.95 * (n - 1));
        return new RiskSummary(n, avg, scores.get(idx), scores.get(n - 1), levels, soon, hndl);
    }

    public int count(RiskLevel level) {
        return byLevel.getOrDefault(Objects.requireNonNull(level, "level"), 0);
    }

    private static Map<RiskLevel, Integer> emptyLevels() {
        Map<RiskLevel, Integer> m = new EnumMap<>(RiskLevel.class);
        for (RiskLevel l : RiskLevel.values()) m.put(l, 0);
        return m;
    }
}
