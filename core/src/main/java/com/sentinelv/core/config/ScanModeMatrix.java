package com.sentinelv.core.config;

import com.sentinelv.core.model.ScanConfig;
import com.sentinelv.core.model.ScanMode;
import com.sentinelv.core.model.SubdomainSource;

import java.time.Duration;
import java.util.EnumSet;

/**
 * 모드(프리셋)별 설정 중앙 테이블.
 * - 여기만 수정하면 모드별 동작이 바뀜
 *
 *   모드            | 자산 | 양자 | 지연 | 소스
 *   STANDARD_RECON  | 10   | OFF  | -    | CT + common
 *   DEEP_QUANTUM    | 25   | ON   | -    | CT + common
 *   STEALTH         | 15   | ON   | 3s   | CT (패시브 OSINT)
 *   COMPREHENSIVE   | 50   | ON   | -    | CT + common + extended
 */
public final class ScanModeMatrix {
    private ScanModeMatrix() {}

    public static final Duration STEALTH_DELAY = Duration.ofSeconds(3);

    public static int maxAssets(ScanMode m) {
        return switch (m) {
            case STANDARD_RECON -> 10;
            case DEEP_QUANTUM -> 25;
            case STEALTH -> 15;
            case COMPREHENSIVE -> 50;
        };
    }

    public static boolean quantum(ScanMode m) {
        return m != ScanMode.STANDARD_RECON;
    }

    public static Duration perRequestDelay(ScanMode m) {
        return m == ScanMode.STEALTH ? STEALTH_DELAY : Duration.ZERO;
    }

    public static EnumSet<SubdomainSource> sources(ScanMode m) {
        return switch (m) {
            case STANDARD_RECON, DEEP_QUANTUM -> EnumSet.of(SubdomainSource.CT_LOG, SubdomainSource.WORDLIST_COMMON);
            case STEALTH -> EnumSet.of(SubdomainSource.CT_LOG);
            case COMPREHENSIVE -> EnumSet.allOf(SubdomainSource.class);
        };
    }

    /** 스텔스는 동시성도 낮춘다 (대상 도메인에 대한 동시 연결 최소화) */
    public static int concurrency(ScanMode m) {
        return m == ScanMode.STEALTH ? 2 : 10;
    }

    /** 프리셋에서 출발하는 빌더. 개별 값은 이후 덮어쓸 수 있다. */
    public static ScanConfig.Builder preset(ScanMode m) {
        if (m == null) m = ScanMode.DEEP_QUANTUM;
        return ScanConfig.builder()
                .mode(m)
                .maxAssets(maxAssets(m))
                .enableQuantum(quantum(m))
                .enableTlsCheck(true)
                .enableGeo(true)
                .perRequestDelay(perRequestDelay(m))
                .timeout(Duration.ofSeconds(10))
                .subdomainSources(sources(m))
                .concurrency(concurrency(m));
    }
}
