package com.sentinelv.core.model;

import com.sentinelv.core.config.CriticalityRules;
import com.sentinelv.core.config.ProviderEndpoints;
import com.sentinelv.core.config.QuantumThreatTable;
import com.sentinelv.core.config.ScanModeMatrix;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * 스캔 설정 (불변). 스캔이 시작되면 바뀌지 않는다.
 *
 * 생성은 프리셋에서 출발하는 것을 권장: {@code ScanConfig.forMode(ScanMode.DEEP_QUANTUM)} 또는
 * {@code ScanModeMatrix.preset(mode).maxAssets(5).build()}. YAML 오버레이는 YamlConfigLoader.
 * 코어는 시스템 프로퍼티/환경변수를 읽지 않는다. 설정 표면은 이 객체뿐.
 */
public final class ScanConfig {

    /** 자산당 네트워크 호출 수 상한: DNS, 지리(1차), 지리(2차), TLS */
    public static final int PROBE_CALLS_PER_ASSET = 4;

    /** 그 중 호스트 허가를 잡는 호출: 지리 2회 + TLS (DNS 는 허가 없음) */
    public static final int PERMIT_CALLS_PER_ASSET = 3;

    /** DNS는 짧게: min(timeout, 5s) */
    public static final Duration DNS_TIMEOUT_CAP = Duration.ofSeconds(5);

    private final ScanMode mode;
    private final int maxAssets;
    private final boolean enableQuantum;
    private final boolean enableTlsCheck;
    private final boolean enableGeo;
    private final Duration perRequestDelay;
    private final Duration timeout;
    private final Set<SubdomainSource> subdomainSources;
    private final int concurrency;               // 워커 풀 크기
    private final int maxConnectionsPerHost;     // 호스트별 동시 연결 상한
    private final int ctEntryLimit;              // CT 응답에서 읽을 최대 항목 수
    private final CryptoFamily assumedCryptoFamily;
    private final int assumedKeySize;
    private final ProviderEndpoints providers;
    private final QuantumThreatTable threatTable;
    private final CriticalityRules criticalityRules;

    private ScanConfig(Builder b) {
        this.mode = b.mode;
        this.maxAssets = b.maxAssets;
        this.enableQuantum = b.enableQuantum;
        this.enableTlsCheck = b.enableTlsCheck;
        this.enableGeo = b.enableGeo;
        this.perRequestDelay = b.perRequestDelay;
        this.timeout = b.timeout;
        this.subdomainSources = Set.copyOf(b.subdomainSources);
        this.concurrency = b.concurrency;
        this.maxConnectionsPerHost = b.maxConnectionsPerHost;
        this.ctEntryLimit = b.ctEntryLimit;
        this.assumedCryptoFamily = b.assumedCryptoFamily;
        this.assumedKeySize = b.assumedKeySize;
        this.providers = b.providers;
        this.threatTable = b.threatTable;
        this.criticalityRules = (b.criticalityRules != null ? b.criticalityRules : CriticalityRules.defaults());
    }

    // ---------- getters ----------
    public ScanMode getMode() { return mode; }
    public int getMaxAssets() { return maxAssets; }
    public boolean isEnableQuantum() { return enableQuantum; }
    public boolean isEnableTlsCheck() { return enableTlsCheck; }
    public boolean isEnableGeo() { return enableGeo; }
    public Duration getPerRequestDelay() { return perRequestDelay; }
    public Duration getTimeout() { return timeout; }
    public Set<SubdomainSource> getSubdomainSources() { return subdomainSources; }
    public boolean hasSource(SubdomainSource s) { return subdomainSources.contains(s); }
    public int getConcurrency() { return concurrency; }
    public int getMaxConnectionsPerHost() { return maxConnectionsPerHost; }
    public int getCtEntryLimit() { return ctEntryLimit; }
    public CryptoFamily getAssumedCryptoFamily() { return assumedCryptoFamily; }
    public int getAssumedKeySize() { return assumedKeySize; }
    public ProviderEndpoints getProviders() { return providers; }
    public QuantumThreatTable getThreatTable() { return threatTable; }
    public CriticalityRules getCriticalityRules() { return criticalityRules; }

    // ---------- helpers ----------
    public long getTimeoutMs() { return timeout.toMillis(); }

    /** Socket 등 int ms 필요 시 편의 메서드 */
    public int getTimeoutMsInt() {
        long ms = getTimeoutMs();
        return (ms > Integer.MAX_VALUE) ? Integer.MAX_VALUE : (int) ms;
    }

    public Duration getDnsTimeout() {
        return timeout.compareTo(DNS_TIMEOUT_CAP) < 0 ? timeout : DNS_TIMEOUT_CAP;
    }

    /**
     * 허가 대기 차례 수: ceil(concurrency / maxConnectionsPerHost).
     * 작업 수가 호스트 상한을 넘으면 허가 하나를 앞선 보유자들이 이만큼의 차례 동안 쥐고 있을 수 있다.
     */
    public int getPermitWaves() {
        return (concurrency + maxConnectionsPerHost - 1) / maxConnectionsPerHost;
    }

    /**
     * 자산 1건의 하드 예산: DNS timeout + 허가 호출마다 (대기 차례 × timeout) + 호출별 지연.
     * concurrency ≤ maxConnectionsPerHost 이면 timeout × 4 + 지연 × 4.
     */
    public Duration getAssetBudget() {
        long permitSlots = (long) PERMIT_CALLS_PER_ASSET * getPermitWaves();
        return timeout.multipliedBy(PROBE_CALLS_PER_ASSET - PERMIT_CALLS_PER_ASSET + permitSlots)
                .plus(perRequestDelay.multipliedBy(PROBE_CALLS_PER_ASSET));
    }

    public static ScanConfig forMode(ScanMode mode) {
        return ScanModeMatrix.preset(mode).build();
    }

    public static ScanConfig defaults() { return forMode(ScanMode.DEEP_QUANTUM); }

    public Builder toBuilder() {
        return new Builder()
                .mode(mode)
                .maxAssets(maxAssets)
                .enableQuantum(enableQuantum)
                .enableTlsCheck(enableTlsCheck)
                .enableGeo(enableGeo)
                .perRequestDelay(perRequestDelay)
                .timeout(timeout)
                .subdomainSources(subdomainSources)
                .concurrency(concurrency)
                .maxConnectionsPerHost(maxConnectionsPerHost)
                .ctEntryLimit(ctEntryLimit)
                .assumedCrypto(assumedCryptoFamily, assumedKeySize)
                .providers(providers)
                .threatTable(threatTable)
                .criticalityRules(criticalityRules);
    }

    public static Builder builder() { return new Builder(); }

    @Override public String toString() {
        return "ScanConfig{mode=" + mode + ", maxAssets=" + maxAssets
                + ", quantum=" + enableQuantum + ", tls=" + enableTlsCheck + ", geo=" + enableGeo
                + ", delay=" + perRequestDelay.toMillis() + "ms, timeout=" + timeout.toMillis() + "ms"
                + ", sources=" + subdomainSources + ", cc=" + concurrency + "}";
    }

    public static final class Builder {
        private ScanMode mode = ScanMode.DEEP_QUANTUM;
        private int maxAssets = 25;
        private boolean enableQuantum = true;
        private boolean enableTlsCheck = true;
        private boolean enableGeo = true;
        private Duration perRequestDelay = Duration.ZERO;
        private Duration timeout = Duration.ofSeconds(10);
        private Set<SubdomainSource> subdomainSources =
                EnumSet.of(SubdomainSource.CT_LOG, SubdomainSource.WORDLIST_COMMON);
        private int concurrency = 10;
        private int maxConnectionsPerHost = 5;
        private int ctEntryLimit = 100;
        private CryptoFamily assumedCryptoFamily = CryptoFamily.RSA;
        private int assumedKeySize = 2048;
        private ProviderEndpoints providers = ProviderEndpoints.defaults();
        private QuantumThreatTable threatTable = QuantumThreatTable.defaults();
        private CriticalityRules criticalityRules;   // null이면 클래스패스 기본

        private Builder() {}

        public Builder mode(ScanMode mode) { this.mode = mode; return this; }
        public Builder maxAssets(int maxAssets) { this.maxAssets = maxAssets; return this; }
        public Builder enableQuantum(boolean v) { this.enableQuantum = v; return this; }
        public Builder enableTlsCheck(boolean v) { this.enableTlsCheck = v; return this; }
        public Builder enableGeo(boolean v) { this.enableGeo = v; return this; }
        public Builder perRequestDelay(Duration d) { this.perRequestDelay = d; return this; }
        public Builder timeout(Duration d) { this.timeout = d; return this; }
        public Builder subdomainSources(Set<SubdomainSource> s) {
            this.subdomainSources = (s == null || s.isEmpty()) ? EnumSet.noneOf(SubdomainSource.class) : EnumSet.copyOf(s);
            return this;
        }
        public Builder concurrency(int concurrency) { this.concurrency = Math.max(1, concurrency); return this; }
        public Builder maxConnectionsPerHost(int v) { this.maxConnectionsPerHost = Math.max(1, v); return this; }
        public Builder ctEntryLimit(int v) { this.ctEntryLimit = v; return this; }
        public Builder assumedCrypto(CryptoFamily family, int keySize) {
            this.assumedCryptoFamily = family;
            this.assumedKeySize = keySize;
            return this;
        }
        public Builder providers(ProviderEndpoints p) { this.providers = p; return this; }
        public Builder threatTable(QuantumThreatTable t) { this.threatTable = t; return this; }
        public Builder criticalityRules(CriticalityRules r) { this.criticalityRules = r; return this; }

        /** 검증 후 생성. 잘못된 값은 네트워크 활동 전에 여기서 거부된다. */
        public ScanConfig build() {
            Objects.requireNonNull(mode, "mode");
            if (maxAssets < 1) throw new IllegalArgumentException("maxAssets must be >= 1");
            if (timeout == null || timeout.isNegative() || timeout.isZero())
                throw new IllegalArgumentException("timeout must be > 0");
            if (perRequestDelay == null || perRequestDelay.isNegative())
                throw new IllegalArgumentException("perRequestDelay must be >= 0");
            if (subdomainSources.isEmpty())
                throw new IllegalArgumentException("subdomainSources must not be empty");
            if (ctEntryLimit < 0) throw new IllegalArgumentException("ctEntryLimit must be >= 0");
            Objects.requireNonNull(assumedCryptoFamily, "assumedCryptoFamily");
            if (assumedKeySize < 1) throw new IllegalArgumentException("assumedKeySize must be >= 1");
            Objects.requireNonNull(providers, "providers");
            Objects.requireNonNull(threatTable, "threatTable");
            return new ScanConfig(this);
        }
    }
}
