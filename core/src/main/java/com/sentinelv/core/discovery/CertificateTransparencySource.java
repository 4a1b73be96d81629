package com.sentinelv.core.discovery;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sentinelv.core.api.IAssetSource;
import com.sentinelv.core.http.CountingRetryPolicy;
import com.sentinelv.core.http.DefaultRetryPolicy;
import com.sentinelv.core.http.HttpFetcher;
import com.sentinelv.core.http.RetryPolicy;
import com.sentinelv.core.model.ScanConfig;
import com.sentinelv.core.model.ScanStats;
import com.sentinelv.core.model.SubdomainSource;
import com.sentinelv.core.util.DomainNames;
import com.sentinelv.core.util.Sleeper;
import com.sentinelv.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Supplier;

/**
 * Certificate Transparency 로그(crt.sh 호환 JSON) 조회.
 * 응답: [{"name_value": "a.example.com\n*.b.example.com", ...}, ...]
 *
 * 실패(전송 오류, 비 200, JSON 파싱 실패)는 WARN 로그 후 빈 집합.
 */
public final class CertificateTransparencySource implements IAssetSource {

    private static final Logger LOG = LoggerFactory.getLogger(CertificateTransparencySource.class);
    private static final StructuredLog SLOG = StructuredLog.get(CertificateTransparencySource.class);
    private static final ObjectMapper JSON = new ObjectMapper();

    private final HttpFetcher fetcher;
    private final Sleeper sleeper;
    private final ScanStats stats;
    private final Supplier<RetryPolicy> retryPolicy;

    public CertificateTransparencySource(HttpFetcher fetcher, Sleeper sleeper, ScanStats stats) {
        this(fetcher, sleeper, stats, DefaultRetryPolicy::new);
    }

    public CertificateTransparencySource(HttpFetcher fetcher, Sleeper sleeper, ScanStats stats,
                                         Supplier<RetryPolicy> retryPolicy) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.stats = Objects.requireNonNull(stats, "stats");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
    }

    @Override public SubdomainSource kind() { return SubdomainSource.CT_LOG; }

    @Override
    public Set<String> collect(String domain, ScanConfig config) throws InterruptedException {
        URI url;
        try {
            url = URI.create(config.getProviders().ctLogUrlFor(domain));
        } catch (IllegalArgumentException e) {
            LOG.warn("CT lookup skipped: bad URL template {}", config.getProviders().ctLogUrl());
            stats.addSourceFailure();
            return Set.of();
        }

        CountingRetryPolicy counting = new CountingRetryPolicy(retryPolicy.get());
        HttpFetcher.FetchResult res = fetcher.fetchWithRetry(url, counting, sleeper);
        if (!res.isOk()) {
            LOG.warn("CT lookup failed for {}: status={} retries={}", domain, res.statusCode(), counting.getRetryCount());
            SLOG.warn("source-failed", "source", kind(), "domain", domain, "status", res.statusCode());
            stats.addSourceFailure();
            return Set.of();
        }

        try {
            Set<String> names = parse(res.body(), domain, config.getCtEntryLimit());
            LOG.debug("CT lookup {} -> {} names ({}ms)", domain, names.size(), res.elapsedMs());
            return names;
        } catch (IOException e) {
            LOG.warn("CT payload for {} is not JSON: {}", domain, e.getMessage());
            SLOG.warn("source-failed", "source", kind(), "domain", domain, "reason", "malformed-json");
            stats.addSourceFailure();
            return Set.of();
        }
    }

    /**
     * CT JSON → 도메인 범위 안의 유효 호스트명.
     * 배열이 아닌 루트, 객체가 아닌 항목, 문자열이 아닌 name_value 는 건너뛴다.
     */
    static Set<String> parse(String body, String domain, int entryLimit) throws IOException {
        Set<String> out = new TreeSet<>();
        JsonNode root = JSON.readTree(body == null ? "" : body);
        if (root == null || !root.isArray()) return out;

        int seen = 0;
        for (JsonNode entry : root) {
            if (seen++ >= entryLimit) break;
            if (!entry.isObject()) continue;
            JsonNode nv = entry.get("name_value");
            if (nv == null || !nv.isTextual()) continue;

            for (String line : nv.asText().split("\n")) {
                String name = line.trim().toLowerCase(Locale.ROOT);
                if (name.startsWith("*.")) name = name.substring(2);
                if (DomainNames.isWithin(name, domain) && DomainNames.isValidHostname(name)) {
                    out.add(name);
                }
            }
        }
        return out;
    }
}
