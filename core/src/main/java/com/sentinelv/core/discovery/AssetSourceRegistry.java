package com.sentinelv.core.discovery;

import com.sentinelv.core.api.IAssetDiscovery;
import com.sentinelv.core.api.IAssetSource;
import com.sentinelv.core.http.ScanSession;
import com.sentinelv.core.model.ScanConfig;
import com.sentinelv.core.model.ScanStats;
import com.sentinelv.core.model.SubdomainSource;
import com.sentinelv.core.util.DomainNames;
import com.sentinelv.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 설정에 켜진 소스들을 합쳐 감사 대상 호스트 집합을 만든다.
 *
 *  - 루트 도메인은 항상 포함
 *  - 도메인 범위 밖/문법 오류 이름은 버림, 중복 제거
 *  - maxAssets 초과 시 루트 + 사전순으로 가장 작은 (maxAssets-1)개만 유지
 *  - 소스 하나의 실패는 그 소스의 기여만 비운다
 */
public final class AssetSourceRegistry implements IAssetDiscovery {

    private static final Logger LOG = LoggerFactory.getLogger(AssetSourceRegistry.class);
    private static final StructuredLog SLOG = StructuredLog.get(AssetSourceRegistry.class);

    private final List<IAssetSource> sources;
    private final ScanStats stats;

    public AssetSourceRegistry(List<IAssetSource> sources, ScanStats stats) {
        this.sources = List.copyOf(Objects.requireNonNull(sources, "sources"));
        this.stats = Objects.requireNonNull(stats, "stats");
    }

    /** 기본 구성: CT + 번들 워드리스트 2종 (사용 여부는 config.subdomainSources 가 결정) */
    public static AssetSourceRegistry standard(ScanSession session) {
        List<IAssetSource> list = new ArrayList<>();
        list.add(new CertificateTransparencySource(session.fetcher(), session.sleeper(), session.stats()));
        list.add(WordlistSource.bundled(SubdomainSource.WORDLIST_COMMON));
        list.add(WordlistSource.bundled(SubdomainSource.WORDLIST_EXTENDED));
        return new AssetSourceRegistry(list, session.stats());
    }

    @Override
    public SortedSet<String> discover(String domain, ScanConfig config) throws InterruptedException {
        Objects.requireNonNull(config, "config");
        String root = DomainNames.requireDomain(domain);

        Set<String> all = new TreeSet<>();
        for (IAssetSource src : sources) {
            if (!config.hasSource(src.kind())) continue;
            Set<String> got;
            try {
                got = src.collect(root, config);
            } catch (RuntimeException e) {
                LOG.warn("Source {} failed for {}: {}", src.kind(), root, e.toString());
                SLOG.error("source-failed", e, "source", src.kind(), "domain", root);
                stats.addSourceFailure();
                continue;
            }
            int kept = 0;
            for (String raw : got) {
                String name = DomainNames.normalize(raw);
                if (DomainNames.isWithin(name, root) && DomainNames.isValidHostname(name) && all.add(name)) kept++;
            }
            LOG.debug("Source {} -> {} new names", src.kind(), kept);
        }

        SortedSet<String> result = truncate(root, all, config.getMaxAssets());
        LOG.info("Discovery {}: candidates={}, kept={}", root, all.size() + (all.contains(root) ? 0 : 1), result.size());
        SLOG.info("discovery-done", "domain", root, "candidates", all.size(), "kept", result.size());
        return result;
    }

    /** 루트 우선, 나머지는 사전순 앞에서부터 */
    static SortedSet<String> truncate(String root, Set<String> names, int maxAssets) {
        TreeSet<String> out = new TreeSet<>();
        out.add(root);
        for (String n : new TreeSet<>(names)) {
            if (out.size() >= maxAssets) break;
            out.add(n);
        }
        return Collections.unmodifiableSortedSet(out);
    }

    public List<IAssetSource> getSources() { return sources; }
}
