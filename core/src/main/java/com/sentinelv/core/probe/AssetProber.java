package com.sentinelv.core.probe;

import com.sentinelv.core.api.IAssetProber;
import com.sentinelv.core.api.IGeoProvider;
import com.sentinelv.core.http.ScanSession;
import com.sentinelv.core.model.GeoRecord;
import com.sentinelv.core.model.ProbeResult;
import com.sentinelv.core.model.ScanConfig;
import com.sentinelv.core.model.ScanStats;
import com.sentinelv.core.model.TlsRecord;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 자산 1건: DNS → (지리) → (TLS). DNS 실패 시 이후 단계는 건너뛰고 센티널.
 * 단계 사이마다 인터럽트(워치독/취소)를 확인한다.
 */
public final class AssetProber implements IAssetProber {

    private final DnsResolver dns;
    private final GeoLocator geo;
    private final TlsProbe tls;
    private final ScanStats stats;

    public AssetProber(DnsResolver dns, GeoLocator geo, TlsProbe tls, ScanStats stats) {
        this.dns = Objects.requireNonNull(dns, "dns");
        this.geo = Objects.requireNonNull(geo, "geo");
        this.tls = Objects.requireNonNull(tls, "tls");
        this.stats = Objects.requireNonNull(stats, "stats");
    }

    /** 세션 자원으로 실제 네트워크 구성 */
    public static AssetProber forSession(ScanSession s) {
        ScanConfig cfg = s.config();
        DnsResolver dns = new DnsResolver(s.dnsExecutor(), s.pacer(), s.stats(), cfg.getDnsTimeout(), DnsResolver.SYSTEM);
        List<IGeoProvider> chain = List.of(
                new IpApiProvider(s.fetcher(), cfg.getProviders()),
                new IpApiCoProvider(s.fetcher(), cfg.getProviders()));
        TlsProbe tls = TlsProbe.platformDefault(s.permits(), s.rootDomain(), s.pacer(), s.stats(), cfg.getTimeout());
        return new AssetProber(dns, new GeoLocator(chain, s.stats()), tls, s.stats());
    }

    @Override
    public ProbeResult probe(String hostname, ScanConfig config) throws InterruptedException {
        Objects.requireNonNull(hostname, "hostname");
        Objects.requireNonNull(config, "config");

        Optional<String> ip = dns.resolve(hostname);
        checkInterrupt();
        if (ip.isEmpty()) {
            stats.addDnsFailure();
            return ProbeResult.unresolved();
        }

        GeoRecord g = config.isEnableGeo() ? geo.locate(ip.get()) : GeoRecord.disabled(ip.get());
        checkInterrupt();

        TlsRecord t = config.isEnableTlsCheck() ? tls.probe(hostname, ip.get()) : TlsRecord.notChecked();
        checkInterrupt();

        return new ProbeResult(g, t);
    }

    private static void checkInterrupt() throws InterruptedException {
        if (Thread.currentThread().isInterrupted()) throw new InterruptedException("asset probe interrupted");
    }
}
