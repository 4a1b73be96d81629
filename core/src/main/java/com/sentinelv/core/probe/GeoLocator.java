package com.sentinelv.core.probe;

import com.sentinelv.core.api.IGeoProvider;
import com.sentinelv.core.model.GeoRecord;
import com.sentinelv.core.model.ScanStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 순서가 있는 지리 정보 폴백 체인. 앞 제공자가 실패했을 때만 다음을 호출한다(병렬 호출 없음).
 * 전부 실패하면 IP 를 담은 센티널(resolved=false).
 */
public final class GeoLocator {

    private static final Logger LOG = LoggerFactory.getLogger(GeoLocator.class);

    private final List<IGeoProvider> providers;
    private final ScanStats stats;

    public GeoLocator(List<IGeoProvider> providers, ScanStats stats) {
        this.providers = List.copyOf(Objects.requireNonNull(providers, "providers"));
        this.stats = Objects.requireNonNull(stats, "stats");
    }

    public GeoRecord locate(String ip) throws InterruptedException {
        for (IGeoProvider p : providers) {
            Optional<GeoRecord> hit;
            try {
                hit = p.lookup(ip);
            } catch (RuntimeException e) {
                LOG.warn("Geo provider {} threw for {}: {}", p.name(), ip, e.toString());
                hit = Optional.empty();
            }
            if (hit.isPresent()) return hit.get();
            LOG.debug("Geo provider {} had no answer for {}, falling back", p.name(), ip);
        }
        stats.addGeoFailure();
        return GeoRecord.unknown(ip);
    }

    public List<IGeoProvider> getProviders() { return providers; }
}
