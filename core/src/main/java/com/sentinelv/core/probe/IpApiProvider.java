package com.sentinelv.core.probe;

import com.fasterxml.jackson.databind.JsonNode;
import com.sentinelv.core.config.ProviderEndpoints;
import com.sentinelv.core.http.HttpFetcher;
import com.sentinelv.core.model.GeoRecord;

import java.util.Optional;

/** 1차 제공자 (ip-api.com): {status, lat, lon, country, city, isp, timezone} */
public final class IpApiProvider extends JsonGeoProvider {

    public IpApiProvider(HttpFetcher fetcher, ProviderEndpoints endpoints) {
        super(fetcher, endpoints::primaryGeoUrlFor);
    }

    @Override public String name() { return "ip-api"; }

    @Override
    protected Optional<GeoRecord> map(JsonNode root, String ip) {
        if (!"success".equals(root.path("status").asText())) return Optional.empty();
        if (!hasNumber(root, "lat") || !hasNumber(root, "lon")) return Optional.empty();
        return Optional.of(new GeoRecord(ip,
                root.get("lat").asDouble(), root.get("lon").asDouble(),
                text(root, "country"), text(root, "city"), text(root, "isp"), text(root, "timezone"),
                true, name()));
    }
}
