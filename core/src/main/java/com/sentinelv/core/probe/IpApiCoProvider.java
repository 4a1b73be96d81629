package com.sentinelv.core.probe;

import com.fasterxml.jackson.databind.JsonNode;
import com.sentinelv.core.config.ProviderEndpoints;
import com.sentinelv.core.http.HttpFetcher;
import com.sentinelv.core.model.GeoRecord;

import java.util.Optional;

/** 2차 제공자 (ipapi.co): {latitude, longitude, country_name, city, org, timezone, error} */
public final class IpApiCoProvider extends JsonGeoProvider {

    public IpApiCoProvider(HttpFetcher fetcher, ProviderEndpoints endpoints) {
        super(fetcher, endpoints::secondaryGeoUrlFor);
    }

    @Override public String name() { return "ipapi.co"; }

    @Override
    protected Optional<GeoRecord> map(JsonNode root, String ip) {
        if (root.path("error").asBoolean(false)) return Optional.empty();
        if (!hasNumber(root, "latitude") || !hasNumber(root, "longitude")) return Optional.empty();
        return Optional.of(new GeoRecord(ip,
                root.get("latitude").asDouble(), root.get("longitude").asDouble(),
                text(root, "country_name"), text(root, "city"), text(root, "org"), text(root, "timezone"),
                true, name()));
    }
}
