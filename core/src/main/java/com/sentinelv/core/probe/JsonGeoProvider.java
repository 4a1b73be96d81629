package com.sentinelv.core.probe;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sentinelv.core.api.IGeoProvider;
import com.sentinelv.core.http.HttpFetcher;
import com.sentinelv.core.model.GeoRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/** JSON 한 번 GET 으로 끝나는 지리 정보 제공자 공통 골격. 재시도 없음(폴백 체인이 대신). */
abstract class JsonGeoProvider implements IGeoProvider {

    private static final Logger LOG = LoggerFactory.getLogger(JsonGeoProvider.class);
    private static final ObjectMapper JSON = new ObjectMapper();

    private final HttpFetcher fetcher;
    private final UnaryOperator<String> urlForIp;

    protected JsonGeoProvider(HttpFetcher fetcher, UnaryOperator<String> urlForIp) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.urlForIp = Objects.requireNonNull(urlForIp, "urlForIp");
    }

    @Override
    public final Optional<GeoRecord> lookup(String ip) throws InterruptedException {
        HttpFetcher.FetchResult res;
        try {
            res = fetcher.fetch(URI.create(urlForIp.apply(ip)));
        } catch (IllegalArgumentException e) {
            LOG.debug("{}: bad URL for {}", name(), ip);
            return Optional.empty();
        }
        if (!res.isOk()) {
            LOG.debug("{}: status {} for {}", name(), res.statusCode(), ip);
            return Optional.empty();
        }
        try {
            JsonNode root = JSON.readTree(res.body());
            if (root == null || !root.isObject()) return Optional.empty();
            return map(root, ip);
        } catch (IOException e) {
            LOG.debug("{}: malformed payload for {}", name(), ip);
            return Optional.empty();
        }
    }

    /** 제공자별 스키마 → GeoRecord. 성공 표시가 없거나 좌표가 없으면 empty. */
    protected abstract Optional<GeoRecord> map(JsonNode root, String ip);

    static String text(JsonNode root, String field) {
        JsonNode n = root.get(field);
        if (n == null || n.isNull()) return GeoRecord.UNKNOWN;
        String s = n.asText().trim();
        return s.isEmpty() ? GeoRecord.UNKNOWN : s;
    }

    static boolean hasNumber(JsonNode root, String field) {
        JsonNode n = root.get(field);
        return n != null && n.isNumber();
    }
}
