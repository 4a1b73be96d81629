package com.sentinelv.core.http;

import com.sentinelv.core.config.ProviderEndpoints;
import com.sentinelv.core.discovery.AssetSourceRegistry;
import com.sentinelv.core.model.ScanConfig;
import com.sentinelv.core.model.SubdomainSource;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.EnumSet;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/** 로컬 HttpServer 로 실제 HttpClient 경로를 태운다 */
class ScanSessionTest {

    private HttpServer server;
    private final AtomicInteger ctHits = new AtomicInteger();
    private String base;

    @BeforeEach
    void start() throws Exception {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/ct", ex -> {
            ctHits.incrementAndGet();
            String q = ex.getRequestURI().getQuery();
            String domain = q.substring(q.indexOf('=') + 1);
            byte[] body = ("[{\"name_value\":\"api." + domain + "\\n*.mail." + domain + "\"}]")
                    .getBytes(StandardCharsets.UTF_8);
            ex.getResponseHeaders().set("Content-Type", "application/json");
            ex.sendResponseHeaders(200, body.length);
            try (OutputStream os = ex.getResponseBody()) { os.write(body); }
        });
        server.createContext("/busy", ex -> {
            ex.getResponseHeaders().set("Retry-After", "0");
            ex.sendResponseHeaders(503, -1);
            ex.close();
        });
        server.start();
        base = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void stop() {
        server.stop(0);
    }

    @Test
    @DisplayName("실제 HttpClient 세션으로 CT 조회 → 탐색 결과")
    void discovery_over_real_http_client() throws Exception {
        ScanConfig cfg = ScanConfig.builder()
                .subdomainSources(EnumSet.of(SubdomainSource.CT_LOG))
                .providers(ProviderEndpoints.defaults().withCtLogUrl(base + "/ct?domain={domain}"))
                .timeout(Duration.ofSeconds(3))
                .build();

        ScanSession session = ScanSession.open("example.com", cfg);
        try (session) {
            assertThat(AssetSourceRegistry.standard(session).discover("example.com", cfg))
                    .containsExactly("api.example.com", "example.com", "mail.example.com");
            assertThat(session.stats().snapshot().networkCalls).isEqualTo(1);
            assertThat(session.permits().available("127.0.0.1")).isEqualTo(cfg.getMaxConnectionsPerHost());
        }
        assertThat(session.isClosed()).isTrue();
        assertThat(session.dnsExecutor().isShutdown()).isTrue();
        assertThat(session.watchdog().isShutdown()).isTrue();
        assertThat(ctHits.get()).isEqualTo(1);
    }

    @Test
    void retries_are_counted_against_a_busy_server() throws Exception {
        ScanConfig cfg = ScanConfig.builder().timeout(Duration.ofSeconds(3)).build();
        try (ScanSession session = ScanSession.open("example.com", cfg)) {
            CountingRetryPolicy policy = new CountingRetryPolicy(new DefaultRetryPolicy());

            HttpFetcher.FetchResult res = session.fetcher()
                    .fetchWithRetry(URI.create(base + "/busy"), policy, session.sleeper());

            assertThat(res.statusCode()).isEqualTo(503);
            assertThat(policy.getRetryCount()).isEqualTo(2);
            assertThat(session.stats().snapshot().retries).isEqualTo(2);
            assertThat(session.stats().snapshot().networkCalls).isEqualTo(3);
        }
    }

    @Test
    void close_is_idempotent() {
        ScanSession s = ScanSession.open("example.com", ScanConfig.defaults());
        s.close();
        s.close();
        assertThat(s.isClosed()).isTrue();
    }
}
