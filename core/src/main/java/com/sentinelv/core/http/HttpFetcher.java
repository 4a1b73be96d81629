package com.sentinelv.core.http;

import com.sentinelv.core.model.ScanStats;
import com.sentinelv.core.util.Pacer;
import com.sentinelv.core.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 감사용 GET 전송기. 호출마다: 페이싱 → 호스트 허가 획득 → 전송 → 허가 반납.
 * 전송 오류는 예외 대신 status -1 로 돌려준다. 인터럽트만 호출자에게 전파.
 */
public class HttpFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(HttpFetcher.class);
    private static final Duration MAX_RETRY_AFTER = Duration.ofSeconds(30);

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<String> send(HttpRequest req) throws IOException, InterruptedException;
    }

    /** GET 결과 */
    public record FetchResult(int statusCode, String body, Map<String, List<String>> headers, long elapsedMs) {
        public FetchResult {
            body = (body == null ? "" : body);
            headers = (headers == null ? Map.of() : headers);
        }

        public static FetchResult transportError(long elapsedMs) {
            return new FetchResult(-1, "", Map.of(), elapsedMs);
        }

        public boolean isOk() { return statusCode == 200; }
    }

    private final HttpSender sender;
    private final HostPermits permits;
    private final Pacer pacer;
    private final ScanStats stats;
    private final Duration timeout;

    public HttpFetcher(HttpSender sender, HostPermits permits, Pacer pacer, ScanStats stats, Duration timeout) {
        this.sender = Objects.requireNonNull(sender, "sender");
        this.permits = Objects.requireNonNull(permits, "permits");
        this.pacer = Objects.requireNonNull(pacer, "pacer");
        this.stats = Objects.requireNonNull(stats, "stats");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    /** 한 번 전송. 요청 자체가 timeout 으로 제한된다. */
    public FetchResult fetch(URI url) throws InterruptedException {
        Objects.requireNonNull(url, "url");
        pacer.beforeCall();

        long start = System.nanoTime();
        try (HostPermits.Permit ignored = permits.acquire(url.getHost())) {
            stats.addNetworkCall();
            HttpRequest req = HttpRequest.newBuilder(url)
                    .timeout(timeout)
                    .header("Accept", "application/json")
                    .GET()
                    .build();
            HttpResponse<String> resp = sender.send(req);
            return new FetchResult(resp.statusCode(), resp.body(), resp.headers().map(), elapsedMs(start));
        } catch (IOException | RuntimeException e) {
            LOG.debug("GET {} failed: {}", url, e.toString());
            return FetchResult.transportError(elapsedMs(start));
        }
    }

    /** 재시도 포함: policy 가 허용하는 동안만, Retry-After 우선 */
    public FetchResult fetchWithRetry(URI url, RetryPolicy policy, Sleeper sleeper) throws InterruptedException {
        Objects.requireNonNull(policy, "policy");
        Objects.requireNonNull(sleeper, "sleeper");
        int attempt = 1;
        while (true) {
            FetchResult res = fetch(url);
            if (!policy.shouldRetry(res.statusCode(), attempt)) {
                return res;
            }
            stats.addRetries(1);
            sleeper.sleep(resolveRetryAfterOr(policy.nextDelay(attempt), res));
            attempt++;
        }
    }

    /** Retry-After(초 단위)만 존중, 상한 30초. HTTP-date 형태는 fallback. */
    static Duration resolveRetryAfterOr(Duration fallback, FetchResult res) {
        List<String> values = res.headers().get("retry-after");
        if (values == null || values.isEmpty()) values = res.headers().get("Retry-After");
        if (values == null || values.isEmpty()) return fallback;
        try {
            Duration d = Duration.ofSeconds(Long.parseLong(values.get(0).trim()));
            return d.compareTo(MAX_RETRY_AFTER) > 0 ? MAX_RETRY_AFTER : d;
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static long elapsedMs(long startNs) {
        return (System.nanoTime() - startNs) / 1_000_000;
    }
}
