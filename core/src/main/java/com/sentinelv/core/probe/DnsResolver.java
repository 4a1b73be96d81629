package com.sentinelv.core.probe;

import com.sentinelv.core.model.ScanStats;
import com.sentinelv.core.util.Pacer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 호스트명 → IPv4/IPv6 문자열. InetAddress 조회는 블로킹이므로 세션 DNS executor 에서 돌리고
 * 호출 스레드는 timeout 까지만 기다린다.
 */
public final class DnsResolver {

    private static final Logger LOG = LoggerFactory.getLogger(DnsResolver.class);

    /** 조회 훅 (테스트에서 교체) */
    @FunctionalInterface
    public interface Lookup {
        String resolve(String hostname) throws UnknownHostException;
    }

    public static final Lookup SYSTEM = h -> InetAddress.getByName(h).getHostAddress();

    private final ExecutorService executor;
    private final Pacer pacer;
    private final ScanStats stats;
    private final Duration timeout;
    private final Lookup lookup;

    public DnsResolver(ExecutorService executor, Pacer pacer, ScanStats stats, Duration timeout, Lookup lookup) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.pacer = Objects.requireNonNull(pacer, "pacer");
        this.stats = Objects.requireNonNull(stats, "stats");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.lookup = Objects.requireNonNull(lookup, "lookup");
    }

    /** 실패/타임아웃은 empty. 인터럽트만 전파. */
    public Optional<String> resolve(String hostname) throws InterruptedException {
        pacer.beforeCall();
        stats.addNetworkCall();

        Future<String> f;
        try {
            f = executor.submit(() -> lookup.resolve(hostname));
        } catch (RejectedExecutionException e) {
            LOG.debug("DNS {} rejected: session closed", hostname);
            return Optional.empty();
        }
        try {
            String ip = f.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return Optional.ofNullable(ip);
        } catch (TimeoutException e) {
            f.cancel(true);
            LOG.debug("DNS {} timed out after {}ms", hostname, timeout.toMillis());
            return Optional.empty();
        } catch (ExecutionException e) {
            LOG.debug("DNS {} failed: {}", hostname, String.valueOf(e.getCause()));
            return Optional.empty();
        } catch (InterruptedException ie) {
            f.cancel(true);
            throw ie;
        }
    }
}
