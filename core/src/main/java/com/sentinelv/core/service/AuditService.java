package com.sentinelv.core.service;

import com.sentinelv.core.api.IAssetDiscovery;
import com.sentinelv.core.api.IAssetProber;
import com.sentinelv.core.config.CriticalityRules;
import com.sentinelv.core.discovery.AssetSourceRegistry;
import com.sentinelv.core.http.ScanSession;
import com.sentinelv.core.model.Asset;
import com.sentinelv.core.model.AssetReport;
import com.sentinelv.core.model.PqcRecommendation;
import com.sentinelv.core.model.ProbeResult;
import com.sentinelv.core.model.QuantumAssessment;
import com.sentinelv.core.model.ScanConfig;
import com.sentinelv.core.model.ScanStats;
import com.sentinelv.core.probe.AssetProber;
import com.sentinelv.core.quantum.PqcRecommendationEngine;
import com.sentinelv.core.quantum.QuantumVulnerabilityAssessor;
import com.sentinelv.core.risk.RiskAggregator;
import com.sentinelv.core.util.DomainNames;
import com.sentinelv.core.util.NamedThreadFactory;
import com.sentinelv.core.util.ProgressListener;
import com.sentinelv.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * 감사 오케스트레이터:
 *  - discover → classify → (probe → assess → recommend → score) × 자산 → 정렬
 *  - 자산 하나가 작업 하나. 고정 스레드풀(동시성=concurrency) + 유한 큐 역압
 *  - 자산별 워치독이 예산 초과 작업을 인터럽트, 전체 마감 시간 초과분은 취소
 *  - 실패/타임아웃 자산은 버린다(반쯤 채운 결과는 내보내지 않음)
 *
 * runAudit 이 돌려준 future 를 취소하거나 타임아웃으로 끝내면 진행 중인 작업도 인터럽트된다.
 * 어떤 경로로 끝나든 ScanSession 은 닫힌다.
 */
public final class AuditService {

    private static final Logger LOG = LoggerFactory.getLogger(AuditService.class);
    private static final StructuredLog SLOG = StructuredLog.get(AuditService.class);

    /** 워치독/마감 시간 여유분 */
    public static final Duration GRACE = Duration.ofSeconds(2);

    /** 결과 정렬: 위험 점수 내림차순, 같으면 호스트명 */
    public static final Comparator<AssetReport> RESULT_ORDER =
            Comparator.comparingInt(AssetReport::getRiskScore).reversed()
                    .thenComparing(AssetReport::getHostname);

    /** 세션 자원으로 탐색기/탐침기를 만드는 조립 지점 (테스트/플러그인 주입용) */
    public interface Wiring {
        IAssetDiscovery discovery(ScanSession session);
        IAssetProber prober(ScanSession session);

        Wiring NETWORK = of(AssetSourceRegistry::standard, AssetProber::forSession);

        static Wiring of(Function<ScanSession, IAssetDiscovery> discovery,
                         Function<ScanSession, IAssetProber> prober) {
            Objects.requireNonNull(discovery, "discovery");
            Objects.requireNonNull(prober, "prober");
            return new Wiring() {
                @Override public IAssetDiscovery discovery(ScanSession s) { return discovery.apply(s); }
                @Override public IAssetProber prober(ScanSession s) { return prober.apply(s); }
            };
        }
    }

    /** 감사 1회용 세션 생성기 */
    @FunctionalInterface
    public interface SessionFactory {
        ScanSession open(String rootDomain, ScanConfig config);
    }

    private final Wiring wiring;
    private final SessionFactory sessions;
    private final Clock clock;
    private final ProgressListener listener;
    private final PqcRecommendationEngine pqcEngine = new PqcRecommendationEngine();
    private final RiskAggregator aggregator = new RiskAggregator();

    private volatile ScanStats.Snapshot lastRun = ScanStats.Snapshot.EMPTY;

    /** 기본: 실제 네트워크, UTC 시스템 시계 */
    public AuditService() {
        this(Wiring.NETWORK, ScanSession::open, Clock.systemUTC(), ProgressListener.NONE);
    }

    public AuditService(ProgressListener listener) {
        this(Wiring.NETWORK, ScanSession::open, Clock.systemUTC(), listener);
    }

    /** DI/테스트용 */
    public AuditService(Wiring wiring, SessionFactory sessions, Clock clock, ProgressListener listener) {
        this.wiring = Objects.requireNonNull(wiring, "wiring");
        this.sessions = Objects.requireNonNull(sessions, "sessions");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.listener = (listener != null) ? listener : ProgressListener.NONE;
    }

    /**
     * 도메인 하나를 감사한다. 입력 검증 오류는 네트워크 활동 전에 즉시 던진다.
     *
     * @return 위험 점수 내림차순(동점은 호스트명) 결과. 자산이 모두 실패하면 빈 리스트.
     */
    public CompletableFuture<List<AssetReport>> runAudit(String domain, ScanConfig config) {
        Objects.requireNonNull(config, "config");
        final String root = DomainNames.requireDomain(domain);
        final String scanId = UUID.randomUUID().toString().substring(0, 8);
        final AtomicBoolean abort = new AtomicBoolean(false);

        CompletableFuture<List<AssetReport>> result = new CompletableFuture<>();
        Thread coordinator = new NamedThreadFactory("audit-" + scanId).newThread(() -> {
            try {
                result.complete(execute(scanId, root, config, abort));
            } catch (Throwable t) {
                result.completeExceptionally(t);
            }
        });
        // 외부 취소/타임아웃 → 중단 플래그 + 코디네이터 인터럽트(풀은 코디네이터가 정리)
        result.whenComplete((r, t) -> {
            if (t != null) {
                abort.set(true);
                coordinator.interrupt();
            }
        });
        coordinator.start();
        return result;
    }

    /** 직전 감사의 런타임 통계 */
    public ScanStats.Snapshot getLastRunSnapshot() {
        return lastRun;
    }

    private List<AssetReport> execute(String scanId, String root, ScanConfig config, AtomicBoolean abort)
            throws InterruptedException {
        final long t0 = System.nanoTime();
        final int cc = config.getConcurrency();
        LOG.info("Audit start: domain={}, mode={}, maxAssets={}, cc={}", root, config.getMode(), config.getMaxAssets(), cc);
        SLOG.info("scan-start", "scanId", scanId, "domain", root, "mode", config.getMode(),
                "maxAssets", config.getMaxAssets(), "cc", cc);

        try (ScanSession session = sessions.open(root, config)) {
            try {
                return runPhases(scanId, root, config, session, abort);
            } finally {
                lastRun = session.stats().snapshot();
                SLOG.info("scan-stats", "scanId", scanId,
                        "networkCalls", lastRun.networkCalls, "retries", lastRun.retries,
                        "completed", lastRun.assetsCompleted, "dropped", lastRun.assetsDropped,
                        "maxObservedCC", lastRun.maxObservedConcurrency,
                        "elapsedMs", TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0));
            }
        }
    }

    private List<AssetReport> runPhases(String scanId, String root, ScanConfig config,
                                        ScanSession session, AtomicBoolean abort) throws InterruptedException {
        // ---- 1) 탐색 ----
        notify(0.0, "discover", 0, -1);
        SortedSet<String> hosts = wiring.discovery(session).discover(root, config);
        checkCancel(abort);

        CriticalityRules rules = config.getCriticalityRules();
        List<Asset> assets = new ArrayList<>(hosts.size());
        for (String h : hosts) assets.add(new Asset(h, rules.classify(h, root)));

        final int total = assets.size();
        notify(0.0, "probe", 0, total);

        // 자산별 암호 가정이 같으므로 양자 평가는 감사당 한 번
        int year = clock.instant().atZone(ZoneOffset.UTC).getYear();
        QuantumAssessment quantum = new QuantumVulnerabilityAssessor(config.getThreatTable())
                .assess(config.getAssumedCryptoFamily(), config.getAssumedKeySize(), year);

        IAssetProber prober = wiring.prober(session);
        ScanStats stats = session.stats();
        final int cc = config.getConcurrency();
        final Duration taskBudget = config.getAssetBudget().plus(GRACE);

        // ---- 2) 고정 스레드풀(+역압) ----
        ThreadPoolExecutor exec = new ThreadPoolExecutor(
                cc, cc,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(cc * 2),
                new NamedThreadFactory("audit-worker"),
                (r, e) -> {
                    if (e.isShutdown()) throw new RejectedExecutionException("pool shut down");
                    try { e.getQueue().put(r); }
                    catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        throw new RejectedExecutionException("Interrupted while enqueueing", ie);
                    }
                }
        );

        final AtomicInteger inFlight = new AtomicInteger(0);
        final AtomicInteger done = new AtomicInteger(0);
        final List<Future<AssetReport>> futures = new ArrayList<>(total);
        final List<Asset> submitted = new ArrayList<>(total);
        final List<AssetReport> results = new ArrayList<>(total);

        try {
            for (Asset asset : assets) {
                checkCancel(abort);
                futures.add(exec.submit(() -> {
                    checkCancel(abort);
                    int cur = inFlight.incrementAndGet();
                    stats.observeConcurrency(cur);
                    Watchdog dog = Watchdog.arm(session, Thread.currentThread(), taskBudget);
                    try {
                        ProbeResult pr = prober.probe(asset.getHostname(), config);
                        PqcRecommendation pqc = pqcEngine.recommend(asset.getCriticality());
                        AssetReport rep = aggregator.score(asset, pr.geo(), pr.tls(), quantum, pqc, config, clock.instant());
                        if (dog.fired() || abort.get()) throw new CancellationException("asset budget exceeded");
                        return rep;
                    } catch (InterruptedException ie) {
                        throw new CancellationException(dog.fired() ? "asset budget exceeded" : "interrupted");
                    } finally {
                        dog.disarm();
                        inFlight.decrementAndGet();
                        int d = done.incrementAndGet();
                        notify(total == 0 ? 1.0 : (double) d / total, "probe", d, total);
                    }
                }));
                submitted.add(asset);
            }

            // ---- 3) 결과 수집 (전체 마감 시간) ----
            long waves = (total + cc - 1) / cc;
            long deadlineNs = System.nanoTime() + taskBudget.multipliedBy(Math.max(1, waves)).plus(GRACE).toNanos();
            for (int i = 0; i < futures.size(); i++) {
                Future<AssetReport> f = futures.get(i);
                Asset asset = submitted.get(i);
                try {
                    long left = Math.max(0, deadlineNs - System.nanoTime());
                    AssetReport rep = f.get(left, TimeUnit.NANOSECONDS);
                    results.add(rep);
                    stats.addCompleted();
                    SLOG.debug("asset-done", "scanId", scanId, "host", asset.getHostname(),
                            "score", rep.getRiskScore(), "level", rep.getRiskLevel());
                } catch (TimeoutException te) {
                    f.cancel(true);
                    stats.addDropped();
                    LOG.warn("Asset {} dropped: audit deadline reached", asset.getHostname());
                    SLOG.warn("asset-dropped", "scanId", scanId, "host", asset.getHostname(), "reason", "deadline");
                } catch (ExecutionException e) {
                    stats.addDropped();
                    Throwable cause = (e.getCause() != null ? e.getCause() : e);
                    if (cause instanceof CancellationException) {
                        LOG.warn("Asset {} dropped: {}", asset.getHostname(), cause.getMessage());
                        SLOG.warn("asset-dropped", "scanId", scanId, "host", asset.getHostname(),
                                "reason", cause.getMessage());
                    } else {
                        LOG.error("Asset {} failed: {}", asset.getHostname(), cause.toString());
                        SLOG.error("asset-failed", cause, "scanId", scanId, "host", asset.getHostname());
                    }
                } catch (CancellationException ce) {
                    stats.addDropped();
                }
                checkCancel(abort);
            }
        } catch (CancellationException | InterruptedException | RejectedExecutionException e) {
            LOG.info("Audit {} cancelled", root);
            SLOG.info("scan-cancelled", "scanId", scanId, "domain", root);
            throw (e instanceof CancellationException) ? (CancellationException) e : cancelled(e);
        } finally {
            // ---- 4) 종료 ----
            exec.shutdownNow();
            try {
                if (!exec.awaitTermination(5, TimeUnit.SECONDS)) {
                    LOG.warn("Audit workers still running after shutdown");
                }
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        }

        results.sort(RESULT_ORDER);
        notify(1.0, "done", results.size(), total);
        LOG.info("Audit done: domain={}, assets={}, reported={}", root, total, results.size());
        SLOG.info("scan-done", "scanId", scanId, "domain", root, "assets", total, "reported", results.size());
        return List.copyOf(results);
    }

    private void notify(double progress, String phase, long done, long total) {
        try {
            listener.onProgress(Math.max(0.0, Math.min(1.0, progress)), phase, done, total);
        } catch (RuntimeException e) {
            LOG.debug("Progress listener threw: {}", e.toString());
        }
    }

    private static CancellationException cancelled(Throwable cause) {
        if (cause instanceof InterruptedException) Thread.currentThread().interrupt();
        CancellationException ce = new CancellationException("audit cancelled");
        ce.initCause(cause);
        return ce;
    }

    private static void checkCancel(AtomicBoolean flag) {
        if (Thread.currentThread().isInterrupted() || flag.get()) {
            throw new CancellationException("audit cancelled");
        }
    }

    /**
     * 작업 1건 워치독. disarm() 이후에는 인터럽트가 절대 도착하지 않는다
     * (발화와 해제가 같은 락 아래에서 일어나고, 발화했으면 남은 인터럽트 플래그를 지운다).
     */
    static final class Watchdog {
        private final Thread worker;
        private boolean finished;
        private volatile boolean fired;
        private ScheduledFuture<?> timer;

        private Watchdog(Thread worker) { this.worker = worker; }

        static Watchdog arm(ScanSession session, Thread worker, Duration budget) {
            Watchdog w = new Watchdog(worker);
            try {
                w.timer = session.watchdog().schedule(w::fire, budget.toMillis(), TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                // 세션이 닫히는 중: 취소 경로가 곧 인터럽트한다
                w.timer = null;
            }
            return w;
        }

        private synchronized void fire() {
            if (!finished) {
                fired = true;
                worker.interrupt();
            }
        }

        boolean fired() { return fired; }

        void disarm() {
            synchronized (this) { finished = true; }
            if (timer != null) timer.cancel(false);
            if (fired) Thread.interrupted();
        }
    }
}
