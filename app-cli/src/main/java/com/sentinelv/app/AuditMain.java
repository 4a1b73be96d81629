package com.sentinelv.app;

import com.sentinelv.app.logging.LogSetup;
import com.sentinelv.core.model.AssetReport;
import com.sentinelv.core.model.RiskLevel;
import com.sentinelv.core.model.ScanConfig;
import com.sentinelv.core.model.ScanMode;
import com.sentinelv.core.risk.RiskSummary;
import com.sentinelv.core.service.AuditService;
import com.sentinelv.core.util.YamlConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * 헤드리스 런처: 인자 해석 → 로그 설정 → 감사 1회 → 결과 표 출력.
 * 종료 코드: 0 성공, 2 사용법/설정 오류, 1 감사 실패.
 */
public final class AuditMain {

    private static final Logger LOG = LoggerFactory.getLogger(AuditMain.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;

    private AuditMain() {}

    public static void main(String[] args) {
        System.exit(run(args, new AuditService(), System.out, System.err));
    }

    static int run(String[] args, AuditService service, PrintStream out, PrintStream err) {
        CliArgs cli;
        ScanConfig config;
        try {
            cli = CliArgs.parse(args);
            config = loadConfig(cli);
        } catch (CliArgs.UsageException e) {
            err.println("error: " + e.getMessage());
            err.println(CliArgs.USAGE);
            return EXIT_USAGE;
        } catch (IOException | IllegalArgumentException e) {
            err.println("config error: " + e.getMessage());
            return EXIT_USAGE;
        }

        LogSetup.init(cli.logDir(), cli.logLevel());

        CompletableFuture<List<AssetReport>> future;
        try {
            future = service.runAudit(cli.domain(), config);
        } catch (IllegalArgumentException e) {
            err.println("error: " + e.getMessage());
            return EXIT_USAGE;
        }

        // Ctrl+C → 진행 중 감사 취소(세션 정리)
        Thread hook = new Thread(() -> future.cancel(true), "audit-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            List<AssetReport> reports = future.get();
            printTable(reports, out);
            return EXIT_OK;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            err.println("audit interrupted");
            return EXIT_FAILURE;
        } catch (CancellationException e) {
            err.println("audit cancelled");
            return EXIT_FAILURE;
        } catch (ExecutionException e) {
            Throwable cause = (e.getCause() != null ? e.getCause() : e);
            LOG.error("Audit failed for {}", cli.domain(), cause);
            err.println("audit failed: " + cause);
            return EXIT_FAILURE;
        } finally {
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException ignore) {
                // JVM 종료 중
            }
        }
    }

    static ScanConfig loadConfig(CliArgs cli) throws IOException {
        if (cli.config() != null) return YamlConfigLoader.load(cli.config(), cli.mode());
        ScanMode mode = (cli.mode() != null ? cli.mode() : ScanMode.DEEP_QUANTUM);
        return ScanConfig.forMode(mode);
    }

    static void printTable(List<AssetReport> reports, PrintStream out) {
        out.printf(Locale.ROOT, "%-40s %-9s %-15s %5s  %-27s %s%n",
                "HOST", "TIER", "IP", "RISK", "LEVEL", "REMEDIATION");
        for (AssetReport r : reports) {
            out.printf(Locale.ROOT, "%-40s %-9s %-15s %5d  %-27s %s%n",
                    r.getHostname(), r.getAsset().getCriticality(), r.getGeo().ip(),
                    r.getRiskScore(), r.getRiskLabel(), r.getRemediation());
        }
        RiskSummary s = RiskSummary.of(reports);
        out.printf(Locale.ROOT, "%nassets=%d avg=%d p95=%d max=%d critical=%d high=%d harvest-now=%d%n",
                s.count(), s.avg(), s.p95(), s.max(),
                s.count(RiskLevel.CRITICAL), s.count(RiskLevel.HIGH), s.harvestNowThreats());
    }
}
