package com.sentinelv.app;

import com.sentinelv.core.model.ScanMode;

import java.nio.file.Path;
import java.util.Locale;
import java.util.logging.Level;

/** sentinel-v 명령행 인자. 잘못된 인자는 UsageException. */
public record CliArgs(String domain, ScanMode mode, Path config, Path logDir, Level logLevel) {

    public static final String USAGE =
            "usage: sentinel-v <domain> [--mode STANDARD_RECON|DEEP_QUANTUM|STEALTH|COMPREHENSIVE]"
                    + " [--config scan.yml] [--log-dir DIR] [--log-level INFO]";

    public static final class UsageException extends Exception {
        public UsageException(String message) { super(message); }
    }

    public static CliArgs parse(String... args) throws UsageException {
        String domain = null;
        ScanMode mode = null;
        Path config = null;
        Path logDir = null;
        Level level = Level.INFO;

        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            switch (a) {
                case "--mode":
                    mode = parseMode(value(args, ++i, a));
                    break;
                case "--config":
                    config = Path.of(value(args, ++i, a));
                    break;
                case "--log-dir":
                    logDir = Path.of(value(args, ++i, a));
                    break;
                case "--log-level":
                    level = parseLevel(value(args, ++i, a));
                    break;
                default:
                    if (a.startsWith("--")) throw new UsageException("unknown option: " + a);
                    if (domain != null) throw new UsageException("only one domain per run: " + a);
                    domain = a;
            }
        }
        if (domain == null || domain.isBlank()) throw new UsageException("missing <domain>");
        return new CliArgs(domain, mode, config, logDir, level);
    }

    private static String value(String[] args, int i, String opt) throws UsageException {
        if (i >= args.length || args[i].startsWith("--")) throw new UsageException(opt + " needs a value");
        return args[i];
    }

    private static ScanMode parseMode(String s) throws UsageException {
        String v = s.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (ScanMode m : ScanMode.values()) {
            if (m.name().equals(v)) return m;
        }
        throw new UsageException("unknown mode: " + s);
    }

    private static Level parseLevel(String s) throws UsageException {
        try {
            return Level.parse(s.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new UsageException("unknown log level: " + s);
        }
    }
}
