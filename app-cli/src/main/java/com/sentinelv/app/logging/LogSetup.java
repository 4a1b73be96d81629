package com.sentinelv.app.logging;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * java.util.logging 전역 설정 (slf4j-jdk14 바인딩이 여기로 흘러온다).
 *  - 콘솔: stderr, 한 줄 포맷
 *  - 파일: logDir/sentinel-v-%g.log, 사이즈 롤링 2MB x 5 (logDir 이 null 이면 생략)
 */
public final class LogSetup {
    private LogSetup() {}

    public static final int ROLL_BYTES = 2 * 1024 * 1024;
    public static final int ROLL_FILES = 5;

    private static volatile boolean initialized = false; // 재초기화 방지
    private static final Formatter LINE_FORMATTER = new LineFormatter();

    public static synchronized void init(Path logDir, Level level) {
        if (initialized) return;
        initialized = true;

        Level lvl = (level == null ? Level.INFO : level);
        LogManager.getLogManager().reset();
        Logger root = Logger.getLogger("");

        ConsoleHandler console = new ConsoleHandler();
        console.setLevel(lvl);
        console.setFormatter(LINE_FORMATTER);
        root.addHandler(console);

        if (logDir != null) {
            try {
                Files.createDirectories(logDir);
                String pattern = logDir.resolve("sentinel-v-%g.log").toString();
                FileHandler file = new FileHandler(pattern, ROLL_BYTES, ROLL_FILES, true);
                file.setLevel(lvl);
                file.setFormatter(LINE_FORMATTER);
                root.addHandler(file);
            } catch (IOException e) {
                // 파일 로그 없이 콘솔만으로 진행
                Logger.getAnonymousLogger().log(Level.WARNING, "File log setup failed: " + e.getMessage(), e);
            }
        }
        root.setLevel(lvl);
        Logger.getLogger(LogSetup.class.getName()).fine(
                () -> "Log initialized. dir=" + (logDir == null ? "-" : logDir.toAbsolutePath()) + ", level=" + lvl.getName());
    }

    /** 한 줄 포맷 + 스레드명 + 예외 스택 */
    private static final class LineFormatter extends Formatter {
        @Override public String format(LogRecord r) {
            String base = String.format(Locale.ROOT,
                    "%1$tF %1$tT.%1$tL [%2$s] (%3$s) %4$s - %5$s%n",
                    r.getMillis(), r.getLevel().getName(),
                    Thread.currentThread().getName(),
                    r.getLoggerName(), formatMessage(r));

            Throwable t = r.getThrown();
            if (t == null) return base;

            StringWriter sw = new StringWriter(256);
            t.printStackTrace(new PrintWriter(sw));
            return base + sw + System.lineSeparator();
        }
    }
}
