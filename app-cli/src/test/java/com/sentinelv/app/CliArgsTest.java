package com.sentinelv.app;

import com.sentinelv.core.model.ScanMode;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.logging.Level;

import static org.junit.jupiter.api.Assertions.*;

class CliArgsTest {

    @Test
    void domain_only_uses_defaults() throws Exception {
        CliArgs a = CliArgs.parse("example.com");
        assertEquals("example.com", a.domain());
        assertNull(a.mode());
        assertNull(a.config());
        assertNull(a.logDir());
        assertEquals(Level.INFO, a.logLevel());
    }

    @Test
    void all_options_in_any_order() throws Exception {
        CliArgs a = CliArgs.parse("--mode", "deep-quantum", "--log-level", "fine",
                "example.com", "--config", "scan.yml", "--log-dir", "logs");
        assertEquals(ScanMode.DEEP_QUANTUM, a.mode());
        assertEquals(Level.FINE, a.logLevel());
        assertEquals(Path.of("scan.yml"), a.config());
        assertEquals(Path.of("logs"), a.logDir());
        assertEquals("example.com", a.domain());
    }

    @Test
    void usage_errors() {
        assertThrows(CliArgs.UsageException.class, CliArgs::parse);
        assertThrows(CliArgs.UsageException.class, () -> CliArgs.parse("--mode", "TURBO", "example.com"));
        assertThrows(CliArgs.UsageException.class, () -> CliArgs.parse("example.com", "--mode"));
        assertThrows(CliArgs.UsageException.class, () -> CliArgs.parse("example.com", "--config", "--mode"));
        assertThrows(CliArgs.UsageException.class, () -> CliArgs.parse("example.com", "--verbose"));
        assertThrows(CliArgs.UsageException.class, () -> CliArgs.parse("a.com", "b.com"));
        assertThrows(CliArgs.UsageException.class, () -> CliArgs.parse("example.com", "--log-level", "LOUD"));
    }
}
