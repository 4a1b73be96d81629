package com.sentinelv.core.util;

import com.sentinelv.core.model.Criticality;
import com.sentinelv.core.model.CryptoFamily;
import com.sentinelv.core.model.ScanConfig;
import com.sentinelv.core.model.ScanMode;
import com.sentinelv.core.model.SubdomainSource;
import com.sentinelv.core.model.Urgency;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class YamlConfigLoaderTest {

    @TempDir Path dir;

    private Path write(String... lines) throws IOException {
        Path f = dir.resolve("scan.yml");
        Files.writeString(f, String.join("\n", lines) + "\n");
        return f;
    }

    @Test
    void overlays_keys_on_top_of_mode_preset() throws Exception {
        Path f = write(
                "mode: stealth",
                "maxAssets: 5",
                "enableGeo: false",
                "timeoutMs: 1500",
                "sources: CT_LOG, wordlist_common",
                "assumedCrypto:",
                "  family: ecdsa",
                "  keySize: 256");

        ScanConfig c = YamlConfigLoader.load(f);

        assertEquals(ScanMode.STEALTH, c.getMode());
        assertEquals(5, c.getMaxAssets());
        assertFalse(c.isEnableGeo());
        assertTrue(c.isEnableQuantum());                          // 프리셋 값 유지
        assertEquals(Duration.ofSeconds(3), c.getPerRequestDelay()); // 프리셋 값 유지
        assertEquals(Duration.ofMillis(1500), c.getTimeout());
        assertTrue(c.hasSource(SubdomainSource.WORDLIST_COMMON));
        assertEquals(CryptoFamily.ECC, c.getAssumedCryptoFamily());
        assertEquals(256, c.getAssumedKeySize());
    }

    @Test
    @DisplayName("CLI --mode 가 YAML 의 mode 보다 우선")
    void mode_override_wins() throws Exception {
        Path f = write("mode: COMPREHENSIVE", "maxAssets: 7");

        ScanConfig c = YamlConfigLoader.load(f, ScanMode.STANDARD_RECON);

        assertEquals(ScanMode.STANDARD_RECON, c.getMode());
        assertFalse(c.isEnableQuantum());
        assertEquals(7, c.getMaxAssets());
    }

    @Test
    void empty_file_yields_preset() throws Exception {
        Path f = write("");
        ScanConfig c = YamlConfigLoader.load(f);
        assertEquals(ScanMode.DEEP_QUANTUM, c.getMode());
        assertEquals(25, c.getMaxAssets());
    }

    @Test
    void quantum_and_criticality_sections() throws Exception {
        Path f = write(
                "quantum:",
                "  breakYears: { RSA: 2035 }",
                "  thresholds: { immediate: 2, urgent: 4, high: 6 }",
                "  riskScores: { urgent: 80 }",
                "  hndlWindowYears: 12",
                "providers:",
                "  ctLogUrl: 'http://127.0.0.1:1/ct?d={domain}'",
                "criticality:",
                "  default: MODERATE",
                "  rules:",
                "    - tier: CRITICAL",
                "      keywords: [pay]");

        ScanConfig c = YamlConfigLoader.load(f);

        assertEquals(2035, c.getThreatTable().breakYear(CryptoFamily.RSA, 2048, 2026));
        assertEquals(Urgency.URGENT, c.getThreatTable().urgencyFor(4));
        assertEquals(80, c.getThreatTable().riskScore(Urgency.URGENT));
        assertEquals(12, c.getThreatTable().getHndlWindowYears());
        assertEquals("http://127.0.0.1:1/ct?d=example.com", c.getProviders().ctLogUrlFor("example.com"));
        assertEquals(Criticality.MODERATE, c.getCriticalityRules().classify("www.shop.io", "shop.io"));
        assertEquals(Criticality.CRITICAL, c.getCriticalityRules().classify("pay.shop.io", "shop.io"));
    }

    @Test
    void invalid_values_are_rejected() throws Exception {
        assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(write("maxAssets: 0")));
        assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(write("timeoutMs: -5")));
        assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(write("sources: [DNS_BRUTE]")));
        assertThrows(IllegalArgumentException.class,
                () -> YamlConfigLoader.load(write("assumedCrypto:", "  family: blowfish")));
        assertThrows(IllegalArgumentException.class,
                () -> YamlConfigLoader.load(write("quantum:", "  thresholds: { immediate: 9 }")));
        IllegalArgumentException badDefault = assertThrows(IllegalArgumentException.class,
                () -> YamlConfigLoader.load(write("criticality:", "  default: LOW")));
        assertTrue(badDefault.getMessage().contains("default tier"));
    }

    @Test
    void missing_file_is_io_error() {
        IOException ex = assertThrows(IOException.class, () -> YamlConfigLoader.load(dir.resolve("nope.yml")));
        assertTrue(ex.getMessage().contains("not found"));
    }
}
