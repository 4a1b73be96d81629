package com.sentinelv.core.util;

import com.sentinelv.core.config.CriticalityRules;
import com.sentinelv.core.config.ProviderEndpoints;
import com.sentinelv.core.config.QuantumThreatTable;
import com.sentinelv.core.config.ScanModeMatrix;
import com.sentinelv.core.model.CryptoFamily;
import com.sentinelv.core.model.ScanConfig;
import com.sentinelv.core.model.ScanMode;
import com.sentinelv.core.model.SubdomainSource;
import com.sentinelv.core.model.Urgency;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

/**
 * scan.yml 을 읽어 모드 프리셋 위에 덮어쓴 ScanConfig 로 변환.
 * 호출자가 명시적으로 부르는 어댑터다. 코어는 스스로 파일/환경변수를 읽지 않는다.
 *
 * 예상 YAML 키 (전부 옵션):
 * mode: STANDARD_RECON | DEEP_QUANTUM | STEALTH | COMPREHENSIVE
 * maxAssets: 25
 * enableQuantum: true
 * enableTlsCheck: true
 * enableGeo: true
 * perRequestDelayMs: 0
 * timeoutMs: 10000
 * concurrency: 10
 * maxConnectionsPerHost: 5
 * ctEntryLimit: 100
 * sources: [CT_LOG, WORDLIST_COMMON]     # 또는 "CT_LOG, WORDLIST_EXTENDED"
 *
 * assumedCrypto:
 *   family: RSA
 *   keySize: 2048
 *
 * providers:
 *   ctLogUrl: "https://crt.sh/?q=%25.{domain}&output=json"
 *   primaryGeoUrl: "http://ip-api.com/json/{ip}"
 *   secondaryGeoUrl: "https://ipapi.co/{ip}/json/"
 *
 * quantum:
 *   breakYears: { RSA: 2030, ECC: 2030, AES: 2040, SHA: 2040 }
 *   rsaLargeKey: { thresholdBits: 2048, breakYear: 2032 }
 *   thresholds: { immediate: 3, urgent: 5, high: 7 }
 *   riskScores: { IMMEDIATE: 95, URGENT: 85, HIGH: 70, MODERATE: 50 }
 *   hndlWindowYears: 10
 *   pqcHorizonYears: 50
 *
 * criticality:          # criticality-rules.yml 과 같은 형식
 *   default: HIGH
 *   rules: [...]
 */
public final class YamlConfigLoader {

    private YamlConfigLoader() {}

    public static ScanConfig loadDefault() throws IOException {
        return load(Path.of("scan.yml"));
    }

    public static ScanConfig load(Path yamlPath) throws IOException {
        return load(yamlPath, null);
    }

    /**
     * @param modeOverride null 이 아니면 YAML 의 mode 대신 이 프리셋에서 출발 (CLI --mode)
     */
    public static ScanConfig load(Path yamlPath, ScanMode modeOverride) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("scan.yml not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return parse(in, modeOverride);
        }
    }

    public static ScanConfig parse(InputStream in, ScanMode modeOverride) {
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object root = yaml.load(in);

        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 단순 스칼라면 프리셋 그대로
            return ScanModeMatrix.preset(modeOverride != null ? modeOverride : ScanMode.DEEP_QUANTUM).build();
        }

        ScanMode mode = modeOverride;
        if (mode == null) {
            mode = enumOf(map.get("mode"), ScanMode.class);
            if (mode == null) mode = ScanMode.DEEP_QUANTUM;
        }
        ScanConfig.Builder b = ScanModeMatrix.preset(mode);

        // 1) 평면 키
        setInt(map, "maxAssets", b::maxAssets);
        setBoolean(map, "enableQuantum", b::enableQuantum);
        setBoolean(map, "enableTlsCheck", b::enableTlsCheck);
        setBoolean(map, "enableGeo", b::enableGeo);
        setDurationMs(map, "perRequestDelayMs", b::perRequestDelay);
        setDurationMs(map, "timeoutMs", b::timeout);
        setInt(map, "concurrency", b::concurrency);
        setInt(map, "maxConnectionsPerHost", b::maxConnectionsPerHost);
        setInt(map, "ctEntryLimit", b::ctEntryLimit);
        setStringList(map, "sources", names -> {
            EnumSet<SubdomainSource> set = EnumSet.noneOf(SubdomainSource.class);
            for (String n : names) {
                SubdomainSource s = enumOf(n, SubdomainSource.class);
                if (s == null) throw new IllegalArgumentException("unknown subdomain source: " + n);
                set.add(s);
            }
            b.subdomainSources(set);
        });

        // 2) assumedCrypto.*
        Map<String, Object> crypto = getMap(map, "assumedCrypto");
        if (crypto != null) {
            CryptoFamily family = crypto.get("family") == null
                    ? CryptoFamily.RSA : familyOf(crypto.get("family"));
            int keySize = crypto.get("keySize") == null ? 2048 : toInt(crypto.get("keySize"));
            b.assumedCrypto(family, keySize);
        }

        // 3) providers.*
        Map<String, Object> prov = getMap(map, "providers");
        if (prov != null) {
            ProviderEndpoints p = ProviderEndpoints.defaults();
            if (prov.get("ctLogUrl") != null) p = p.withCtLogUrl(String.valueOf(prov.get("ctLogUrl")));
            if (prov.get("primaryGeoUrl") != null) p = p.withPrimaryGeoUrl(String.valueOf(prov.get("primaryGeoUrl")));
            if (prov.get("secondaryGeoUrl") != null) p = p.withSecondaryGeoUrl(String.valueOf(prov.get("secondaryGeoUrl")));
            b.providers(p);
        }

        // 4) quantum.*
        Map<String, Object> q = getMap(map, "quantum");
        if (q != null) {
            b.threatTable(threatTable(q));
        }

        // 5) criticality.*
        Map<String, Object> crit = getMap(map, "criticality");
        if (crit != null) {
            b.criticalityRules(CriticalityRules.fromMap(crit));
        }

        // 기본값/필수값 확인은 build() 에서
        return b.build();
    }

    private static QuantumThreatTable threatTable(Map<String, Object> q) {
        QuantumThreatTable.Builder t = QuantumThreatTable.defaults().toBuilder();

        Map<String, Object> years = getMap(q, "breakYears");
        if (years != null) {
            for (Map.Entry<String, Object> e : years.entrySet()) {
                t.breakYear(familyOf(e.getKey()), toInt(e.getValue()));
            }
        }
        Map<String, Object> large = getMap(q, "rsaLargeKey");
        if (large != null) {
            t.rsaLargeKey(toInt(large.getOrDefault("thresholdBits", 2048)),
                    toInt(large.getOrDefault("breakYear", 2032)));
        }
        Map<String, Object> th = getMap(q, "thresholds");
        if (th != null) {
            QuantumThreatTable cur = QuantumThreatTable.defaults();
            t.urgencyThresholds(
                    toInt(th.getOrDefault("immediate", cur.getImmediateMaxYears())),
                    toInt(th.getOrDefault("urgent", cur.getUrgentMaxYears())),
                    toInt(th.getOrDefault("high", cur.getHighMaxYears())));
        }
        Map<String, Object> scores = getMap(q, "riskScores");
        if (scores != null) {
            for (Map.Entry<String, Object> e : scores.entrySet()) {
                Urgency u = enumOf(e.getKey(), Urgency.class);
                if (u == null) throw new IllegalArgumentException("unknown urgency: " + e.getKey());
                t.riskScore(u, toInt(e.getValue()));
            }
        }
        setInt(q, "hndlWindowYears", t::hndlWindowYears);
        setInt(q, "pqcHorizonYears", t::pqcHorizonYears);
        return t.build();
    }

    // ------------ helpers ------------
    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    private static void setStringList(Map<?, ?> map, String key, Consumer<List<String>> setter) {
        Object v = map.get(key);
        if (v == null) return;
        List<String> out = new ArrayList<>();
        if (v instanceof List<?> list) {
            for (Object o : list) if (o != null) out.add(String.valueOf(o).trim());
        } else {
            // "a,b,c" 형태 지원
            for (String p : String.valueOf(v).trim().split("\\s*,\\s*")) if (!p.isEmpty()) out.add(p);
        }
        if (!out.isEmpty()) setter.accept(List.copyOf(out));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(toInt(v));
    }

    // 음수/0 검증은 ScanConfig.build() 에 맡긴다
    private static void setDurationMs(Map<?, ?> map, String key, Consumer<Duration> setter) {
        Object v = map.get(key);
        if (v == null) return;
        long ms = (v instanceof Number n) ? n.longValue() : Long.parseLong(String.valueOf(v).trim());
        setter.accept(Duration.ofMillis(ms));
    }

    private static CryptoFamily familyOf(Object v) {
        CryptoFamily f = CryptoFamily.parse(String.valueOf(v));
        if (f == null) throw new IllegalArgumentException("unknown crypto family: " + v);
        return f;
    }

    private static int toInt(Object v) {
        if (v instanceof Number n) return n.intValue();
        return Integer.parseInt(String.valueOf(v).trim());
    }

    private static <E extends Enum<E>> E enumOf(Object v, Class<E> type) {
        if (v == null) return null;
        String s = String.valueOf(v).trim();
        for (E e : type.getEnumConstants()) {
            if (e.name().equalsIgnoreCase(s)) return e;
        }
        return null;
    }
}
