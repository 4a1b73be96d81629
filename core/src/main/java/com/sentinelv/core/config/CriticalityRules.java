package com.sentinelv.core.config;

import com.sentinelv.core.model.Criticality;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 호스트 이름 키워드 → 중요도 티어 선언 테이블.
 * 키워드 추가는 criticality-rules.yml 수정만으로 가능하다(코드 변경 불필요).
 *
 * 매칭 규칙:
 *  - 루트 도메인 왼쪽의 서브도메인 라벨만 본다 (루트 자체 이름은 보지 않음)
 *  - 라벨을 '.', '-' 로 토큰화, 토큰이 키워드로 "시작"하면 매칭 (api2, testing 등)
 *  - 규칙은 선언 순서대로 평가, 첫 매칭 승리. 없으면 defaultTier
 *
 * YAML 형식:
 * default: HIGH
 * rules:
 *   - tier: CRITICAL
 *     keywords: [vault, api, auth]
 *   - tier: MODERATE
 *     keywords: [dev, test, staging]
 */
public final class CriticalityRules {

    public static final String RESOURCE = "criticality-rules.yml";

    /** 규칙 한 줄 */
    public record Rule(Criticality tier, Set<String> keywords) {
        public Rule {
            Objects.requireNonNull(tier, "tier");
            keywords = Set.copyOf(keywords);
        }
    }

    private final List<Rule> rules;
    private final Criticality defaultTier;

    public CriticalityRules(List<Rule> rules, Criticality defaultTier) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
        this.defaultTier = Objects.requireNonNull(defaultTier, "defaultTier");
    }

    private static volatile CriticalityRules bundled;

    /** 클래스패스 criticality-rules.yml (한 번만 읽음) */
    public static CriticalityRules defaults() {
        CriticalityRules r = bundled;
        if (r == null) {
            synchronized (CriticalityRules.class) {
                r = bundled;
                if (r == null) {
                    try (InputStream in = CriticalityRules.class.getClassLoader().getResourceAsStream(RESOURCE)) {
                        if (in == null) throw new IllegalStateException(RESOURCE + " missing from classpath");
                        r = parse(in);
                    } catch (IOException e) {
                        throw new UncheckedIOException("failed to read " + RESOURCE, e);
                    }
                    bundled = r;
                }
            }
        }
        return r;
    }

    public static CriticalityRules load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return parse(in);
        }
    }

    public static CriticalityRules parse(InputStream in) {
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object root = yaml.load(in);
        if (!(root instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("criticality rules must be a YAML mapping");
        }
        return fromMap(map);
    }

    /** YamlConfigLoader 의 `criticality:` 섹션에서도 재사용 */
    public static CriticalityRules fromMap(Map<?, ?> map) {
        Object defNode = map.get("default");
        Criticality def = tierOf(defNode, Criticality.HIGH);
        if (def == null) throw new IllegalArgumentException("invalid default tier: " + defNode);
        List<Rule> out = new ArrayList<>();
        Object rulesNode = map.get("rules");
        if (rulesNode instanceof List<?> list) {
            for (Object o : list) {
                if (!(o instanceof Map<?, ?> m)) continue;
                Criticality tier = tierOf(m.get("tier"), null);
                if (tier == null) throw new IllegalArgumentException("rule without valid tier: " + m);
                Set<String> kws = new LinkedHashSet<>();
                if (m.get("keywords") instanceof List<?> kl) {
                    for (Object k : kl) {
                        if (k != null && !String.valueOf(k).isBlank()) {
                            kws.add(String.valueOf(k).trim().toLowerCase(Locale.ROOT));
                        }
                    }
                }
                out.add(new Rule(tier, kws));
            }
        }
        return new CriticalityRules(out, def);
    }

    /** v 가 없으면 ifAbsent, 알 수 없는 값이면 null */
    private static Criticality tierOf(Object v, Criticality ifAbsent) {
        if (v == null) return ifAbsent;
        try {
            return Criticality.valueOf(String.valueOf(v).trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    /** hostname 을 rootDomain 기준으로 분류 */
    public Criticality classify(String hostname, String rootDomain) {
        String host = hostname == null ? "" : hostname.toLowerCase(Locale.ROOT);
        String root = rootDomain == null ? "" : rootDomain.toLowerCase(Locale.ROOT);

        String sub;
        if (!root.isEmpty() && host.equals(root)) sub = "";
        else if (!root.isEmpty() && host.endsWith("." + root)) sub = host.substring(0, host.length() - root.length() - 1);
        else sub = host;
        if (sub.isEmpty()) return defaultTier;

        String[] tokens = sub.split("[.\\-]");
        for (Rule rule : rules) {
            for (String t : tokens) {
                if (t.isEmpty()) continue;
                for (String kw : rule.keywords()) {
                    if (t.startsWith(kw)) return rule.tier();
                }
            }
        }
        return defaultTier;
    }

    public List<Rule> getRules() { return rules; }
    public Criticality getDefaultTier() { return defaultTier; }
}
