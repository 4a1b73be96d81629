package com.sentinelv.core.discovery;

import com.sentinelv.core.model.SubdomainSource;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** 클래스패스 워드리스트 로더 (한 줄에 라벨 하나, '#' 주석/빈 줄 무시). 한 번 읽고 캐시. */
public final class Wordlists {

    private static final Map<SubdomainSource, List<String>> CACHE = new ConcurrentHashMap<>();

    private Wordlists() {}

    public static String resourceFor(SubdomainSource kind) {
        switch (kind) {
            case WORDLIST_COMMON:   return "wordlists/common.txt";
            case WORDLIST_EXTENDED: return "wordlists/extended.txt";
            default: throw new IllegalArgumentException("not a wordlist source: " + kind);
        }
    }

    public static List<String> bundled(SubdomainSource kind) {
        return CACHE.computeIfAbsent(kind, k -> {
            String res = resourceFor(k);
            try (InputStream in = Wordlists.class.getClassLoader().getResourceAsStream(res)) {
                if (in == null) throw new IllegalStateException(res + " missing from classpath");
                return read(in);
            } catch (IOException e) {
                throw new UncheckedIOException("failed to read " + res, e);
            }
        });
    }

    static List<String> read(InputStream in) throws IOException {
        List<String> out = new ArrayList<>();
        try (BufferedReader r = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = r.readLine()) != null) {
                String s = line.trim();
                if (s.isEmpty() || s.startsWith("#")) continue;
                out.add(s.toLowerCase(Locale.ROOT));
            }
        }
        return List.copyOf(out);
    }
}
