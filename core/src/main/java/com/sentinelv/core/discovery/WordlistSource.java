package com.sentinelv.core.discovery;

import com.sentinelv.core.api.IAssetSource;
import com.sentinelv.core.model.ScanConfig;
import com.sentinelv.core.model.SubdomainSource;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/** 라벨 목록 × 루트 도메인 → "label.domain". 네트워크 호출 없음. */
public final class WordlistSource implements IAssetSource {

    private final SubdomainSource kind;
    private final List<String> labels;

    public WordlistSource(SubdomainSource kind, List<String> labels) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.labels = List.copyOf(Objects.requireNonNull(labels, "labels"));
    }

    /** 번들 워드리스트 사용 */
    public static WordlistSource bundled(SubdomainSource kind) {
        return new WordlistSource(kind, Wordlists.bundled(kind));
    }

    @Override public SubdomainSource kind() { return kind; }

    @Override
    public Set<String> collect(String domain, ScanConfig config) {
        Set<String> out = new LinkedHashSet<>();
        for (String label : labels) {
            out.add(label + "." + domain);
        }
        return out;
    }

    public List<String> getLabels() { return labels; }
}
