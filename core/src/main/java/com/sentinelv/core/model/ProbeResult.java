package com.sentinelv.core.model;

import java.util.Objects;

/** 자산 하나에 대한 네트워크 프로브 결과 쌍 */
public record ProbeResult(GeoRecord geo, TlsRecord tls) {
    public ProbeResult {
        Objects.requireNonNull(geo, "geo");
        Objects.requireNonNull(tls, "tls");
    }

    public static ProbeResult unresolved() {
        return new ProbeResult(GeoRecord.unresolved(), TlsRecord.invalid());
    }
}
