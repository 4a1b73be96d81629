package com.sentinelv.core.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;
import java.util.Objects;

/** 발견된 단일 자산(호스트). 스캔 안에서 hostname 유일. */
public final class Asset {
    private final String hostname;
    private final Criticality criticality;
    private final String assetId;   // sha256(hostname) 앞 12자리, 스캔 간 추적용

    public Asset(String hostname, Criticality criticality) {
        this.hostname = Objects.requireNonNull(hostname, "hostname").toLowerCase(Locale.ROOT);
        this.criticality = Objects.requireNonNull(criticality, "criticality");
        this.assetId = fingerprint(this.hostname);
    }

    public String getHostname() { return hostname; }
    public Criticality getCriticality() { return criticality; }
    public String getAssetId() { return assetId; }

    static String fingerprint(String hostname) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] digest = md.digest(hostname.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(12);
            for (int i = 0; i < 6; i++) sb.append(String.format("%02x", digest[i]));
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            // SHA-256은 모든 JRE 필수 알고리즘
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Asset a)) return false;
        return hostname.equals(a.hostname) && criticality == a.criticality;
    }

    @Override public int hashCode() { return Objects.hash(hostname, criticality); }

    @Override public String toString() { return "Asset{" + hostname + " " + criticality + "}"; }
}
