package com.sentinelv.core.model;

import java.util.Locale;

/** 평가 대상 암호 계열 */
public enum CryptoFamily {
    RSA,
    ECC,
    AES,
    SHA,
    /** 이미 PQC 알고리즘(ML-KEM 등)으로 전환된 경우 */
    PQC;

    /** "rsa", "ECDSA", "sha-256" 같은 느슨한 표기를 허용. 모르면 null */
    public static CryptoFamily parse(String s) {
        if (s == null || s.isBlank()) return null;
        String v = s.trim().toUpperCase(Locale.ROOT);
        if (v.startsWith("EC")) return ECC;
        if (v.startsWith("SHA")) return SHA;
        if (v.startsWith("ML-") || v.startsWith("MLKEM") || v.startsWith("KYBER")) return PQC;
        for (CryptoFamily f : values()) {
            if (v.startsWith(f.name())) return f;
        }
        return null;
    }
}
