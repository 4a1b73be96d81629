package com.sentinelv.core.model;

/**
 * TLS 핸드셰이크 관찰 결과.
 * quantumSafe 는 협상된 cipher 이름이 하이브리드 PQC 토큰 목록과 일치할 때만 true.
 */
public record TlsRecord(
        boolean valid,
        boolean checked,
        String protocolVersion,
        String cipherSuite,
        String issuer,
        boolean quantumSafe
) {
    public static final String NA = "N/A";

    /** 연결/핸드셰이크/인증서 오류 */
    public static TlsRecord invalid() {
        return new TlsRecord(false, true, NA, "Unknown", NA, false);
    }

    /** 설정상 TLS 점검을 끈 경우 */
    public static TlsRecord notChecked() {
        return new TlsRecord(false, false, NA, "Unknown", NA, false);
    }

    public static TlsRecord valid(String protocol, String cipher, String issuer, boolean quantumSafe) {
        return new TlsRecord(true, true, protocol, cipher, issuer, quantumSafe);
    }
}
