package com.sentinelv.core.probe;

import com.sentinelv.core.http.HostPermits;
import com.sentinelv.core.model.ScanStats;
import com.sentinelv.core.model.TlsRecord;
import com.sentinelv.core.util.Pacer;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.net.ssl.SSLSocketFactory;
import java.security.cert.Certificate;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class TlsProbeTest {

    private static LocalTlsServer server;

    private final ScanStats stats = new ScanStats();
    private final HostPermits permits = new HostPermits(2);

    @BeforeAll
    static void start() throws Exception {
        server = new LocalTlsServer();
    }

    @AfterAll
    static void stop() throws Exception {
        server.close();
    }

    private TlsProbe probeWith(SSLSocketFactory factory) {
        return new TlsProbe(factory, server.port(), permits, "example.com", Pacer.none(), stats, Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("신뢰된 인증서: valid, 발급자 O= 추출")
    void trusted_certificate_is_valid() throws Exception {
        TlsRecord r = probeWith(server.trustingFactory()).probe("localhost", "127.0.0.1");

        assertThat(r.valid()).isTrue();
        assertThat(r.checked()).isTrue();
        assertThat(r.protocolVersion()).startsWith("TLS");
        assertThat(r.cipherSuite()).startsWith("TLS_");
        assertThat(r.issuer()).isEqualTo("Sentinel Test CA");
        assertThat(r.quantumSafe()).isFalse();
        assertThat(stats.snapshot().networkCalls).isEqualTo(1);
        assertThat(stats.snapshot().tlsFailures).isZero();
        assertThat(permits.available("example.com")).isEqualTo(2);
    }

    @Test
    void self_signed_against_platform_trust_is_invalid() throws Exception {
        TlsRecord r = probeWith((SSLSocketFactory) SSLSocketFactory.getDefault()).probe("localhost", "127.0.0.1");

        assertThat(r).isEqualTo(TlsRecord.invalid());
        assertThat(stats.snapshot().tlsFailures).isEqualTo(1);
    }

    @Test
    @DisplayName("SAN 불일치 호스트명은 신뢰된 인증서라도 invalid (접속 IP 가 SAN 에 있어도)")
    void hostname_mismatch_is_invalid() throws Exception {
        // 인증서 SAN = localhost, 127.0.0.1 → 검증은 호스트명만 본다
        TlsRecord r = probeWith(server.trustingFactory()).probe("vault.example.com", "127.0.0.1");
        assertThat(r.valid()).isFalse();
        assertThat(r.issuer()).isEqualTo(TlsRecord.NA);
        assertThat(stats.snapshot().tlsFailures).isEqualTo(1);
        assertThat(permits.available("example.com")).isEqualTo(2);
    }

    @Test
    void connection_refused_is_invalid_and_releases_permit() throws Exception {
        int closedPort;
        try (java.net.ServerSocket tmp = new java.net.ServerSocket(0)) {
            closedPort = tmp.getLocalPort();
        }
        TlsProbe p = new TlsProbe(server.trustingFactory(), closedPort, permits, "example.com",
                Pacer.none(), stats, Duration.ofSeconds(2));

        assertThat(p.probe("localhost", "127.0.0.1").valid()).isFalse();
        assertThat(permits.available("example.com")).isEqualTo(2);
    }

    @Test
    void quantum_tokens_in_cipher_name() {
        assertThat(TlsProbe.isQuantumSafe("TLS_AES_256_GCM_SHA384")).isFalse();
        assertThat(TlsProbe.isQuantumSafe("X25519Kyber768Draft00")).isTrue();
        assertThat(TlsProbe.isQuantumSafe("x25519_mlkem768")).isTrue();
        assertThat(TlsProbe.isQuantumSafe("CECPQ2")).isTrue();
        assertThat(TlsProbe.isQuantumSafe(null)).isFalse();
    }

    @Test
    void issuer_falls_back_to_cn_then_na() {
        assertThat(TlsProbe.issuerOrganization(new Certificate[]{server.certificate()})).isEqualTo("Sentinel Test CA");
        assertThat(TlsProbe.issuerOrganization(new Certificate[0])).isEqualTo(TlsRecord.NA);
        assertThat(TlsProbe.issuerOrganization(null)).isEqualTo(TlsRecord.NA);
    }
}
