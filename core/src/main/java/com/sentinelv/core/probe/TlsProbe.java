package com.sentinelv.core.probe;

import com.sentinelv.core.http.HostPermits;
import com.sentinelv.core.model.ScanStats;
import com.sentinelv.core.model.TlsRecord;
import com.sentinelv.core.util.Pacer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.naming.InvalidNameException;
import javax.naming.ldap.LdapName;
import javax.naming.ldap.Rdn;
import javax.net.ssl.SNIHostName;
import javax.net.ssl.SSLParameters;
import javax.net.ssl.SSLSession;
import javax.net.ssl.SSLSocket;
import javax.net.ssl.SSLSocketFactory;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.security.cert.Certificate;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * 해석된 IP:443 으로 TLS 핸드셰이크 한 번. SNI 와 HTTPS 호스트명 검증은 원래 호스트명 기준.
 * 신뢰 저장소는 주입된 SSLSocketFactory 의 것(기본: 플랫폼 기본값).
 * 어떤 예외든 TlsRecord.invalid().
 */
public final class TlsProbe {

    private static final Logger LOG = LoggerFactory.getLogger(TlsProbe.class);

    public static final int HTTPS_PORT = 443;
    public static final Duration CONNECT_TIMEOUT_CAP = Duration.ofSeconds(5);

    /** 하이브리드 PQC 키 교환 이름에 나타나는 토큰 */
    static final List<String> QUANTUM_TOKENS = List.of("CECPQ2", "KYBER", "NTRU", "SIKE", "MLKEM", "ML-KEM");

    private final SSLSocketFactory factory;
    private final int port;
    private final HostPermits permits;
    private final String permitKey;
    private final Pacer pacer;
    private final ScanStats stats;
    private final Duration timeout;

    public TlsProbe(SSLSocketFactory factory, int port, HostPermits permits, String permitKey,
                    Pacer pacer, ScanStats stats, Duration timeout) {
        this.factory = Objects.requireNonNull(factory, "factory");
        if (port < 1 || port > 65535) throw new IllegalArgumentException("port out of range: " + port);
        this.port = port;
        this.permits = Objects.requireNonNull(permits, "permits");
        this.permitKey = Objects.requireNonNull(permitKey, "permitKey");
        this.pacer = Objects.requireNonNull(pacer, "pacer");
        this.stats = Objects.requireNonNull(stats, "stats");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    public static TlsProbe platformDefault(HostPermits permits, String permitKey,
                                           Pacer pacer, ScanStats stats, Duration timeout) {
        return new TlsProbe((SSLSocketFactory) SSLSocketFactory.getDefault(), HTTPS_PORT,
                permits, permitKey, pacer, stats, timeout);
    }

    public TlsRecord probe(String hostname, String ip) throws InterruptedException {
        pacer.beforeCall();
        try (HostPermits.Permit ignored = permits.acquire(permitKey)) {
            stats.addNetworkCall();
            return handshake(hostname, ip);
        } catch (InterruptedException ie) {
            throw ie;
        } catch (Exception e) {
            LOG.debug("TLS {} ({}:{}) failed: {}", hostname, ip, port, e.toString());
            stats.addTlsFailure();
            return TlsRecord.invalid();
        }
    }

    private TlsRecord handshake(String hostname, String ip) throws Exception {
        int connectMs = (int) Math.min(timeout.toMillis(), CONNECT_TIMEOUT_CAP.toMillis());
        int readMs = (int) Math.min(Integer.MAX_VALUE, timeout.toMillis());

        // IP 로 평문 연결 후 호스트명으로 TLS 를 얹는다: 세션 peer host 가 IP 리터럴이면
        // SNI 이름 검증 실패 시 IP SAN 으로 대체 검증되어 버린다
        try (Socket plain = new Socket()) {
            plain.connect(new InetSocketAddress(ip, port), connectMs);
            plain.setSoTimeout(readMs);
            try (SSLSocket socket = (SSLSocket) factory.createSocket(plain, hostname, port, true)) {
                return inspect(socket, hostname);
            }
        }
    }

    private static TlsRecord inspect(SSLSocket socket, String hostname) throws Exception {
        SSLParameters params = socket.getSSLParameters();
        params.setServerNames(List.of(new SNIHostName(hostname)));
        params.setEndpointIdentificationAlgorithm("HTTPS");
        socket.setSSLParameters(params);
        socket.startHandshake();

        SSLSession session = socket.getSession();
        String cipher = session.getCipherSuite();
        String issuer = issuerOrganization(session.getPeerCertificates());
        LOG.debug("TLS {} -> {} {} issuer={}", hostname, session.getProtocol(), cipher, issuer);
        return TlsRecord.valid(session.getProtocol(), cipher, issuer, isQuantumSafe(cipher));
    }

    static boolean isQuantumSafe(String cipherSuite) {
        if (cipherSuite == null) return false;
        String upper = cipherSuite.toUpperCase(Locale.ROOT);
        for (String t : QUANTUM_TOKENS) {
            if (upper.contains(t)) return true;
        }
        return false;
    }

    /** 발급자 O=, 없으면 CN=, 그것도 없으면 "N/A" */
    static String issuerOrganization(Certificate[] chain) {
        if (chain == null || chain.length == 0 || !(chain[0] instanceof X509Certificate)) return TlsRecord.NA;
        String dn = ((X509Certificate) chain[0]).getIssuerX500Principal().getName();
        try {
            String cn = null;
            for (Rdn rdn : new LdapName(dn).getRdns()) {
                if ("O".equalsIgnoreCase(rdn.getType())) return String.valueOf(rdn.getValue());
                if ("CN".equalsIgnoreCase(rdn.getType())) cn = String.valueOf(rdn.getValue());
            }
            return cn != null ? cn : TlsRecord.NA;
        } catch (InvalidNameException e) {
            return TlsRecord.NA;
        }
    }
}
