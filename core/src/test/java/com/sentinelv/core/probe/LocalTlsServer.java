package com.sentinelv.core.probe;

import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x509.BasicConstraints;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.GeneralName;
import org.bouncycastle.asn1.x509.GeneralNames;
import org.bouncycastle.asn1.x509.KeyUsage;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.cert.jcajce.JcaX509v3CertificateBuilder;
import org.bouncycastle.operator.ContentSigner;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;

import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLServerSocket;
import javax.net.ssl.SSLSocket;
import javax.net.ssl.SSLSocketFactory;
import javax.net.ssl.TrustManagerFactory;
import java.io.IOException;
import java.io.InputStream;
import java.math.BigInteger;
import java.net.InetAddress;
import java.net.SocketException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.KeyStore;
import java.security.SecureRandom;
import java.security.cert.Certificate;
import java.security.cert.X509Certificate;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Date;

/**
 * 테스트용 로컬 TLS 서버 (127.0.0.1, 임의 포트).
 * 자체 서명 인증서: 발급자 "O=Sentinel Test CA, CN=localhost", SAN DNS:localhost / IP:127.0.0.1.
 * 연결마다 핸드셰이크만 하고 클라이언트가 닫을 때까지 기다린다.
 */
final class LocalTlsServer implements AutoCloseable {

    static final String ISSUER_DN = "O=Sentinel Test CA, CN=localhost";
    private static final char[] PASSWORD = "changeit".toCharArray();

    private final X509Certificate certificate;
    private final SSLServerSocket server;
    private final Thread acceptor;

    LocalTlsServer() throws Exception {
        KeyPairGenerator kpg = KeyPairGenerator.getInstance("RSA");
        kpg.initialize(2048);
        KeyPair kp = kpg.generateKeyPair();
        this.certificate = generateSelfSigned(kp);

        KeyStore ks = KeyStore.getInstance("PKCS12");
        ks.load(null, null);
        ks.setKeyEntry("local", kp.getPrivate(), PASSWORD, new Certificate[]{certificate});
        KeyManagerFactory kmf = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
        kmf.init(ks, PASSWORD);
        SSLContext ctx = SSLContext.getInstance("TLS");
        ctx.init(kmf.getKeyManagers(), null, new SecureRandom());

        this.server = (SSLServerSocket) ctx.getServerSocketFactory()
                .createServerSocket(0, 16, InetAddress.getByName("127.0.0.1"));
        this.acceptor = new Thread(this::acceptLoop, "local-tls-server");
        this.acceptor.setDaemon(true);
        this.acceptor.start();
    }

    int port() { return server.getLocalPort(); }

    X509Certificate certificate() { return certificate; }

    /** 이 서버 인증서만 신뢰하는 클라이언트 팩토리 */
    SSLSocketFactory trustingFactory() throws Exception {
        KeyStore trust = KeyStore.getInstance("PKCS12");
        trust.load(null, null);
        trust.setCertificateEntry("local", certificate);
        TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
        tmf.init(trust);
        SSLContext ctx = SSLContext.getInstance("TLS");
        ctx.init(null, tmf.getTrustManagers(), new SecureRandom());
        return ctx.getSocketFactory();
    }

    private void acceptLoop() {
        while (!server.isClosed()) {
            try (SSLSocket s = (SSLSocket) server.accept()) {
                s.setSoTimeout(5_000);
                s.startHandshake();
                InputStream in = s.getInputStream();
                while (in.read() != -1) {
                    // 클라이언트가 닫을 때까지 소비
                }
            } catch (SocketException closed) {
                if (server.isClosed()) return;
            } catch (IOException handshakeRejected) {
                // 클라이언트가 인증서를 거부한 경우 등: 다음 연결로
            }
        }
    }

    private static X509Certificate generateSelfSigned(KeyPair kp) throws Exception {
        X500Name subject = new X500Name(ISSUER_DN);
        BigInteger serial = new BigInteger(64, new SecureRandom());
        Date notBefore = Date.from(ZonedDateTime.now().minus(1, ChronoUnit.DAYS).toInstant());
        Date notAfter = Date.from(ZonedDateTime.now().plusYears(1).toInstant());

        GeneralNames san = new GeneralNames(new GeneralName[]{
                new GeneralName(GeneralName.dNSName, "localhost"),
                new GeneralName(GeneralName.iPAddress, "127.0.0.1")
        });

        JcaX509v3CertificateBuilder builder = new JcaX509v3CertificateBuilder(
                subject, serial, notBefore, notAfter, subject, kp.getPublic());
        builder.addExtension(Extension.basicConstraints, true, new BasicConstraints(false));
        builder.addExtension(Extension.subjectAlternativeName, false, san);
        builder.addExtension(Extension.keyUsage, true,
                new KeyUsage(KeyUsage.digitalSignature | KeyUsage.keyEncipherment));

        ContentSigner signer = new JcaContentSignerBuilder("SHA256withRSA").build(kp.getPrivate());
        X509CertificateHolder holder = builder.build(signer);
        return new JcaX509CertificateConverter().getCertificate(holder);
    }

    @Override
    public void close() throws IOException {
        server.close();
    }
}
