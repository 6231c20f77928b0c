package com.scaniq.collector.client;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import javax.net.ssl.SSLSession;
import javax.net.ssl.SSLSocket;
import javax.net.ssl.SSLSocketFactory;
import java.net.InetSocketAddress;
import java.security.cert.Certificate;
import java.security.cert.X509Certificate;
import java.time.Instant;

/**
 * Performs a TLS handshake against a host and reports the negotiated session.
 */
@Component
@Slf4j
public class TlsInspector {

    @Value("${collector.http.timeout.connect:10000}")
    private int connectTimeout;

    public record TlsInfo(String host, String protocol, String cipherSuite, String issuer, Instant notAfter) {

        public boolean isExpired() {
            return notAfter != null && notAfter.isBefore(Instant.now());
        }
    }

    public Mono<TlsInfo> inspect(String host, int port) {
        return Mono.fromCallable(() -> handshake(host, port))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnSuccess(info -> log.debug("TLS {} for {}: {}", info.protocol(), host, info.cipherSuite()));
    }

    private TlsInfo handshake(String host, int port) throws Exception {
        SSLSocketFactory factory = (SSLSocketFactory) SSLSocketFactory.getDefault();
        try (SSLSocket socket = (SSLSocket) factory.createSocket()) {
            socket.connect(new InetSocketAddress(host, port), connectTimeout);
            socket.setSoTimeout(connectTimeout);
            socket.startHandshake();

            SSLSession session = socket.getSession();
            String issuer = null;
            Instant notAfter = null;
            Certificate[] chain = session.getPeerCertificates();
            if (chain.length > 0 && chain[0] instanceof X509Certificate leaf) {
                issuer = leaf.getIssuerX500Principal().getName();
                notAfter = leaf.getNotAfter().toInstant();
            }
            return new TlsInfo(host, session.getProtocol(), session.getCipherSuite(), issuer, notAfter);
        }
    }
}
