package com.demo.loadclient.client;

import org.springframework.lang.Nullable;

import java.time.Duration;
import java.util.List;

/**
 * Transport settings of one {@link LoadClient}.
 *
 * Zero read/write timeouts mean no timeout. The pool settings bound idle connections only:
 * {@code maxIdleConns} is the number kept across all hosts and {@code idleConnTimeout} how
 * long each may stay idle (zero keeps OkHttp's five minute default). Neither caps the
 * number of open connections nor their lifetime.
 */
public record ClientConfig(
    @Nullable String userAgent,
    Duration dialTimeout,
    Duration readTimeout,
    Duration writeTimeout,
    Duration idleConnTimeout,
    int maxIdleConns,
    @Nullable String proxy,
    TlsConfig tls,
    List<String> blockedIps,
    List<String> blockedHostnames
) {
    public static final Duration DEFAULT_DIAL_TIMEOUT = Duration.ofSeconds(5);
    public static final int DEFAULT_MAX_IDLE_CONNS = 1;

    public ClientConfig {
        if (dialTimeout == null || dialTimeout.isZero() || dialTimeout.isNegative()) {
            dialTimeout = DEFAULT_DIAL_TIMEOUT;
        }
        readTimeout = readTimeout == null ? Duration.ZERO : readTimeout;
        writeTimeout = writeTimeout == null ? Duration.ZERO : writeTimeout;
        idleConnTimeout = idleConnTimeout == null ? Duration.ZERO : idleConnTimeout;
        if (maxIdleConns <= 0) {
            maxIdleConns = DEFAULT_MAX_IDLE_CONNS;
        }
        if (proxy != null && proxy.isBlank()) {
            proxy = null;
        }
        tls = tls == null ? TlsConfig.DEFAULT : tls;
        blockedIps = blockedIps == null ? List.of() : List.copyOf(blockedIps);
        blockedHostnames = blockedHostnames == null ? List.of() : List.copyOf(blockedHostnames);
    }

    public static ClientConfig defaults() {
        return new ClientConfig(null, DEFAULT_DIAL_TIMEOUT, Duration.ZERO, Duration.ZERO, Duration.ZERO,
            DEFAULT_MAX_IDLE_CONNS, null, TlsConfig.DEFAULT, List.of(), List.of());
    }

    public ClientConfig withBlocked(List<String> ips, List<String> hostnames) {
        return new ClientConfig(userAgent, dialTimeout, readTimeout, writeTimeout, idleConnTimeout,
            maxIdleConns, proxy, tls, ips, hostnames);
    }

    public ClientConfig withTimeouts(Duration dial, Duration read, Duration write) {
        return new ClientConfig(userAgent, dial, read, write, idleConnTimeout,
            maxIdleConns, proxy, tls, blockedIps, blockedHostnames);
    }

    /**
     * TLS settings. Certificate and private key are PEM file paths and must be given together.
     */
    public record TlsConfig(
        boolean insecureSkipVerify,
        @Nullable String privateKey,
        @Nullable String certificate
    ) {
        public static final TlsConfig DEFAULT = new TlsConfig(false, null, null);

        public TlsConfig {
            privateKey = privateKey == null || privateKey.isBlank() ? null : privateKey;
            certificate = certificate == null || certificate.isBlank() ? null : certificate;
            if (privateKey != null && certificate == null) {
                throw new IllegalArgumentException("blank certificate");
            }
            if (privateKey == null && certificate != null) {
                throw new IllegalArgumentException("blank private key");
            }
        }

        public boolean hasClientCertificate() {
            return certificate != null;
        }
    }
}
