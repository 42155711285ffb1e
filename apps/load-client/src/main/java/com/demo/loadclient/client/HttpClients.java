package com.demo.loadclient.client;

import com.demo.loadclient.tracer.TrailRecorder;
import okhttp3.ConnectionPool;
import okhttp3.Credentials;
import okhttp3.Dns;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.tls.HandshakeCertificates;
import okhttp3.tls.HeldCertificate;

import javax.net.ssl.KeyManager;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Proxy;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.cert.X509Certificate;
import java.util.concurrent.TimeUnit;

/**
 * Builds the OkHttp client behind a {@link LoadClient}.
 */
public final class HttpClients {

    private static final long DEFAULT_KEEP_ALIVE_MILLIS = TimeUnit.MINUTES.toMillis(5);

    private HttpClients() {
    }

    public static OkHttpClient build(ClientConfig config) {
        long keepAliveMillis = config.idleConnTimeout().isZero()
            ? DEFAULT_KEEP_ALIVE_MILLIS
            : config.idleConnTimeout().toMillis();

        OkHttpClient.Builder builder = new OkHttpClient.Builder()
            .connectTimeout(config.dialTimeout().toMillis(), TimeUnit.MILLISECONDS)
            .readTimeout(config.readTimeout().toMillis(), TimeUnit.MILLISECONDS)
            .writeTimeout(config.writeTimeout().toMillis(), TimeUnit.MILLISECONDS)
            .connectionPool(new ConnectionPool(config.maxIdleConns(), keepAliveMillis, TimeUnit.MILLISECONDS))
            // one call is one round trip: no silent retries, no redirects
            .retryOnConnectionFailure(false)
            .followRedirects(false)
            .followSslRedirects(false)
            .dns(new PolicyDns(Dns.SYSTEM, config.blockedIps(), config.blockedHostnames()))
            .eventListenerFactory(TrailRecorder.FACTORY);

        if (config.userAgent() != null) {
            String userAgent = config.userAgent();
            builder.addInterceptor(chain -> {
                Request request = chain.request();
                if (request.header("User-Agent") != null) {
                    return chain.proceed(request);
                }
                return chain.proceed(request.newBuilder().header("User-Agent", userAgent).build());
            });
        }

        if (config.proxy() != null) {
            configureProxy(builder, config.proxy());
        }

        ClientConfig.TlsConfig tls = config.tls();
        if (tls.insecureSkipVerify() || tls.hasClientCertificate()) {
            configureTls(builder, tls);
        }
        return builder.build();
    }

    private static void configureProxy(OkHttpClient.Builder builder, String proxy) {
        URI uri = URI.create(proxy.contains("://") ? proxy : "http://" + proxy);
        if (uri.getHost() == null || uri.getPort() < 0) {
            throw new IllegalArgumentException("proxy must be host:port, got " + proxy);
        }
        builder.proxy(new Proxy(Proxy.Type.HTTP, InetSocketAddress.createUnresolved(uri.getHost(), uri.getPort())));

        String userInfo = uri.getUserInfo();
        if (userInfo != null && userInfo.contains(":")) {
            String credentials = Credentials.basic(
                userInfo.substring(0, userInfo.indexOf(':')),
                userInfo.substring(userInfo.indexOf(':') + 1));
            builder.proxyAuthenticator((route, response) -> response.request().newBuilder()
                .header("Proxy-Authorization", credentials)
                .build());
        }
    }

    private static void configureTls(OkHttpClient.Builder builder, ClientConfig.TlsConfig tls) {
        try {
            HandshakeCertificates.Builder certificates = new HandshakeCertificates.Builder()
                .addPlatformTrustedCertificates();
            if (tls.hasClientCertificate()) {
                String pem = Files.readString(Path.of(tls.certificate())) + "\n"
                    + Files.readString(Path.of(tls.privateKey()));
                certificates.heldCertificate(HeldCertificate.decode(pem));
            }
            HandshakeCertificates handshakeCertificates = certificates.build();

            X509TrustManager trustManager = tls.insecureSkipVerify()
                ? new TrustAllManager()
                : handshakeCertificates.trustManager();
            SSLContext context = SSLContext.getInstance("TLS");
            context.init(new KeyManager[]{handshakeCertificates.keyManager()}, new TrustManager[]{trustManager}, null);

            builder.sslSocketFactory(context.getSocketFactory(), trustManager);
            if (tls.insecureSkipVerify()) {
                builder.hostnameVerifier((hostname, session) -> true);
            }
        } catch (IOException | IllegalArgumentException e) {
            throw new IllegalArgumentException("failed to load key/cert; " + e.getMessage(), e);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("failed to initialize TLS", e);
        }
    }

    private static final class TrustAllManager implements X509TrustManager {
        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType) {
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType) {
        }

        @Override
        public X509Certificate[] getAcceptedIssuers() {
            return new X509Certificate[0];
        }
    }
}
