package com.demo.loadclient.tracer;

import okhttp3.Call;
import okhttp3.Connection;
import okhttp3.EventListener;
import okhttp3.Protocol;
import org.springframework.lang.Nullable;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.Proxy;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Per-call OkHttp listener that measures one round trip and produces its {@link Trail}.
 *
 * The recorder travels with the request as a tag; {@link #FACTORY} picks it up for the call.
 */
public class TrailRecorder extends EventListener {

    public static final EventListener.Factory FACTORY = call -> {
        TrailRecorder recorder = call.request().tag(TrailRecorder.class);
        return recorder != null ? recorder : EventListener.NONE;
    };

    private long callStartNanos;
    private long dnsStartNanos;
    private long dnsNanos;
    private long connectStartNanos;
    private long connectNanos;
    @Nullable
    private InetSocketAddress remoteAddress;
    @Nullable
    private Trail trail;

    public TrailRecorder() {
        this.callStartNanos = System.nanoTime();
    }

    @Override
    public synchronized void callStart(Call call) {
        callStartNanos = System.nanoTime();
    }

    @Override
    public synchronized void dnsStart(Call call, String domainName) {
        dnsStartNanos = System.nanoTime();
    }

    @Override
    public synchronized void dnsEnd(Call call, String domainName, List<InetAddress> inetAddressList) {
        dnsNanos += System.nanoTime() - dnsStartNanos;
    }

    @Override
    public synchronized void connectStart(Call call, InetSocketAddress inetSocketAddress, Proxy proxy) {
        connectStartNanos = System.nanoTime();
    }

    @Override
    public synchronized void connectEnd(Call call, InetSocketAddress inetSocketAddress, Proxy proxy,
                                        @Nullable Protocol protocol) {
        connectNanos += System.nanoTime() - connectStartNanos;
    }

    @Override
    public synchronized void connectFailed(Call call, InetSocketAddress inetSocketAddress, Proxy proxy,
                                           @Nullable Protocol protocol, IOException ioe) {
        connectNanos += System.nanoTime() - connectStartNanos;
    }

    @Override
    public synchronized void connectionAcquired(Call call, Connection connection) {
        remoteAddress = connection.route().socketAddress();
    }

    @Override
    public synchronized void responseBodyEnd(Call call, long byteCount) {
        extendTrail();
    }

    @Override
    public synchronized void callEnd(Call call) {
        extendTrail();
    }

    @Override
    public synchronized void callFailed(Call call, IOException ioe) {
        extendTrail();
    }

    /**
     * Build the trail for a finished round trip. Later body events keep extending it.
     */
    public synchronized Trail finishRoundTrip() {
        if (trail == null) {
            trail = new Trail(Instant.now(), Duration.ofNanos(connectNanos), elapsed(), remoteAddress);
        }
        return trail;
    }

    private void extendTrail() {
        if (trail != null) {
            trail.extend(Instant.now(), elapsed());
        }
    }

    private Duration elapsed() {
        long nanos = System.nanoTime() - callStartNanos - dnsNanos - connectNanos;
        return Duration.ofNanos(Math.max(0, nanos));
    }
}
