package com.demo.loadclient.client;

import com.demo.loadclient.errors.ClassifiedError;
import com.demo.loadclient.errors.ClassifiedException;
import com.demo.loadclient.errors.ErrorClassifier;
import com.demo.loadclient.errors.ErrorCode;
import com.demo.loadclient.errors.RequestException;
import com.demo.loadclient.metrics.ExecutionState;
import com.demo.loadclient.metrics.FinishedRequest;
import com.demo.loadclient.metrics.MetricDispatcher;
import com.demo.loadclient.metrics.UnfinishedRequest;
import com.demo.loadclient.tracer.Trail;
import com.demo.loadclient.tracer.TrailRecorder;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

import java.io.Closeable;
import java.io.IOException;
import java.net.Inet6Address;
import java.net.InetSocketAddress;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * HTTP client issuing requests from pooled {@link RequestDefinition}s and recording a
 * metric sample for every round trip.
 *
 * Samples of a call are emitted when the next call starts, or on {@link #flush()}.
 * Calls through one client are expected to be sequential; clients are cheap to create
 * per execution unit.
 */
public class LoadClient implements Closeable {
    private static final Logger logger = LoggerFactory.getLogger(LoadClient.class);

    private static final Set<String> BODY_REQUIRED = Set.of("POST", "PUT", "PATCH", "PROPPATCH", "REPORT");
    private static final Set<String> BODY_FORBIDDEN = Set.of("GET", "HEAD");
    private static final byte[] EMPTY = new byte[0];

    private final OkHttpClient httpClient;
    private final MetricDispatcher dispatcher;
    private final ErrorClassifier classifier;

    public LoadClient(OkHttpClient httpClient, ExecutionState state, ErrorClassifier classifier) {
        this.httpClient = httpClient;
        this.classifier = classifier;
        this.dispatcher = new MetricDispatcher(state, classifier);
    }

    public ClientResponse get(RequestDefinition definition) throws IOException {
        return request("GET", definition);
    }

    public ClientResponse head(RequestDefinition definition) throws IOException {
        return request("HEAD", definition);
    }

    public ClientResponse post(RequestDefinition definition) throws IOException {
        return request("POST", definition);
    }

    public ClientResponse put(RequestDefinition definition) throws IOException {
        return request("PUT", definition);
    }

    public ClientResponse patch(RequestDefinition definition) throws IOException {
        return request("PATCH", definition);
    }

    public ClientResponse delete(RequestDefinition definition) throws IOException {
        return request("DELETE", definition);
    }

    public ClientResponse options(RequestDefinition definition) throws IOException {
        return request("OPTIONS", definition);
    }

    /**
     * Send one request.
     *
     * @throws RequestException on a transport or body read failure when the definition asks
     *                          to throw, and always when the request cannot be prepared
     */
    public ClientResponse request(String method, RequestDefinition definition) throws IOException {
        try (RequestPool.PooledRequest pooled = definition.getPool().acquire()) {
            try {
                if (pooled.isReused()) {
                    setupCachedRequest(pooled.builder(), definition, method);
                } else {
                    setupNewRequest(pooled.builder(), definition, method);
                }
            } catch (IOException | RuntimeException e) {
                // a half set up builder must not be reused
                pooled.discard();
                throw e;
            }
            return execute(pooled.builder(), definition, method);
        }
    }

    /**
     * Emit the samples of the last call.
     */
    public Optional<FinishedRequest> flush() {
        return dispatcher.drainAndEmit(null);
    }

    @Override
    public void close() {
        flush();
    }

    private void setupCachedRequest(Request.Builder builder, RequestDefinition definition, String method)
        throws IOException {
        // the builder keeps the previous call's method and body, both are replaced
        builder.method(method, bodyFor(definition, method));
        applyKeepAlive(builder, definition);
    }

    private void setupNewRequest(Request.Builder builder, RequestDefinition definition, String method)
        throws IOException {
        HttpUrl url = HttpUrl.parse(definition.getUrl());
        if (url == null) {
            throw new RequestException(method, definition.getUrl(),
                new ClassifiedException(ErrorCode.INVALID_URL, "invalid URL", null));
        }
        builder.url(url);

        if (definition.getHost() != null && !definition.getHost().isEmpty()) {
            builder.header("Host", definition.getHost());
        }
        applyKeepAlive(builder, definition);
        definition.getHeaders().forEach(builder::header);

        builder.method(method, bodyFor(definition, method));
    }

    private static void applyKeepAlive(Request.Builder builder, RequestDefinition definition) {
        if (definition.isDisableKeepAlive()) {
            builder.header("Connection", "close");
        } else if (!definition.getHeaders().containsKey("Connection")) {
            builder.removeHeader("Connection");
        }
    }

    @Nullable
    private RequestBody bodyFor(RequestDefinition definition, String method) throws IOException {
        if (BODY_FORBIDDEN.contains(method)) {
            return null;
        }
        if (definition.getBody() == null) {
            return BODY_REQUIRED.contains(method) ? RequestBody.create(EMPTY, null) : null;
        }
        if (definition.getBody() instanceof FileStream stream) {
            try {
                stream.rewind();
            } catch (IOException e) {
                logger.error("Failed to reset stream {} to beginning", stream.getPath(), e);
                throw e;
            }
        }
        return definition.getBody().toRequestBody();
    }

    private ClientResponse execute(Request.Builder builder, RequestDefinition definition, String method)
        throws IOException {
        dispatcher.drainAndEmit(null);

        TrailRecorder recorder = new TrailRecorder();
        Request request = builder.tag(TrailRecorder.class, recorder).build();
        String url = request.url().toString();

        Response response = null;
        RequestException failure = null;
        try {
            response = httpClient.newCall(request).execute();
        } catch (IOException e) {
            failure = new RequestException(method, url, e);
        }

        Trail trail = recorder.finishRoundTrip();
        String proto = response != null ? protoName(response.protocol()) : null;
        dispatcher.stage(new UnfinishedRequest(method, url, definition.getTags(),
            response != null ? response.code() : null, proto, trail, failure));

        if (failure != null) {
            if (definition.isThrowOnFailure()) {
                throw failure;
            }
            ClassifiedError classified = classifier.classify(failure);
            logger.warn("Request failed: {} ({})", classified.message(), classified.code(), failure);
            return ClientResponse.failed(url, classified);
        }

        ClientResponse result = new ClientResponse(response.code(), remoteIp(trail.getConnRemoteAddr()), url,
            proto, headers(response));
        try {
            result.setBody(ResponseBodies.read(definition.getResponseType(), response));
        } catch (IOException e) {
            RequestException bodyFailure = new RequestException(method, url, e);
            dispatcher.drainAndEmit(bodyFailure);
            if (definition.isThrowOnFailure()) {
                throw bodyFailure;
            }
            ClassifiedError classified = classifier.classify(bodyFailure);
            logger.warn("Reading response body failed: {} ({})", classified.message(), classified.code(), e);
            result.setError(classified);
        }
        return result;
    }

    private static Map<String, String> headers(Response response) {
        Map<String, String> headers = new LinkedHashMap<>();
        for (String name : response.headers().names()) {
            headers.put(name, response.header(name));
        }
        return headers;
    }

    @Nullable
    static String remoteIp(@Nullable InetSocketAddress address) {
        if (address == null || address.getAddress() == null) {
            return null;
        }
        String ip = address.getAddress().getHostAddress();
        if (address.getAddress() instanceof Inet6Address) {
            ip = "[" + ip + "]";
        }
        return ip + ":" + address.getPort();
    }

    static String protoName(Protocol protocol) {
        return switch (protocol) {
            case HTTP_1_0 -> "HTTP/1.0";
            case HTTP_1_1 -> "HTTP/1.1";
            case HTTP_2, H2_PRIOR_KNOWLEDGE -> "HTTP/2.0";
            default -> protocol.toString();
        };
    }
}
