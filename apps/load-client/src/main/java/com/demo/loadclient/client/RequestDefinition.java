package com.demo.loadclient.client;

import org.springframework.lang.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A request that is sent many times: target, headers, body and response handling.
 * Every definition owns a pool of reusable transport requests.
 */
public class RequestDefinition {

    private final String url;
    @Nullable
    private final String host;
    private final Map<String, String> headers;
    @Nullable
    private final RequestPayload body;
    private final boolean throwOnFailure;
    private final boolean disableKeepAlive;
    private final ResponseType responseType;
    private final Map<String, String> tags;
    private final RequestPool pool = new RequestPool();

    private RequestDefinition(Builder builder) {
        this.url = builder.url;
        this.host = builder.host;
        this.headers = Map.copyOf(builder.headers);
        this.body = builder.body;
        this.throwOnFailure = builder.throwOnFailure;
        this.disableKeepAlive = builder.disableKeepAlive;
        this.responseType = builder.responseType;
        this.tags = Map.copyOf(builder.tags);
    }

    public static Builder builder(String url) {
        return new Builder(url);
    }

    public String getUrl() {
        return url;
    }

    /** Host header override. */
    @Nullable
    public String getHost() {
        return host;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    @Nullable
    public RequestPayload getBody() {
        return body;
    }

    public boolean isThrowOnFailure() {
        return throwOnFailure;
    }

    public boolean isDisableKeepAlive() {
        return disableKeepAlive;
    }

    public ResponseType getResponseType() {
        return responseType;
    }

    /** Extra tags for this request's samples. */
    public Map<String, String> getTags() {
        return tags;
    }

    public RequestPool getPool() {
        return pool;
    }

    public static final class Builder {
        private final String url;
        private String host;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private RequestPayload body;
        private boolean throwOnFailure;
        private boolean disableKeepAlive;
        private ResponseType responseType = ResponseType.TEXT;
        private final Map<String, String> tags = new LinkedHashMap<>();

        private Builder(String url) {
            if (url == null || url.isBlank()) {
                throw new IllegalArgumentException("request url is required");
            }
            this.url = url;
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder header(String name, String value) {
            headers.put(name, value);
            return this;
        }

        public Builder body(RequestPayload body) {
            this.body = body;
            return this;
        }

        public Builder body(String text) {
            this.body = BytesPayload.of(text);
            return this;
        }

        public Builder throwOnFailure(boolean throwOnFailure) {
            this.throwOnFailure = throwOnFailure;
            return this;
        }

        public Builder disableKeepAlive(boolean disableKeepAlive) {
            this.disableKeepAlive = disableKeepAlive;
            return this;
        }

        public Builder responseType(ResponseType responseType) {
            this.responseType = responseType;
            return this;
        }

        public Builder tag(String name, String value) {
            tags.put(name, value);
            return this;
        }

        public RequestDefinition build() {
            return new RequestDefinition(this);
        }
    }
}
