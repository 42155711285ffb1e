package com.demo.loadclient.client;

import com.demo.loadclient.errors.ClassifiedError;
import org.springframework.lang.Nullable;

import java.util.Map;

/**
 * Outcome of one call handed back to the caller. A failed round trip has status 0 and
 * carries the classified error code and message.
 */
public class ClientResponse {

    private final int status;
    @Nullable
    private final String remoteIp;
    private final String url;
    @Nullable
    private final String proto;
    private final Map<String, String> headers;
    @Nullable
    private Object body;
    @Nullable
    private String error;
    private int errorCode;

    public ClientResponse(int status, @Nullable String remoteIp, String url, @Nullable String proto,
                          Map<String, String> headers) {
        this.status = status;
        this.remoteIp = remoteIp;
        this.url = url;
        this.proto = proto;
        this.headers = Map.copyOf(headers);
    }

    static ClientResponse failed(String url, ClassifiedError error) {
        ClientResponse response = new ClientResponse(0, null, url, null, Map.of());
        response.setError(error);
        return response;
    }

    public int getStatus() {
        return status;
    }

    /** ip:port of the peer. */
    @Nullable
    public String getRemoteIp() {
        return remoteIp;
    }

    public String getUrl() {
        return url;
    }

    @Nullable
    public String getProto() {
        return proto;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    /** String for text responses, byte[] for binary ones, null for none or no content. */
    @Nullable
    public Object getBody() {
        return body;
    }

    @Nullable
    public String getError() {
        return error;
    }

    /** 0 when no error occurred. */
    public int getErrorCode() {
        return errorCode;
    }

    public boolean isFailed() {
        return error != null;
    }

    void setBody(@Nullable Object body) {
        this.body = body;
    }

    void setError(ClassifiedError classified) {
        this.error = classified.message();
        this.errorCode = classified.code().value();
    }
}
