package com.demo.loadclient.errors;

import java.io.IOException;

/**
 * Transport failure of a single round trip, naming the method and URL it happened on.
 * Classification always looks through it to the cause.
 */
public class RequestException extends IOException {

    private final String method;
    private final String url;

    public RequestException(String method, String url, Throwable cause) {
        super(method + " \"" + url + "\": " + cause.getMessage(), cause);
        this.method = method;
        this.url = url;
    }

    public String getMethod() {
        return method;
    }

    public String getUrl() {
        return url;
    }
}
