package com.demo.loadclient.errors;

import java.io.IOException;

/**
 * HTTP/2 protocol failure reported by a transport, carrying the raw protocol error code.
 */
public class Http2Exception extends IOException {

    public enum Kind {
        GO_AWAY,
        STREAM,
        CONNECTION
    }

    private final Kind kind;
    private final long errorCode;

    public Http2Exception(Kind kind, long errorCode) {
        super("http2 " + kind.name().toLowerCase() + " error, code " + errorCode);
        this.kind = kind;
        this.errorCode = errorCode;
    }

    public Kind getKind() {
        return kind;
    }

    public long getErrorCode() {
        return errorCode;
    }
}
