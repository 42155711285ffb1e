package com.demo.loadclient.client;

import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.lang.Nullable;

import java.io.IOException;

/**
 * Reads a response body according to the requested {@link ResponseType}.
 *
 * The body is always consumed and the response closed, so the connection can go back
 * to the pool.
 */
final class ResponseBodies {

    private ResponseBodies() {
    }

    @Nullable
    static Object read(ResponseType type, Response response) throws IOException {
        try (response) {
            ResponseBody body = response.body();
            if (body == null || hasNoContent(response.code())) {
                return null;
            }
            return switch (type) {
                case TEXT -> body.string();
                case BINARY -> body.bytes();
                case NONE -> {
                    body.bytes();
                    yield null;
                }
            };
        }
    }

    /** 1xx, 204 and 304 never carry content (RFC 9110 section 6.4.1). */
    static boolean hasNoContent(int status) {
        return (status >= 100 && status <= 199) || status == 204 || status == 304;
    }
}
