package com.demo.loadclient.client;

import okhttp3.MediaType;
import okhttp3.RequestBody;
import org.springframework.lang.Nullable;

import java.nio.charset.StandardCharsets;

/**
 * In-memory request body.
 */
public final class BytesPayload implements RequestPayload {

    private final byte[] bytes;
    @Nullable
    private final MediaType contentType;

    public BytesPayload(byte[] bytes, @Nullable MediaType contentType) {
        this.bytes = bytes.clone();
        this.contentType = contentType;
    }

    public static BytesPayload of(String text) {
        return new BytesPayload(text.getBytes(StandardCharsets.UTF_8), null);
    }

    @Override
    public RequestBody toRequestBody() {
        return RequestBody.create(bytes, contentType);
    }
}
