package com.demo.loadclient.client;

import okhttp3.RequestBody;

import java.io.IOException;

/**
 * Body of a request definition: in-memory bytes or a streamed file.
 */
public interface RequestPayload {

    /**
     * Prepare the payload for one more send and return the body to transmit.
     */
    RequestBody toRequestBody() throws IOException;
}
