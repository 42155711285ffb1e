package com.demo.loadclient.client;

import java.util.Locale;

/**
 * How a response body is handed back to the caller.
 */
public enum ResponseType {
    /** Body decoded as a String */
    TEXT,

    /** Raw bytes */
    BINARY,

    /** Body read and discarded */
    NONE;

    public static ResponseType fromString(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid response type " + value, e);
        }
    }
}
