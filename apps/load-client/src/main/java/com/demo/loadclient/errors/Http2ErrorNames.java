package com.demo.loadclient.errors;

/**
 * HTTP/2 protocol error codes (RFC 9113 section 7) known to the classifier.
 */
final class Http2ErrorNames {

    private static final String[] NAMES = {
        "NO_ERROR",
        "PROTOCOL_ERROR",
        "INTERNAL_ERROR",
        "FLOW_CONTROL_ERROR",
        "SETTINGS_TIMEOUT",
        "STREAM_CLOSED",
        "FRAME_SIZE_ERROR",
        "REFUSED_STREAM",
        "CANCEL",
        "COMPRESSION_ERROR",
        "CONNECT_ERROR",
        "ENHANCE_YOUR_CALM",
        "INADEQUATE_SECURITY",
        "HTTP_1_1_REQUIRED"
    };

    private Http2ErrorNames() {
    }

    static int offset(long subcode) {
        if (subcode < 0 || subcode >= NAMES.length) {
            return 0;
        }
        return 1 + (int) subcode;
    }

    static String name(long subcode) {
        if (subcode < 0 || subcode >= NAMES.length) {
            return String.format("unknown error code 0x%x", subcode);
        }
        return NAMES[(int) subcode];
    }
}
