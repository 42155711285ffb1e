package com.demo.loadclient.errors;

/**
 * Numeric error codes attached to failed requests.
 *
 * The code space is partitioned by band: 1000s non-specific, 1100s DNS,
 * 1200s TCP, 1300s TLS, 1610/1630/1650 HTTP/2 GoAway/stream/connection,
 * 1700s content errors. A response with status &gt;= 400 gets 1000 + status.
 */
public record ErrorCode(int value) {

    /** Unrecognized failure */
    public static final ErrorCode DEFAULT = new ErrorCode(1000);

    /** Network failure on a non-TCP transport */
    public static final ErrorCode NET_NON_TCP = new ErrorCode(1010);

    /** URL could not be parsed */
    public static final ErrorCode INVALID_URL = new ErrorCode(1020);

    /** Request exceeded its read or write timeout */
    public static final ErrorCode REQUEST_TIMEOUT = new ErrorCode(1050);

    /** Resolver failure other than "no such host" */
    public static final ErrorCode DNS_DEFAULT = new ErrorCode(1100);

    public static final ErrorCode DNS_NO_SUCH_HOST = new ErrorCode(1101);

    /** Resolved address falls into a blocked range */
    public static final ErrorCode BLACKLISTED_IP = new ErrorCode(1110);

    public static final ErrorCode BLOCKED_HOSTNAME = new ErrorCode(1111);

    public static final ErrorCode TCP_DEFAULT = new ErrorCode(1200);
    public static final ErrorCode TCP_BROKEN_PIPE = new ErrorCode(1201);
    public static final ErrorCode NET_UNKNOWN_ERRNO = new ErrorCode(1202);
    public static final ErrorCode TCP_DIAL = new ErrorCode(1210);
    public static final ErrorCode TCP_DIAL_TIMEOUT = new ErrorCode(1211);
    public static final ErrorCode TCP_DIAL_REFUSED = new ErrorCode(1212);
    public static final ErrorCode TCP_DIAL_UNKNOWN_ERRNO = new ErrorCode(1213);
    public static final ErrorCode TCP_RESET_BY_PEER = new ErrorCode(1220);

    /** Reserved, nothing classifies into it yet */
    public static final ErrorCode TLS_DEFAULT = new ErrorCode(1300);
    public static final ErrorCode TLS_HEADER = new ErrorCode(1301);
    public static final ErrorCode X509_UNKNOWN_AUTHORITY = new ErrorCode(1310);
    public static final ErrorCode X509_HOSTNAME = new ErrorCode(1311);

    /** Base of the HTTP/2 GoAway partition, 1611..1624 are specific protocol codes */
    public static final ErrorCode HTTP2_GOAWAY_UNKNOWN = new ErrorCode(1610);

    /** Base of the HTTP/2 stream error partition */
    public static final ErrorCode HTTP2_STREAM_UNKNOWN = new ErrorCode(1630);

    /** Base of the HTTP/2 connection error partition */
    public static final ErrorCode HTTP2_CONNECTION_UNKNOWN = new ErrorCode(1650);

    /** Response body could not be decompressed */
    public static final ErrorCode RESPONSE_DECOMPRESSION = new ErrorCode(1701);

    public ErrorCode {
        if (value < 0) {
            throw new IllegalArgumentException("error code must not be negative: " + value);
        }
    }

    /**
     * Synthetic code for a completed response with an error status.
     * @param status HTTP status code, expected to be &gt;= 400
     * @return 1000 + status
     */
    public static ErrorCode fromHttpStatus(int status) {
        return new ErrorCode(1000 + status);
    }

    /**
     * Code inside an HTTP/2 partition for the given protocol subcode.
     * Subcodes outside the known set collapse onto the partition base.
     */
    public static ErrorCode http2(ErrorCode partition, long subcode) {
        return new ErrorCode(partition.value + Http2ErrorNames.offset(subcode));
    }

    @Override
    public String toString() {
        return Integer.toString(value);
    }
}
