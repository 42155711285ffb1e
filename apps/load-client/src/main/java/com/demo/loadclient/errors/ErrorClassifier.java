package com.demo.loadclient.errors;

import okhttp3.internal.http2.ConnectionShutdownException;
import okhttp3.internal.http2.StreamResetException;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import javax.net.ssl.SSLException;
import javax.net.ssl.SSLPeerUnverifiedException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.PortUnreachableException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.security.cert.CertPathBuilderException;
import java.security.cert.CertPathValidatorException;
import java.security.cert.CertificateException;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;
import java.util.zip.DataFormatException;
import java.util.zip.ZipException;

/**
 * Error Classifier: Maps any failure to a stable numeric {@link ErrorCode} and message.
 *
 * Rules are tried in order, first match wins. Wrapper kinds ({@link RequestException},
 * anything else with a cause) delegate to the same rule list, so the most specific
 * classification survives any amount of wrapping. A {@link ClassifiedException} short-circuits
 * the chain.
 *
 * Output: ClassifiedError{code, message, cause}. Never throws; unknown failures fall back
 * to {@link ErrorCode#DEFAULT} with the failure's own message.
 *
 * Used by: MetricDispatcher (error tags), LoadClient (response error fields)
 */
@Component
public class ErrorClassifier {

    private static final int MAX_DEPTH = 32;

    private static final String RESET_BY_PEER_MSG = "%s: connection reset by peer";
    private static final String BROKEN_PIPE_MSG = "%s: broken pipe";
    private static final String UNKNOWN_ERRNO_MSG = "%s: unknown errno `%d` on %s with message `%s`";
    private static final String DIAL_UNKNOWN_ERRNO_MSG = "dial: unknown errno %d error with msg `%s`";
    private static final String DIAL_TIMEOUT_MSG = "dial: i/o timeout";
    private static final String DIAL_REFUSED_MSG = "dial: connection refused";
    private static final String NO_SUCH_HOST_MSG = "lookup: no such host";
    private static final String BLACKLISTED_IP_MSG = "ip is blacklisted";
    private static final String BLOCKED_HOSTNAME_MSG = "hostname is blocked";
    private static final String HTTP2_GOAWAY_MSG = "http2: received GoAway with http2 ErrCode %s";
    private static final String HTTP2_GOAWAY_NO_CODE_MSG = "http2: received GoAway, ErrCode not reported";
    private static final String HTTP2_STREAM_MSG = "http2: stream error with http2 ErrCode %s";
    private static final String HTTP2_CONNECTION_MSG = "http2: connection error with http2 ErrCode %s";
    private static final String X509_HOSTNAME_MSG = "x509: certificate doesn't match hostname";
    private static final String X509_UNKNOWN_AUTHORITY_MSG = "x509: unknown authority";
    private static final String REQUEST_TIMEOUT_MSG = "request timeout";

    private final String os;
    private final List<Rule> rules;

    public ErrorClassifier() {
        this(System.getProperty("os.name", "unknown"));
    }

    public ErrorClassifier(String osName) {
        this.os = osName.toLowerCase(Locale.ROOT).startsWith("windows")
            ? "windows"
            : osName.toLowerCase(Locale.ROOT).split("\\s+")[0];
        this.rules = List.of(
            rule(ClassifiedException.class, e -> true,
                (e, depth) -> new ClassifiedError(e.getCode(), e.getMessage(), e.getCause())),
            rule(BlockedAddressException.class, e -> true,
                (e, depth) -> new ClassifiedError(ErrorCode.BLACKLISTED_IP, BLACKLISTED_IP_MSG, e)),
            rule(BlockedHostnameException.class, e -> true,
                (e, depth) -> new ClassifiedError(ErrorCode.BLOCKED_HOSTNAME, BLOCKED_HOSTNAME_MSG, e)),
            rule(UnknownHostException.class, e -> true, (e, depth) -> classifyDns(e)),
            rule(Http2Exception.class, e -> true, (e, depth) -> classifyHttp2(e.getKind(), e.getErrorCode(), e)),
            rule(StreamResetException.class, e -> true,
                (e, depth) -> classifyHttp2(Http2Exception.Kind.STREAM, e.errorCode.getHttpCode(), e)),
            // OkHttp raises this after a GOAWAY frame without keeping the frame's error code
            rule(ConnectionShutdownException.class, e -> true,
                (e, depth) -> new ClassifiedError(ErrorCode.HTTP2_GOAWAY_UNKNOWN, HTTP2_GOAWAY_NO_CODE_MSG, e)),
            rule(SocketTimeoutException.class, ErrorClassifier::isConnectTimeout,
                (e, depth) -> new ClassifiedError(ErrorCode.TCP_DIAL_TIMEOUT, DIAL_TIMEOUT_MSG, e)),
            rule(SocketTimeoutException.class, e -> true,
                (e, depth) -> new ClassifiedError(ErrorCode.REQUEST_TIMEOUT, REQUEST_TIMEOUT_MSG, e)),
            rule(SocketException.class, e -> true, this::classifySocketException),
            rule(CertPathBuilderException.class, e -> true,
                (e, depth) -> new ClassifiedError(ErrorCode.X509_UNKNOWN_AUTHORITY, X509_UNKNOWN_AUTHORITY_MSG, e)),
            rule(CertPathValidatorException.class, e -> true,
                (e, depth) -> new ClassifiedError(ErrorCode.X509_UNKNOWN_AUTHORITY, X509_UNKNOWN_AUTHORITY_MSG, e)),
            rule(SSLPeerUnverifiedException.class, e -> true,
                (e, depth) -> new ClassifiedError(ErrorCode.X509_HOSTNAME, X509_HOSTNAME_MSG, e)),
            rule(CertificateException.class, e -> messageContains(e, "no subject alternative", "no name matching"),
                (e, depth) -> new ClassifiedError(ErrorCode.X509_HOSTNAME, X509_HOSTNAME_MSG, e)),
            rule(CertificateException.class, e -> messageContains(e, "pkix path"),
                (e, depth) -> new ClassifiedError(ErrorCode.X509_UNKNOWN_AUTHORITY, X509_UNKNOWN_AUTHORITY_MSG, e)),
            rule(SSLException.class, e -> messageContains(e, "unrecognized ssl message", "plaintext connection"),
                (e, depth) -> new ClassifiedError(ErrorCode.TLS_HEADER, render(e), e)),
            rule(ZipException.class, e -> true,
                (e, depth) -> new ClassifiedError(ErrorCode.RESPONSE_DECOMPRESSION, render(e), e)),
            rule(DataFormatException.class, e -> true,
                (e, depth) -> new ClassifiedError(ErrorCode.RESPONSE_DECOMPRESSION, render(e), e)),
            rule(RequestException.class, e -> e.getCause() != null,
                (e, depth) -> classify(e.getCause(), depth + 1))
        );
    }

    /**
     * Classify a failure into code + message.
     *
     * @param error any failure, may be a deeply wrapped one
     * @return the most specific classification found in the cause chain
     */
    public ClassifiedError classify(Throwable error) {
        return classify(error, 0);
    }

    private ClassifiedError classify(Throwable error, int depth) {
        if (depth < MAX_DEPTH) {
            for (Rule rule : rules) {
                if (rule.matches(error)) {
                    return rule.extract(error, depth);
                }
            }
            Throwable cause = error.getCause();
            if (cause != null && cause != error) {
                return classify(cause, depth + 1);
            }
        }
        return new ClassifiedError(ErrorCode.DEFAULT, render(error), error);
    }

    private ClassifiedError classifyDns(UnknownHostException e) {
        if (messageContains(e, "temporary failure in name resolution", "try again")) {
            return new ClassifiedError(ErrorCode.DNS_DEFAULT, render(e), e);
        }
        return new ClassifiedError(ErrorCode.DNS_NO_SUCH_HOST, NO_SUCH_HOST_MSG, e);
    }

    private ClassifiedError classifyHttp2(Http2Exception.Kind kind, long subcode, Throwable e) {
        String name = Http2ErrorNames.name(subcode);
        return switch (kind) {
            case GO_AWAY -> new ClassifiedError(ErrorCode.http2(ErrorCode.HTTP2_GOAWAY_UNKNOWN, subcode),
                String.format(HTTP2_GOAWAY_MSG, name), e);
            case STREAM -> new ClassifiedError(ErrorCode.http2(ErrorCode.HTTP2_STREAM_UNKNOWN, subcode),
                String.format(HTTP2_STREAM_MSG, name), e);
            case CONNECTION -> new ClassifiedError(ErrorCode.http2(ErrorCode.HTTP2_CONNECTION_UNKNOWN, subcode),
                String.format(HTTP2_CONNECTION_MSG, name), e);
        };
    }

    private ClassifiedError classifySocketException(SocketException e, int depth) {
        if (e instanceof PortUnreachableException) {
            return new ClassifiedError(ErrorCode.NET_NON_TCP, render(e), e);
        }

        String op = operation(e);
        SocketErrno errno = SocketErrno.fromMessage(e.getMessage());
        if (errno == SocketErrno.ECONNRESET) {
            return new ClassifiedError(ErrorCode.TCP_RESET_BY_PEER, String.format(RESET_BY_PEER_MSG, op), e);
        }
        if (errno == SocketErrno.EPIPE) {
            return new ClassifiedError(ErrorCode.TCP_BROKEN_PIPE, String.format(BROKEN_PIPE_MSG, op), e);
        }

        if (!"dial".equals(op)) {
            if (errno != null) {
                return new ClassifiedError(ErrorCode.NET_UNKNOWN_ERRNO,
                    String.format(UNKNOWN_ERRNO_MSG, op, errno.number(os), os, e.getMessage()), e);
            }
            return new ClassifiedError(ErrorCode.TCP_DEFAULT, render(e), e);
        }

        if (errno == SocketErrno.ECONNREFUSED) {
            return new ClassifiedError(ErrorCode.TCP_DIAL_REFUSED, DIAL_REFUSED_MSG, e);
        }
        if (errno != null) {
            return new ClassifiedError(ErrorCode.TCP_DIAL_UNKNOWN_ERRNO,
                String.format(DIAL_UNKNOWN_ERRNO_MSG, errno.number(os), e.getMessage()), e);
        }

        // OkHttp wraps the socket's own ConnectException in a generic "Failed to connect to" one
        Throwable cause = e.getCause();
        if (cause != null && cause != e) {
            ClassifiedError wrapped = classify(cause, depth + 1);
            if (!wrapped.isDefault()) {
                return wrapped;
            }
        }
        return new ClassifiedError(ErrorCode.TCP_DIAL, render(e), e);
    }

    private static String operation(SocketException e) {
        if (e instanceof ConnectException || e instanceof NoRouteToHostException) {
            return "dial";
        }
        if (messageContains(e, "broken pipe", "by peer", "write")) {
            return "write";
        }
        return "read";
    }

    private static boolean isConnectTimeout(SocketTimeoutException e) {
        return messageContains(e, "connect");
    }

    private static boolean messageContains(Throwable e, String... fragments) {
        String message = e.getMessage();
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        for (String fragment : fragments) {
            if (lower.contains(fragment)) {
                return true;
            }
        }
        return false;
    }

    private static String render(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.toString();
    }

    private static <T extends Throwable> Rule rule(Class<T> type, Predicate<T> when, Extractor<T> extractor) {
        return new Rule(
            e -> type.isInstance(e) && when.test(type.cast(e)),
            (e, depth) -> extractor.extract(type.cast(e), depth)
        );
    }

    @FunctionalInterface
    private interface Extractor<T extends Throwable> {
        ClassifiedError extract(T error, int depth);
    }

    private record Rule(Predicate<Throwable> predicate, Extractor<Throwable> extractor) {
        boolean matches(@Nullable Throwable error) {
            return error != null && predicate.test(error);
        }

        ClassifiedError extract(Throwable error, int depth) {
            return extractor.extract(error, depth);
        }
    }
}
