package com.demo.loadclient.errors;

import org.springframework.lang.Nullable;

import java.util.Locale;

/**
 * OS socket conditions recognizable from JDK socket exception messages.
 * The JDK drops the errno itself, so the number is restored per platform.
 */
public enum SocketErrno {
    ECONNRESET(104, 10054, "connection reset", "forcibly closed by the remote host"),
    EPIPE(32, 10058, "broken pipe"),
    ECONNREFUSED(111, 10061, "connection refused"),
    EHOSTUNREACH(113, 10065, "no route to host", "host is unreachable"),
    ENETUNREACH(101, 10051, "network is unreachable"),
    ECONNABORTED(103, 10053, "software caused connection abort", "connection aborted"),
    EADDRNOTAVAIL(99, 10049, "cannot assign requested address"),
    ETIMEDOUT(110, 10060, "connection timed out");

    private final int linuxErrno;
    private final int windowsErrno;
    private final String[] fragments;

    SocketErrno(int linuxErrno, int windowsErrno, String... fragments) {
        this.linuxErrno = linuxErrno;
        this.windowsErrno = windowsErrno;
        this.fragments = fragments;
    }

    public int number(String os) {
        return "windows".equals(os) ? windowsErrno : linuxErrno;
    }

    @Nullable
    public static SocketErrno fromMessage(@Nullable String message) {
        if (message == null) {
            return null;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        for (SocketErrno errno : values()) {
            for (String fragment : errno.fragments) {
                if (lower.contains(fragment)) {
                    return errno;
                }
            }
        }
        return null;
    }
}
