package com.demo.loadclient.errors;

import java.net.UnknownHostException;

/**
 * A hostname matched one of the blocked hostname patterns.
 */
public class BlockedHostnameException extends UnknownHostException {

    private final String pattern;

    public BlockedHostnameException(String host, String pattern) {
        super("hostname (" + host + ") is in a blocked pattern (" + pattern + ")");
        this.pattern = pattern;
    }

    public String getPattern() {
        return pattern;
    }
}
