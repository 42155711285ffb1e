package com.demo.loadclient.errors;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * A host resolved to an address inside a blocked range.
 */
public class BlockedAddressException extends UnknownHostException {

    private final InetAddress address;

    public BlockedAddressException(String host, InetAddress address) {
        super("IP (" + address.getHostAddress() + ") for " + host + " is in a blacklisted range");
        this.address = address;
    }

    public InetAddress getAddress() {
        return address;
    }
}
