package com.demo.loadclient.client;

import com.demo.loadclient.errors.BlockedAddressException;
import com.demo.loadclient.errors.BlockedHostnameException;
import okhttp3.Dns;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * DNS resolver enforcing blocked hostnames and blocked address ranges.
 *
 * Hostname patterns are exact names or {@code *.suffix} wildcards. Ranges are CIDR blocks
 * ({@code 10.0.0.0/8}, {@code ::1/128}) or single addresses.
 */
public class PolicyDns implements Dns {

    private final Dns delegate;
    private final List<IpRange> blockedRanges;
    private final List<String> blockedHostnames;

    public PolicyDns(Dns delegate, List<String> blockedIps, List<String> blockedHostnames) {
        this.delegate = delegate;
        this.blockedRanges = new ArrayList<>(blockedIps.size());
        for (String cidr : blockedIps) {
            if (!cidr.isBlank()) {
                blockedRanges.add(IpRange.parse(cidr));
            }
        }
        this.blockedHostnames = blockedHostnames.stream()
            .map(h -> h.trim().toLowerCase(Locale.ROOT))
            .filter(h -> !h.isEmpty())
            .toList();
    }

    @Override
    public List<InetAddress> lookup(String hostname) throws UnknownHostException {
        String host = hostname.toLowerCase(Locale.ROOT);
        for (String pattern : blockedHostnames) {
            if (matches(pattern, host)) {
                throw new BlockedHostnameException(hostname, pattern);
            }
        }

        List<InetAddress> resolved = delegate.lookup(hostname);
        if (blockedRanges.isEmpty()) {
            return resolved;
        }
        List<InetAddress> allowed = new ArrayList<>(resolved.size());
        InetAddress firstBlocked = null;
        for (InetAddress address : resolved) {
            if (isBlocked(address)) {
                if (firstBlocked == null) {
                    firstBlocked = address;
                }
            } else {
                allowed.add(address);
            }
        }
        if (allowed.isEmpty() && firstBlocked != null) {
            throw new BlockedAddressException(hostname, firstBlocked);
        }
        return allowed;
    }

    boolean isBlocked(InetAddress address) {
        for (IpRange range : blockedRanges) {
            if (range.contains(address)) {
                return true;
            }
        }
        return false;
    }

    private static boolean matches(String pattern, String host) {
        if (pattern.startsWith("*.")) {
            return host.endsWith(pattern.substring(1));
        }
        return pattern.equals(host);
    }

    record IpRange(byte[] network, int prefix) {

        static IpRange parse(String cidr) {
            String value = cidr.trim();
            int slash = value.indexOf('/');
            String addressPart = slash < 0 ? value : value.substring(0, slash);
            byte[] network = literal(addressPart, cidr);
            int prefix = network.length * 8;
            if (slash >= 0) {
                try {
                    prefix = Integer.parseInt(value.substring(slash + 1));
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("invalid CIDR prefix in " + cidr, e);
                }
                if (prefix < 0 || prefix > network.length * 8) {
                    throw new IllegalArgumentException("invalid CIDR prefix in " + cidr);
                }
            }
            return new IpRange(network, prefix);
        }

        boolean contains(InetAddress address) {
            byte[] candidate = address.getAddress();
            if (candidate.length != network.length) {
                return false;
            }
            int fullBytes = prefix / 8;
            for (int i = 0; i < fullBytes; i++) {
                if (candidate[i] != network[i]) {
                    return false;
                }
            }
            int remainingBits = prefix % 8;
            if (remainingBits == 0) {
                return true;
            }
            int mask = (0xFF << (8 - remainingBits)) & 0xFF;
            return (candidate[fullBytes] & mask) == (network[fullBytes] & mask);
        }

        private static byte[] literal(String address, String cidr) {
            if (!address.matches("[0-9.]+") && !address.contains(":")) {
                throw new IllegalArgumentException("not an IP address: " + cidr);
            }
            try {
                // literal addresses are parsed without a lookup
                return InetAddress.getByName(address).getAddress();
            } catch (UnknownHostException e) {
                throw new IllegalArgumentException("not an IP address: " + cidr, e);
            }
        }
    }
}
