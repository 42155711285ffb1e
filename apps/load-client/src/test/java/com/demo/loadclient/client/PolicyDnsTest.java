package com.demo.loadclient.client;

import com.demo.loadclient.errors.BlockedAddressException;
import com.demo.loadclient.errors.BlockedHostnameException;
import okhttp3.Dns;
import org.junit.jupiter.api.Test;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PolicyDnsTest {

    private static InetAddress ip(int a, int b, int c, int d) throws UnknownHostException {
        return InetAddress.getByAddress(new byte[]{(byte) a, (byte) b, (byte) c, (byte) d});
    }

    private static Dns fixed(InetAddress... addresses) {
        return hostname -> List.of(addresses);
    }

    @Test
    void testBlockedHostnamePatterns() throws Exception {
        PolicyDns dns = new PolicyDns(fixed(ip(1, 2, 3, 4)), List.of(), List.of("exact.test", "*.wild.test"));

        assertThrows(BlockedHostnameException.class, () -> dns.lookup("exact.test"));
        assertThrows(BlockedHostnameException.class, () -> dns.lookup("API.wild.test"));
        assertEquals(List.of(ip(1, 2, 3, 4)), dns.lookup("wild.test"));
        assertEquals(List.of(ip(1, 2, 3, 4)), dns.lookup("other.test"));
    }

    @Test
    void testBlockedHostnameCarriesPattern() throws Exception {
        PolicyDns dns = new PolicyDns(fixed(ip(1, 2, 3, 4)), List.of(), List.of("*.wild.test"));

        BlockedHostnameException e = assertThrows(BlockedHostnameException.class, () -> dns.lookup("a.wild.test"));
        assertEquals("*.wild.test", e.getPattern());
    }

    @Test
    void testAllAddressesBlocked() throws Exception {
        PolicyDns dns = new PolicyDns(fixed(ip(10, 1, 2, 3), ip(10, 9, 9, 9)), List.of("10.0.0.0/8"), List.of());

        BlockedAddressException e = assertThrows(BlockedAddressException.class, () -> dns.lookup("internal"));
        assertEquals(ip(10, 1, 2, 3), e.getAddress());
    }

    @Test
    void testBlockedAddressesAreFilteredOut() throws Exception {
        PolicyDns dns = new PolicyDns(fixed(ip(192, 168, 1, 7), ip(8, 8, 8, 8)), List.of("192.168.0.0/16"), List.of());

        assertEquals(List.of(ip(8, 8, 8, 8)), dns.lookup("mixed"));
    }

    @Test
    void testRangeMatching() throws Exception {
        PolicyDns dns = new PolicyDns(fixed(), List.of("172.16.0.0/12", "1.2.3.4", "::1/128", " "), List.of());

        assertTrue(dns.isBlocked(ip(172, 31, 255, 255)));
        assertFalse(dns.isBlocked(ip(172, 32, 0, 0)));
        assertTrue(dns.isBlocked(ip(1, 2, 3, 4)));
        assertFalse(dns.isBlocked(ip(1, 2, 3, 5)));
        assertTrue(dns.isBlocked(InetAddress.getByName("::1")));
    }

    @Test
    void testInvalidRanges() {
        assertThrows(IllegalArgumentException.class, () -> new PolicyDns(fixed(), List.of("example.com"), List.of()));
        assertThrows(IllegalArgumentException.class, () -> new PolicyDns(fixed(), List.of("10.0.0.0/33"), List.of()));
        assertThrows(IllegalArgumentException.class, () -> new PolicyDns(fixed(), List.of("10.0.0.0/x"), List.of()));
    }
}
