package net.cloudtolocalllm.relay.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class ListenAddressTest {
    @Test
    void parsesHostAndPort() {
        ListenAddress address = ListenAddress.parse("127.0.0.1:8181");
        assertEquals("127.0.0.1", address.host());
        assertEquals(8181, address.port());
    }

    @Test
    void barePortBindsLoopback() {
        assertEquals(ListenAddress.loopback(8184), ListenAddress.parse(":8184"));
    }

    @Test
    void parsesBracketedIpv6() {
        ListenAddress address = ListenAddress.parse("[::1]:8183");
        assertEquals("::1", address.host());
        assertEquals("[::1]:8183", address.toString());
    }

    @Test
    void rejectsInvalidFormat() {
        assertThrows(IllegalArgumentException.class, () -> ListenAddress.parse("bad"));
        assertThrows(IllegalArgumentException.class, () -> ListenAddress.parse("localhost:"));
        assertThrows(IllegalArgumentException.class, () -> ListenAddress.parse("localhost:0"));
        assertThrows(IllegalArgumentException.class, () -> ListenAddress.parse("localhost:http"));
    }
}
