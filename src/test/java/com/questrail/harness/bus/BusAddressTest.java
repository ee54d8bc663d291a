package com.questrail.harness.bus;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BusAddressTest {

    @Test
    void parsesTheTcpForm() {
        BusAddress address = BusAddress.parse("tcp:host=127.0.0.1,port=4711");

        assertEquals("127.0.0.1", address.host());
        assertEquals(4711, address.port());
        assertEquals("tcp:host=127.0.0.1,port=4711", address.toString());
        assertEquals(address, BusAddress.parse(address.toString()));
    }

    @Test
    void keyOrderDoesNotMatter() {
        assertEquals(new BusAddress("localhost", 1), BusAddress.parse("tcp:port=1,host=localhost"));
    }

    @Test
    void malformedAddressesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> BusAddress.parse("unix:path=/tmp/bus"));
        assertThrows(IllegalArgumentException.class, () -> BusAddress.parse("tcp:host=localhost"));
        assertThrows(IllegalArgumentException.class, () -> BusAddress.parse("tcp:host=localhost,port=abc"));
        assertThrows(IllegalArgumentException.class, () -> BusAddress.parse("tcp:host=localhost,port=70000"));
        assertThrows(IllegalArgumentException.class, () -> BusAddress.parse("tcp:garbage"));
    }
}
