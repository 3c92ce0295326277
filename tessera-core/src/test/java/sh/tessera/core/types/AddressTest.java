// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.types;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;

class AddressTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void normalizesToLowercase() {
        Address address = new Address("0xA0b86991c6218b36c1d19D4a2e9Eb0cE3606eB48");
        assertEquals("0xa0b86991c6218b36c1d19d4a2e9eb0ce3606eb48", address.value());
        assertEquals(address, new Address("0xa0b86991c6218b36c1d19d4a2e9eb0ce3606eb48"));
    }

    @Test
    void rejectsMalformedAddresses() {
        assertThrows(IllegalArgumentException.class, () -> new Address("0x1234"));
        assertThrows(IllegalArgumentException.class, () -> new Address("a0b86991c6218b36c1d19d4a2e9eb0ce3606eb48"));
        assertThrows(IllegalArgumentException.class, () -> new Address("0xg0b86991c6218b36c1d19d4a2e9eb0ce3606eb48"));
        assertThrows(NullPointerException.class, () -> new Address(null));
        assertFalse(Address.isValid("0x" + "0".repeat(39)));
        assertTrue(Address.isValid("0x" + "0".repeat(40)));
    }

    @Test
    void bytesRoundTrip() {
        byte[] raw = new byte[20];
        raw[19] = 1;
        Address address = Address.fromBytes(raw);
        assertEquals("0x0000000000000000000000000000000000000001", address.value());
        assertEquals(20, address.toBytes().length);
        assertThrows(IllegalArgumentException.class, () -> Address.fromBytes(new byte[19]));
    }

    @Test
    void serializesAsJsonString() throws Exception {
        Address address = new Address("0x0000000000000000000000000000000000000001");
        String json = mapper.writeValueAsString(address);
        assertEquals("\"0x0000000000000000000000000000000000000001\"", json);
        assertEquals(address, mapper.readValue(json, Address.class));
    }
}
