package com.docstore.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class IdentifierTest {

    @Test
    void hexShouldRoundTrip() {
        Identifier id = Identifier.fromHex("5D678D799139918D230CFD41");

        assertEquals("5d678d799139918d230cfd41", id.toHex());
        assertEquals(id, Identifier.of(id.toBytes()));
        assertEquals(id.toHex(), id.toString());
    }

    @Test
    void invalidInputShouldBeRejected() {
        assertFalse(Identifier.isValid(null));
        assertFalse(Identifier.isValid("5d678d"));
        assertFalse(Identifier.isValid("zz678d799139918d230cfd41"));
        assertThrows(IllegalArgumentException.class, () -> Identifier.fromHex("nope"));
        assertThrows(IllegalArgumentException.class, () -> Identifier.of(new byte[11]));
    }

    @Test
    void identifiersShouldOrderByUnsignedBytes() {
        Identifier low = Identifier.fromHex("000000000000000000000001");
        Identifier high = Identifier.fromHex("ff0000000000000000000000");

        assertTrue(low.compareTo(high) < 0);
        assertTrue(high.compareTo(low) > 0);
    }
}
