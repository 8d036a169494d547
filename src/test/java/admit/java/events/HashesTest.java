package admit.java.events;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HashesTest {

    @Test
    void testShortHash_isStableSixteenHexChars() {
        // sha256("abc") = ba7816bf8f01cfea414140de5dae2223...
        assertEquals("ba7816bf8f01cfea", Hashes.shortHash("abc"));
        assertEquals(Hashes.shortHash("10.0.0.1"), Hashes.shortHash("10.0.0.1"));
        assertNotEquals(Hashes.shortHash("10.0.0.1"), Hashes.shortHash("10.0.0.2"));
        assertTrue(Hashes.shortHash("user-1").matches("[0-9a-f]{16}"));
    }

    @Test
    void testShortHash_null() {
        assertNull(Hashes.shortHash(null));
    }
}
