package me.golemcore.rvsafety.domain.service;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PinHasherTest {

    private final PinHasher pinHasher = new PinHasher();

    @Test
    void shouldHashPinConcatenatedWithSalt() {
        // SHA-256("abc")
        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad",
                pinHasher.hash("ab", "c"));
        assertEquals(pinHasher.hash("12", "3400ff"), pinHasher.hash("1234", "00ff"));
    }

    @Test
    void shouldMatchOnlyCorrectPin() {
        String salt = pinHasher.generateSalt();
        String hash = pinHasher.hash("4321", salt);

        assertTrue(pinHasher.matches("4321", salt, hash));
        assertFalse(pinHasher.matches("4320", salt, hash));
        assertFalse(pinHasher.matches("4321", pinHasher.generateSalt(), hash));
        assertFalse(pinHasher.matches(null, salt, hash));
        assertFalse(pinHasher.matches("4321", salt, null));
    }

    @Test
    void shouldGenerateHexSalts() {
        String salt = pinHasher.generateSalt();

        assertEquals(32, salt.length());
        assertTrue(salt.matches("[0-9a-f]+"));
        assertNotEquals(salt, pinHasher.generateSalt());
    }

    @Test
    void shouldGenerateUrlSafeSessionTokens() {
        Set<String> tokens = new HashSet<>();
        for (int i = 0; i < 50; i++) {
            String token = pinHasher.generateSessionToken();
            assertEquals(43, token.length());
            assertTrue(token.matches("[A-Za-z0-9_-]+"));
            tokens.add(token);
        }
        assertEquals(50, tokens.size());
    }

    @Test
    void shouldGenerateNumericPinsOfRequestedLength() {
        String pin = pinHasher.generateNumericPin(6);

        assertEquals(6, pin.length());
        assertTrue(pin.chars().allMatch(Character::isDigit));
    }
}
