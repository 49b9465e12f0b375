package net.cloudtolocalllm.relay.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class UserIdHashTest {
    @Test
    void shortHashIsStableAndHidesTheId() {
        String first = UserIdHash.shortHash("auth0|alice");
        assertEquals(first, UserIdHash.shortHash("auth0|alice"));
        assertEquals(UserIdHash.SHORT_LENGTH, first.length());
        assertFalse(first.contains("alice"));
        assertNotEquals(first, UserIdHash.shortHash("auth0|bob"));
    }

    @Test
    void rejectsEmptyIds() {
        assertThrows(IllegalArgumentException.class, () -> UserIdHash.hash(""));
    }
}
