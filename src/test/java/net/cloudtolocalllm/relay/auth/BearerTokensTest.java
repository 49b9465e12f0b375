package net.cloudtolocalllm.relay.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import org.junit.jupiter.api.Test;

class BearerTokensTest {
    @Test
    void extractsBearerCredential() {
        assertEquals("abc.def.ghi", BearerTokens.extract("Bearer abc.def.ghi"));
        assertEquals("abc.def.ghi", BearerTokens.extract("  bearer   abc.def.ghi "));
    }

    @Test
    void ignoresOtherSchemes() {
        assertNull(BearerTokens.extract(null));
        assertNull(BearerTokens.extract("Basic dXNlcjpwYXNz"));
        assertNull(BearerTokens.extract("Bearer "));
    }
}
