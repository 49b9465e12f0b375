package net.cloudtolocalllm.relay.auth;

import java.io.IOException;

/**
 * Supplies the raw JSON Web Key Set document.
 */
@FunctionalInterface
public interface JwksSource {
    String fetch() throws IOException;
}
