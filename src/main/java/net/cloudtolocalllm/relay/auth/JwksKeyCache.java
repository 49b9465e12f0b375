package net.cloudtolocalllm.relay.auth;

import java.io.IOException;
import java.math.BigInteger;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.spec.RSAPublicKeySpec;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Caches RSA signing keys from a JWKS document.
 * <p>
 * Keys are refetched once the TTL passes. A token carrying an unknown {@code kid} forces a refetch,
 * but refetches never happen more often than the cooldown. A failed refetch keeps the previous keys.
 */
public final class JwksKeyCache {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final JwksSource source;
    private final Duration ttl;
    private final Duration refreshCooldown;
    private final Clock clock;

    private Map<String, PublicKey> keys = Map.of();
    private Instant fetchedAt;
    private Instant lastAttemptAt;
    private CompletableFuture<Void> inFlight;

    public JwksKeyCache(JwksSource source, Duration ttl, Duration refreshCooldown, Clock clock) {
        this.source = Objects.requireNonNull(source, "source");
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        this.refreshCooldown = Objects.requireNonNull(refreshCooldown, "refreshCooldown");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Keys to try for a token, the one matching {@code kid} first.
     * <p>
     * The fetch runs outside the cache lock; other callers keep using the cached keys meanwhile and
     * only wait for it while no key has been loaded yet.
     */
    public List<PublicKey> candidates(String kid) {
        Instant now = clock.instant();
        boolean fetch = false;
        CompletableFuture<Void> pending;
        synchronized (this) {
            boolean stale = fetchedAt == null || !now.isBefore(fetchedAt.plus(ttl));
            boolean unknownKid = kid != null && !keys.containsKey(kid);
            if ((stale || unknownKid) && inFlight == null && mayAttempt(now)) {
                lastAttemptAt = now;
                inFlight = new CompletableFuture<>();
                fetch = true;
            }
            pending = keys.isEmpty() ? inFlight : null;
        }
        if (fetch) {
            refresh(now);
        } else if (pending != null) {
            pending.join();
        }
        return ordered(kid);
    }

    public synchronized int size() {
        return keys.size();
    }

    private synchronized List<PublicKey> ordered(String kid) {
        List<PublicKey> ordered = new ArrayList<>(keys.size());
        PublicKey preferred = kid == null ? null : keys.get(kid);
        if (preferred != null) {
            ordered.add(preferred);
        }
        for (PublicKey key : keys.values()) {
            if (key != preferred) {
                ordered.add(key);
            }
        }
        return ordered;
    }

    private boolean mayAttempt(Instant now) {
        return lastAttemptAt == null || !now.isBefore(lastAttemptAt.plus(refreshCooldown));
    }

    private void refresh(Instant now) {
        try {
            Map<String, PublicKey> parsed = parse(source.fetch());
            synchronized (this) {
                if (parsed.isEmpty()) {
                    System.err.println("JWKS contained no usable RSA signing keys; keeping " + keys.size() + " cached keys");
                } else {
                    keys = parsed;
                    fetchedAt = now;
                }
            }
        } catch (IOException e) {
            System.err.println("JWKS refresh failed, keeping " + size() + " cached keys: " + e.getMessage());
        } finally {
            CompletableFuture<Void> done;
            synchronized (this) {
                done = inFlight;
                inFlight = null;
            }
            done.complete(null);
        }
    }

    static Map<String, PublicKey> parse(String document) throws IOException {
        JsonNode root = MAPPER.readTree(document);
        JsonNode entries = root == null ? null : root.get("keys");
        if (entries == null || !entries.isArray()) {
            throw new IOException("JWKS document has no keys array");
        }
        Map<String, PublicKey> parsed = new LinkedHashMap<>();
        int index = 0;
        for (JsonNode entry : entries) {
            index++;
            if (!"RSA".equals(entry.path("kty").asText()) || "enc".equals(entry.path("use").asText())) {
                continue;
            }
            String modulus = entry.path("n").asText(null);
            String exponent = entry.path("e").asText(null);
            if (modulus == null || exponent == null) {
                continue;
            }
            String kid = entry.path("kid").asText("key-" + index);
            try {
                parsed.put(kid, rsaKey(modulus, exponent));
            } catch (GeneralSecurityException | IllegalArgumentException e) {
                System.err.println("Skipping JWKS key " + kid + ": " + e.getMessage());
            }
        }
        return parsed;
    }

    private static PublicKey rsaKey(String modulus, String exponent) throws GeneralSecurityException {
        Base64.Decoder decoder = Base64.getUrlDecoder();
        RSAPublicKeySpec spec = new RSAPublicKeySpec(
                new BigInteger(1, decoder.decode(modulus)),
                new BigInteger(1, decoder.decode(exponent))
        );
        return KeyFactory.getInstance("RSA").generatePublic(spec);
    }
}
