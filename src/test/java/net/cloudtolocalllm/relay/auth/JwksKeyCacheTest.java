package net.cloudtolocalllm.relay.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.security.PublicKey;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import net.cloudtolocalllm.relay.support.MutableClock;
import net.cloudtolocalllm.relay.support.TestTokens;
import org.junit.jupiter.api.Test;

class JwksKeyCacheTest {
    private static final TestTokens SIGNER = new TestTokens("key-1");

    private final MutableClock clock = MutableClock.startingAt("2026-03-01T12:00:00Z");

    @Test
    void unknownKidRefetchesAtMostOncePerCooldown() {
        CountingSource source = new CountingSource(TestTokens.jwks(SIGNER));
        JwksKeyCache cache = new JwksKeyCache(source, Duration.ofMinutes(10), Duration.ofMinutes(1), clock);

        assertEquals(1, cache.candidates("key-1").size());
        cache.candidates("unknown");
        cache.candidates("unknown");
        assertEquals(1, source.fetches.get());

        clock.advance(Duration.ofSeconds(61));
        cache.candidates("unknown");
        assertEquals(2, source.fetches.get());
    }

    @Test
    void refetchesAfterTtl() {
        CountingSource source = new CountingSource(TestTokens.jwks(SIGNER));
        JwksKeyCache cache = new JwksKeyCache(source, Duration.ofMinutes(10), Duration.ofMinutes(1), clock);

        cache.candidates("key-1");
        clock.advance(Duration.ofMinutes(5));
        cache.candidates("key-1");
        assertEquals(1, source.fetches.get());

        clock.advance(Duration.ofMinutes(6));
        cache.candidates("key-1");
        assertEquals(2, source.fetches.get());
    }

    @Test
    void failedRefreshKeepsCachedKeys() {
        CountingSource source = new CountingSource(TestTokens.jwks(SIGNER));
        JwksKeyCache cache = new JwksKeyCache(source, Duration.ofMinutes(10), Duration.ofMinutes(1), clock);
        cache.candidates("key-1");

        source.failing = true;
        clock.advance(Duration.ofMinutes(11));

        assertEquals(1, cache.candidates("key-1").size());
        assertEquals(1, cache.size());
    }

    @Test
    void slowRefreshDoesNotBlockOtherCallers() throws Exception {
        CountDownLatch fetching = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger fetches = new AtomicInteger();
        String document = TestTokens.jwks(SIGNER);
        JwksKeyCache cache = new JwksKeyCache(() -> {
            if (fetches.incrementAndGet() > 1) {
                fetching.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return document;
        }, Duration.ofMinutes(10), Duration.ofMinutes(1), clock);
        cache.candidates("key-1");
        clock.advance(Duration.ofMinutes(11));

        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<List<PublicKey>> refreshing = pool.submit(() -> cache.candidates("key-1"));
            assertTrue(fetching.await(5, TimeUnit.SECONDS));

            assertEquals(1, cache.candidates("key-1").size());
            assertFalse(refreshing.isDone());

            release.countDown();
            assertEquals(1, refreshing.get(5, TimeUnit.SECONDS).size());
            assertEquals(2, fetches.get());
        } finally {
            release.countDown();
            pool.shutdownNow();
        }
    }

    @Test
    void parseSkipsEncryptionAndNonRsaKeys() throws IOException {
        String document = "{\"keys\":["
                + "{\"kty\":\"EC\",\"kid\":\"ec\",\"crv\":\"P-256\"},"
                + "{\"kty\":\"RSA\",\"kid\":\"enc\",\"use\":\"enc\",\"n\":\"AQAB\",\"e\":\"AQAB\"}"
                + "]}";
        assertEquals(0, JwksKeyCache.parse(document).size());
        assertEquals(1, JwksKeyCache.parse(TestTokens.jwks(SIGNER)).size());
        assertThrows(IOException.class, () -> JwksKeyCache.parse("{}"));
    }

    private static final class CountingSource implements JwksSource {
        private final String document;
        private final AtomicInteger fetches = new AtomicInteger();
        private volatile boolean failing;

        private CountingSource(String document) {
            this.document = document;
        }

        @Override
        public String fetch() throws IOException {
            fetches.incrementAndGet();
            if (failing) {
                throw new IOException("issuer unreachable");
            }
            return document;
        }
    }
}
