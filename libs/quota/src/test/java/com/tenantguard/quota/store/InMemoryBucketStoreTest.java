package com.tenantguard.quota.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("InMemoryBucketStore")
class InMemoryBucketStoreTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    private final InMemoryBucketStore store = new InMemoryBucketStore();

    @Test
    @DisplayName("modify() sees an empty bucket on first use and stores the result")
    void firstUse() {
        String result = store.modify("user:u1:op", current -> {
            assertThat(current).isEmpty();
            return new BucketTransition.Outcome<>(Bucket.full("user:u1:op", 5, NOW), "created");
        });

        assertThat(result).isEqualTo("created");
        assertThat(store.find("user:u1:op")).get().extracting(Bucket::tokens).isEqualTo(5);
    }

    @Test
    @DisplayName("modify() rejects a transition that changes the key")
    void keyMismatch() {
        assertThatThrownBy(() -> store.modify("a", current ->
                new BucketTransition.Outcome<>(Bucket.full("b", 1, NOW), null)))
                .isInstanceOf(IllegalStateException.class);
        assertThat(store.find("a")).isEmpty();
    }

    @Test
    @DisplayName("modify() serializes concurrent writers of one key")
    void noLostUpdates() throws Exception {
        store.modify("k", c -> new BucketTransition.Outcome<>(Bucket.full("k", 0, NOW), null));
        int threads = 16;
        int perThread = 250;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            for (int t = 0; t < threads; t++) {
                pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        store.modify("k", c -> {
                            Bucket b = c.orElseThrow();
                            return new BucketTransition.Outcome<>(b.withTokens(b.tokens() + 1, NOW), null);
                        });
                    }
                    return null;
                });
            }
            start.countDown();
        } finally {
            pool.shutdown();
            assertThat(pool.awaitTermination(30, TimeUnit.SECONDS)).isTrue();
        }

        assertThat(store.find("k").orElseThrow().tokens()).isEqualTo(threads * perThread);
    }

    @Test
    @DisplayName("clearExpiredBlocks() lifts ended blocks and resets their violations")
    void clearExpired() {
        store.modify("expired", c -> new BucketTransition.Outcome<>(
                new Bucket("expired", 0, NOW, 7, NOW.minusSeconds(1)), null));
        store.modify("active", c -> new BucketTransition.Outcome<>(
                new Bucket("active", 0, NOW, 7, NOW.plus(Duration.ofMinutes(5))), null));
        store.modify("clean", c -> new BucketTransition.Outcome<>(Bucket.full("clean", 3, NOW), null));

        assertThat(store.clearExpiredBlocks(NOW)).isEqualTo(1);

        assertThat(store.find("expired").orElseThrow())
                .satisfies(b -> {
                    assertThat(b.blockedUntil()).isNull();
                    assertThat(b.violations()).isZero();
                });
        assertThat(store.find("active").orElseThrow().violations()).isEqualTo(7);
    }
}
