package com.libragraph.datastore.core.storage;

import com.libragraph.datastore.core.config.StorageConfig;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.*;

class DownloadRetryPolicyTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(150);

    private static DownloadRetryPolicy policy(int retries) {
        return new DownloadRetryPolicy(new StorageConfig.Download(retries, TIMEOUT, Duration.ZERO, 1.0));
    }

    private static StorageException transientFailure(String message) {
        return new StorageException(message, "s3://b/k", new IOException("connection reset"), true);
    }

    // --- transient failures ---

    @Test
    void succeedsWithoutRetry() {
        AtomicInteger attempts = new AtomicInteger();

        policy(2).run("s3://b/k", attempts::incrementAndGet);

        assertThat(attempts).hasValue(1);
    }

    @Test
    void retriesTransientFailureUntilSuccess() {
        AtomicInteger attempts = new AtomicInteger();

        policy(2).run("s3://b/k", () -> {
            if (attempts.incrementAndGet() < 3) {
                throw transientFailure("Failed to download");
            }
        });

        assertThat(attempts).hasValue(3);
    }

    @Test
    void rethrowsLastFailureWhenRetriesExhausted() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> policy(2).run("s3://b/k", () -> {
            throw transientFailure("attempt " + attempts.incrementAndGet());
        }))
                .isInstanceOf(StorageException.class)
                .hasMessage("attempt 3: s3://b/k");
    }

    @Test
    void zeroRetriesFailsImmediately() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> policy(0).run("s3://b/k", () -> {
            attempts.incrementAndGet();
            throw transientFailure("boom");
        })).hasMessage("boom: s3://b/k");

        assertThat(attempts).hasValue(1);
    }

    // --- permanent failures ---

    @Test
    void neverRetriesNotFound() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> policy(5).run("s3://b/k", () -> {
            attempts.incrementAndGet();
            throw new ObjectNotFoundException("s3://b/k");
        })).isInstanceOf(ObjectNotFoundException.class);

        assertThat(attempts).hasValue(1);
    }

    @Test
    void neverRetriesNonTransientFailure() {
        AtomicInteger attempts = new AtomicInteger();
        StorageException denied = new StorageException(
                "Failed to download", "s3://b/k", new IllegalStateException("AccessDenied"), false);

        assertThatThrownBy(() -> policy(5).run("s3://b/k", () -> {
            attempts.incrementAndGet();
            throw denied;
        })).isSameAs(denied);

        assertThat(attempts).hasValue(1);
    }

    @Test
    void doesNotCatchIllegalArgument() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatIllegalArgumentException().isThrownBy(() -> policy(5).run("s3://b/k", () -> {
            attempts.incrementAndGet();
            throw new IllegalArgumentException("bad key");
        }));

        assertThat(attempts).hasValue(1);
    }

    // --- timeout ---

    @Test
    void stopsRetryingOnceWaitWouldPassTimeout() {
        AtomicLong now = new AtomicLong();
        AtomicInteger attempts = new AtomicInteger();
        // each attempt takes 5s; after the second, 10s have passed of an 8s budget
        DownloadRetryPolicy policy = new DownloadRetryPolicy(
                new StorageConfig.Download(5, Duration.ofSeconds(8), Duration.ofMillis(4), 5.0),
                now::get);

        assertThatThrownBy(() -> policy.run("s3://b/k", () -> {
            attempts.incrementAndGet();
            now.addAndGet(Duration.ofSeconds(5).toNanos());
            throw transientFailure("Failed to download");
        })).isInstanceOf(StorageException.class);

        assertThat(attempts).hasValue(2);
    }

    @Test
    void retriesWhileWithinTimeout() {
        AtomicLong now = new AtomicLong();
        AtomicInteger attempts = new AtomicInteger();
        DownloadRetryPolicy policy = new DownloadRetryPolicy(
                new StorageConfig.Download(3, Duration.ofSeconds(60), Duration.ZERO, 1.0),
                now::get);

        policy.run("s3://b/k", () -> {
            now.addAndGet(Duration.ofSeconds(10).toNanos());
            if (attempts.incrementAndGet() < 4) {
                throw transientFailure("Failed to download");
            }
        });

        assertThat(attempts).hasValue(4);
    }

    @Test
    void delayGrowsByBackoff() {
        DownloadRetryPolicy policy = new DownloadRetryPolicy(
                new StorageConfig.Download(3, TIMEOUT, Duration.ofSeconds(4), 5.0));

        assertThat(policy.delayBefore(1)).isEqualTo(Duration.ofSeconds(4));
        assertThat(policy.delayBefore(2)).isEqualTo(Duration.ofSeconds(20));
        assertThat(policy.delayBefore(3)).isEqualTo(Duration.ofSeconds(100));
    }
}
