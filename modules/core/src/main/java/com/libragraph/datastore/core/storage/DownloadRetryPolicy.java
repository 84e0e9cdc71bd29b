package com.libragraph.datastore.core.storage;

import com.libragraph.datastore.core.config.StorageConfig;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Retries transient download failures with exponential backoff.
 *
 * <p>Only {@linkplain StorageException#isTransient() transient} failures are retried;
 * {@link ObjectNotFoundException}, 4xx responses and argument errors reach the caller
 * on the first attempt. No retry starts whose wait would end past the download
 * timeout, counted from the first attempt.
 */
public final class DownloadRetryPolicy {

    private static final Logger log = Logger.getLogger(DownloadRetryPolicy.class);

    private final int retries;
    private final Duration timeout;
    private final Duration retryDelay;
    private final double retryBackoff;
    private final LongSupplier nanoClock;

    public DownloadRetryPolicy(StorageConfig.Download config) {
        this(config, System::nanoTime);
    }

    DownloadRetryPolicy(StorageConfig.Download config, LongSupplier nanoClock) {
        Objects.requireNonNull(config, "config cannot be null");
        this.retries = config.retries();
        this.timeout = config.timeout();
        this.retryDelay = config.retryDelay();
        this.retryBackoff = config.retryBackoff();
        this.nanoClock = nanoClock;
    }

    /**
     * Wait before the n-th retry (1-based): {@code retryDelay * retryBackoff^(n-1)}.
     */
    Duration delayBefore(int retry) {
        double millis = retryDelay.toMillis() * Math.pow(retryBackoff, retry - 1);
        return Duration.ofMillis((long) Math.min(millis, Long.MAX_VALUE));
    }

    /**
     * Runs {@code operation}, retrying transient failures up to the configured
     * number of times within the download timeout.
     *
     * @param description names the transfer in log messages
     * @throws StorageException the first non-transient failure, or the last transient
     *         one once retries or time are exhausted
     */
    public void run(String description, Runnable operation) {
        long start = nanoClock.getAsLong();
        int attempt = 0;
        while (true) {
            try {
                operation.run();
                return;
            } catch (StorageException e) {
                if (!e.isTransient() || attempt >= retries) {
                    throw e;
                }
                attempt++;
                Duration wait = delayBefore(attempt);
                Duration elapsed = Duration.ofNanos(nanoClock.getAsLong() - start);
                if (elapsed.plus(wait).compareTo(timeout) > 0) {
                    log.warnf("Download of %s failed (%s), giving up: timeout %s reached",
                            description, e.getMessage(), timeout);
                    throw e;
                }
                log.warnf("Download of %s failed (%s), retry %d/%d in %d ms",
                        description, e.getMessage(), attempt, retries, wait.toMillis());
                sleep(wait);
            }
        }
    }

    private static void sleep(Duration wait) {
        if (wait.isZero()) {
            return;
        }
        try {
            Thread.sleep(wait.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageException("Interrupted while waiting to retry download", e);
        }
    }
}
