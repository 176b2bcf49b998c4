package com.eldplanner.geo;

import com.eldplanner.exception.LocationResolutionException;
import com.eldplanner.util.MdcPropagator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Decorator bounding every lookup of a blocking resolver by a timeout.
 *
 * Lookups run on a small daemon pool with the caller's MDC context. A lookup
 * that fails, times out or is interrupted surfaces as a
 * {@link LocationResolutionException}.
 */
public class TimeoutLocationResolver implements LocationResolver, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TimeoutLocationResolver.class);

    private final LocationResolver delegate;
    private final Duration timeout;
    private final ExecutorService executor;

    public TimeoutLocationResolver(LocationResolver delegate, Duration timeout, int threads) {
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
        this.delegate = delegate;
        this.timeout = timeout;
        this.executor = Executors.newFixedThreadPool(threads, new ResolverThreadFactory());
    }

    @Override
    public String resolve(double lat, double lon) {
        Callable<String> task = () -> delegate.resolve(lat, lon);
        Future<String> lookup = executor.submit(MdcPropagator.wrap(task));
        try {
            return lookup.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            lookup.cancel(true);
            throw new LocationResolutionException(
                "Location lookup for " + lat + "," + lon + " exceeded " + timeout.toMillis() + "ms", e);
        } catch (ExecutionException e) {
            throw new LocationResolutionException(
                "Location lookup for " + lat + "," + lon + " failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            lookup.cancel(true);
            throw new LocationResolutionException("Location lookup interrupted", e);
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
        log.debug("Location resolver pool shut down");
    }

    private static final class ResolverThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "location-resolver-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
