package com.github.rudygunawan.tana.time;

/**
 * A time source that returns the current time in nanoseconds.
 *
 * <p>Caches read it to time lookups, and {@link com.github.rudygunawan.tana.metrics.CacheMetrics}
 * reads it to stamp evictions. Tests substitute a ticker they advance by hand, so latency and
 * eviction-rate behaviour can be checked without sleeping.
 *
 * <p><b>Testing Usage:</b>
 * <pre>{@code
 * FakeTicker ticker = new FakeTicker();
 * CacheMetrics metrics = new CacheMetrics(ticker);
 *
 * metrics.recordEviction();
 * ticker.advance(2, TimeUnit.MINUTES);
 *
 * // The eviction is now outside a one minute window
 * assertEquals(0, metrics.getRecentStats(Duration.ofMinutes(1)).evictionsPerMinute());
 * }</pre>
 */
@FunctionalInterface
public interface Ticker {

    /**
     * Returns the number of nanoseconds elapsed since some fixed but arbitrary point in time.
     *
     * <p>Values must be monotonically non-decreasing, like {@link System#nanoTime()}.
     *
     * @return the number of nanoseconds elapsed since some arbitrary point in time
     */
    long read();

    /**
     * Returns a ticker that reads the current time using {@link System#nanoTime()}.
     *
     * @return a ticker that uses the system's nanosecond-precision clock
     */
    static Ticker systemTicker() {
        return SystemTicker.INSTANCE;
    }

    /**
     * Default system ticker implementation using System.nanoTime().
     */
    enum SystemTicker implements Ticker {
        INSTANCE;

        @Override
        public long read() {
            return System.nanoTime();
        }

        @Override
        public String toString() {
            return "Ticker.systemTicker()";
        }
    }
}
