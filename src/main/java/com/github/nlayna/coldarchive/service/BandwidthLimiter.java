package com.github.nlayna.coldarchive.service;

import com.github.nlayna.coldarchive.model.UploadConfig;

/**
 * Byte budget per one-second window, shared by every stream of one transfer.
 * A caller that finds the window exhausted sleeps until it ends.
 */
public class BandwidthLimiter {

    private static final long WINDOW_NANOS = 1_000_000_000L;

    private final long maxBytesPerSecond;
    private long windowStartNanos;
    private long bytesInWindow;

    public BandwidthLimiter(long maxBytesPerSecond) {
        if (maxBytesPerSecond <= 0) {
            throw new IllegalArgumentException("maxBytesPerSecond must be positive, got: " + maxBytesPerSecond);
        }
        this.maxBytesPerSecond = maxBytesPerSecond;
        this.windowStartNanos = System.nanoTime();
    }

    public static BandwidthLimiter ofMbps(double megabytesPerSecond) {
        return new BandwidthLimiter(Math.max(1L, (long) (megabytesPerSecond * UploadConfig.MIB)));
    }

    public long getMaxBytesPerSecond() {
        return maxBytesPerSecond;
    }

    public synchronized void awaitCapacity() throws InterruptedException {
        if (bytesInWindow < maxBytesPerSecond) {
            return;
        }
        long sleepNanos = WINDOW_NANOS - (System.nanoTime() - windowStartNanos);
        if (sleepNanos > 0) {
            Thread.sleep(sleepNanos / 1_000_000, (int) (sleepNanos % 1_000_000));
        }
        windowStartNanos = System.nanoTime();
        bytesInWindow = 0;
    }

    public synchronized void record(long bytes) {
        if (bytes > 0) {
            bytesInWindow += bytes;
        }
    }
}
