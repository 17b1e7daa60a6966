package com.github.nlayna.coldarchive.service;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * InputStream wrapper that draws every read from a {@link BandwidthLimiter}. Streams built
 * on the same limiter share one throughput ceiling.
 */
public class ThrottledInputStream extends FilterInputStream {

    private final BandwidthLimiter limiter;

    public ThrottledInputStream(InputStream in, BandwidthLimiter limiter) {
        super(in);
        this.limiter = limiter;
    }

    @Override
    public int read() throws IOException {
        throttle();
        int b = in.read();
        if (b != -1) {
            limiter.record(1);
        }
        return b;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        throttle();
        int bytesRead = in.read(b, off, len);
        limiter.record(bytesRead);
        return bytesRead;
    }

    private void throttle() throws IOException {
        try {
            limiter.awaitCapacity();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Throttled read interrupted", e);
        }
    }
}
