package com.github.nlayna.coldarchive.client;

import com.github.nlayna.coldarchive.model.PartRange;
import com.github.nlayna.coldarchive.service.BandwidthLimiter;
import com.github.nlayna.coldarchive.service.ThrottledInputStream;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;

/**
 * Byte range of a local file to be sent as one object or one multipart part. Every call to
 * {@link #openStream()} starts from the beginning of the range, so transfers can be re-sent.
 */
public record PartSource(Path file, long offset, long length, BandwidthLimiter limiter) {

    public static PartSource of(Path file, PartRange part, BandwidthLimiter limiter) {
        return new PartSource(file, part.offset(), part.length(), limiter);
    }

    public InputStream openStream() throws IOException {
        InputStream in = new FileRangeInputStream(file, offset, length);
        return limiter == null ? in : new ThrottledInputStream(in, limiter);
    }
}
