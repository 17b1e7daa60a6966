package com.github.nlayna.coldarchive.client;

import java.io.FilterInputStream;
import java.io.IOException;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Reads {@code length} bytes of a file starting at {@code offset}.
 */
public class FileRangeInputStream extends FilterInputStream {

    private long remaining;

    public FileRangeInputStream(Path file, long offset, long length) throws IOException {
        super(Channels.newInputStream(FileChannel.open(file, StandardOpenOption.READ).position(offset)));
        this.remaining = length;
    }

    @Override
    public int read() throws IOException {
        if (remaining <= 0) {
            return -1;
        }
        int b = in.read();
        if (b != -1) {
            remaining--;
        }
        return b;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        if (remaining <= 0) {
            return -1;
        }
        int bytesRead = in.read(b, off, (int) Math.min(len, remaining));
        if (bytesRead > 0) {
            remaining -= bytesRead;
        }
        return bytesRead;
    }

    @Override
    public long skip(long n) throws IOException {
        long skipped = in.skip(Math.min(n, remaining));
        remaining -= skipped;
        return skipped;
    }

    @Override
    public int available() throws IOException {
        return (int) Math.min(in.available(), remaining);
    }

    @Override
    public boolean markSupported() {
        return false;
    }
}
