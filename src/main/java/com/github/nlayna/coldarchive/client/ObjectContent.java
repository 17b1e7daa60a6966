package com.github.nlayna.coldarchive.client;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;

public record ObjectContent(InputStream stream, long contentLength, String eTag) implements Closeable {

    @Override
    public void close() throws IOException {
        stream.close();
    }
}
