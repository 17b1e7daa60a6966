package com.github.nlayna.coldarchive.client;

/**
 * A multipart part the object store has durably stored.
 */
public record CompletedPartRef(int partNumber, String eTag, long size) {
}
