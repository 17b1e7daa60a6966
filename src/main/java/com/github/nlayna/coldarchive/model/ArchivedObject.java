package com.github.nlayna.coldarchive.model;

import java.time.Instant;

public record ArchivedObject(String key, long size, Instant lastModified, String storageClass, String eTag) {
}
