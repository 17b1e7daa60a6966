package com.github.nlayna.coldarchive.service;

import com.github.nlayna.coldarchive.model.PartPlan;
import com.github.nlayna.coldarchive.model.PartRange;
import com.github.nlayna.coldarchive.model.UploadConfig;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a file into the byte ranges of a transfer. The plan depends only on the file size
 * and the chunk settings, so a resumed upload derives the same part numbers again.
 */
public final class PartPlanner {

    /** Largest part count the object store accepts for one multipart upload. */
    public static final int MAX_PARTS = 10_000;

    private PartPlanner() {
    }

    /**
     * @throws IllegalArgumentException if no chunk size within the configured bounds fits the file into
     *                                  {@link #MAX_PARTS} parts
     */
    public static PartPlan plan(long fileSize, UploadConfig config) {
        if (fileSize < 0) {
            throw new IllegalArgumentException("File size must not be negative: " + fileSize);
        }
        long minChunk = config.getMinChunkSizeMb() * UploadConfig.MIB;
        long maxChunk = config.getMaxChunkSizeMb() * UploadConfig.MIB;
        long chunkSize = Math.max(minChunk, Math.min(maxChunk, config.getChunkSizeMb() * UploadConfig.MIB));

        if (config.isAdaptiveChunkSize()) {
            long required = ceilDiv(fileSize, MAX_PARTS);
            if (required > chunkSize) {
                chunkSize = ceilDiv(required, UploadConfig.MIB) * UploadConfig.MIB;
            }
            if (chunkSize > maxChunk) {
                throw new IllegalArgumentException(String.format(
                        "File of %d bytes needs %d MB parts to stay within %d parts, above the %d MB maximum",
                        fileSize, chunkSize / UploadConfig.MIB, MAX_PARTS, config.getMaxChunkSizeMb()));
            }
        } else if (ceilDiv(fileSize, chunkSize) > MAX_PARTS) {
            throw new IllegalArgumentException(String.format(
                    "File of %d bytes needs %d parts of %d MB, above the %d part limit",
                    fileSize, ceilDiv(fileSize, chunkSize), chunkSize / UploadConfig.MIB, MAX_PARTS));
        }

        if (fileSize == 0) {
            return new PartPlan(0, chunkSize, List.of(new PartRange(1, 0, 0)));
        }

        List<PartRange> parts = new ArrayList<>();
        int partNumber = 1;
        for (long offset = 0; offset < fileSize; offset += chunkSize) {
            parts.add(new PartRange(partNumber++, offset, Math.min(chunkSize, fileSize - offset)));
        }
        return new PartPlan(fileSize, chunkSize, parts);
    }

    private static long ceilDiv(long dividend, long divisor) {
        return (dividend + divisor - 1) / divisor;
    }
}
