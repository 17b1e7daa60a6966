package com.github.nlayna.coldarchive.model;

/**
 * One part of a transfer plan. Part numbers start at 1.
 */
public record PartRange(int partNumber, long offset, long length) {

    public long end() {
        return offset + length;
    }
}
