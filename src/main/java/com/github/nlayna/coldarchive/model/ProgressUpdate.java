package com.github.nlayna.coldarchive.model;

/**
 * Byte-level progress of one upload or download.
 */
public interface ProgressUpdate {

    String subject();

    long transferredBytes();

    long totalBytes();
}
