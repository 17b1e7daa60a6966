package com.github.nlayna.coldarchive.model;

import lombok.Data;

@Data
public class KeyNamingOptions {
    /** Leading key segment; the configured default prefix applies when null. */
    private String prefix;
    private boolean useDateFolder;
    private boolean preserveDirectoryStructure;
    /** Root that preserved directories are made relative to; the user's home when null. */
    private String baseDirectory;
    /** Supports {filename}, {timestamp} and {uuid}. */
    private String namingPattern;
}
