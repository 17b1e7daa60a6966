package com.github.nlayna.coldarchive.model;

public enum UploadTier {
    FREE,
    PREMIUM
}
