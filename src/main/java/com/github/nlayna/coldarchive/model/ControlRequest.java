package com.github.nlayna.coldarchive.model;

/**
 * Cooperative request left on an active upload for its worker to pick up between parts.
 */
public enum ControlRequest {
    NONE,
    PAUSE,
    CANCEL
}
