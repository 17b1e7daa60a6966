package com.github.nlayna.coldarchive.exception;

/**
 * Failure reported by the object store, the credential source or the local file system
 * while moving bytes or querying state.
 */
public abstract class TransferException extends Exception {

    protected TransferException(String message) {
        super(message);
    }

    protected TransferException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract boolean isTransient();
}
