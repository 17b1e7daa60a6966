package com.github.nlayna.coldarchive.exception;

/**
 * Credentials, authorization, quota or destination errors. Never retried.
 */
public class PermanentTransferException extends TransferException {

    public PermanentTransferException(String message) {
        super(message);
    }

    public PermanentTransferException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isTransient() {
        return false;
    }
}
