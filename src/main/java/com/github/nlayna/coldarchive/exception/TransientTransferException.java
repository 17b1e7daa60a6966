package com.github.nlayna.coldarchive.exception;

/**
 * Timeouts, throttling and network errors. Retried until the job's retry budget runs out.
 */
public class TransientTransferException extends TransferException {

    public TransientTransferException(String message) {
        super(message);
    }

    public TransientTransferException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isTransient() {
        return true;
    }
}
