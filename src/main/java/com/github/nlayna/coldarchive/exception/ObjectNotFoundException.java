package com.github.nlayna.coldarchive.exception;

public class ObjectNotFoundException extends PermanentTransferException {

    public ObjectNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
