package com.example.guardianintake.service.store;

/**
 * The case store could not be acquired for writing. Fatal for the current document only;
 * nothing has been written when this is thrown.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
