package com.jcas.error;

/**
 * Root of every error the engine raises. Unchecked, like the rest of the taxonomy.
 */
public class CasException extends RuntimeException {
    public CasException(String message) {
        super(message);
    }

    public CasException(String message, Throwable cause) {
        super(message, cause);
    }
}
