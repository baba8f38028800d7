package com.fintech.candlestream.storage;

/**
 * I/O failure while flushing or hydrating a segment log. Callers log it and
 * keep the live pipeline running; the affected slice of history may be lost.
 */
public class PersistenceException extends RuntimeException {
    
    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
