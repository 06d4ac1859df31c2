package com.texture.dedup.ledger;

/**
 * Reading or writing a ledger file failed.
 */
public class LedgerIOException extends RuntimeException {

    public LedgerIOException(String message, Throwable cause) {
        super(message, cause);
    }
}
