package com.venn.exception;

/**
 * Base exception for Venn.
 */
public class VennException extends RuntimeException {

    public VennException(String message) {
        super(message);
    }

    public VennException(String message, Throwable cause) {
        super(message, cause);
    }
}
