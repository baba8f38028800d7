package com.fintech.candlestream.codec;

/**
 * Raised when a batch cannot be encoded or a buffer cannot be decoded.
 * Fatal to the call that raised it only.
 */
public class CodecException extends RuntimeException {
    
    public CodecException(String message) {
        super(message);
    }
}
