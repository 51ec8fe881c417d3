package com.hybridorm.core;

/**
 * Raised when a structured attribute (a {@code json} cast) holds text that cannot be decoded.
 */
public class DecodeException extends RuntimeException {
    private final String attribute;

    public DecodeException(String attribute, String message, Throwable cause) {
        super(message, cause);
        this.attribute = attribute;
    }

    public String getAttribute() {
        return attribute;
    }
}
