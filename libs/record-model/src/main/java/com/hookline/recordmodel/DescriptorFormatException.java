package com.hookline.recordmodel;

/**
 * Thrown when a descriptor resource cannot be read or does not follow the descriptor format.
 */
public class DescriptorFormatException extends RuntimeException {

    public DescriptorFormatException(String message) {
        super(message);
    }

    public DescriptorFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
