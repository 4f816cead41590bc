package com.cosign.common;

/**
 * Thrown when a string is not a syntactically valid address for the requested {@link AddressFormat}.
 */
public class InvalidAddressException extends IllegalArgumentException {

    public InvalidAddressException(String message) {
        super(message);
    }
}
