package com.storefront.identitysync.application.port.in;

/**
 * Client payload exceeds the serialized size or nesting depth limit.
 */
public class PayloadTooLargeException extends IllegalArgumentException {

    public PayloadTooLargeException(String message) {
        super(message);
    }
}
