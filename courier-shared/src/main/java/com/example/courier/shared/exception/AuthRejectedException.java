package com.example.courier.shared.exception;

/**
 * Thrown when a connection upgrade presents no credential, an unknown credential,
 * or an identity the authorization policy denies. The socket is never opened.
 */
public class AuthRejectedException extends RuntimeException {
    public AuthRejectedException(String message) {
        super(message);
    }
}
