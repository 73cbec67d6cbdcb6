package com.personalsoft.budget.security;

/** The request carries no usable tenant. */
public class UnauthenticatedException extends RuntimeException {

    public UnauthenticatedException(String message) {
        super(message);
    }
}
