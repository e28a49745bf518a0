package com.mike.contactenricher.pool;

public class BrowserPoolException extends RuntimeException {

    public BrowserPoolException(String message) {
        super(message);
    }
}
