package com.mike.contactenricher.pool;

import java.time.Duration;

public class BrowserPoolTimeoutException extends BrowserPoolException {

    public BrowserPoolTimeoutException(Duration timeout) {
        super("No available browser after " + timeout.toMillis() + " ms");
    }
}
