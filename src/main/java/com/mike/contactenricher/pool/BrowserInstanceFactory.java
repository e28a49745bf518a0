package com.mike.contactenricher.pool;

@FunctionalInterface
public interface BrowserInstanceFactory {

    /**
     * Launches a new browser.
     *
     * @throws RuntimeException when the browser cannot be started
     */
    BrowserInstance create();
}
