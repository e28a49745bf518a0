package com.mike.contactenricher.pool;

/**
 * A live, stateful browser process with one browsing context. Not thread-safe: the pool
 * guarantees a single caller at a time.
 */
public interface BrowserInstance extends AutoCloseable {

    /**
     * Stable identity of the underlying browser process, used in logs and health history.
     */
    String id();

    double sampleMemoryMb();

    int openPageCount();

    /**
     * Clears cookies and permissions, closes all pages but one and points that one at {@code about:blank}.
     */
    void resetState();

    PageSnapshot load(String url, int timeoutMillis);

    @Override
    void close();
}
