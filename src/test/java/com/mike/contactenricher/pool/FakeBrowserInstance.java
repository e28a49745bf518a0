package com.mike.contactenricher.pool;

import java.util.concurrent.atomic.AtomicInteger;

class FakeBrowserInstance implements BrowserInstance {

    private final String id;
    volatile double memoryMb = 100;
    volatile int openPages = 1;
    volatile boolean closed;
    volatile RuntimeException loadFailure;
    volatile PageSnapshot page = new PageSnapshot(200, "https://example.org/", "Example", "<html></html>");
    final AtomicInteger resets = new AtomicInteger();
    final AtomicInteger loads = new AtomicInteger();

    FakeBrowserInstance(String id) {
        this.id = id;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public double sampleMemoryMb() {
        return memoryMb;
    }

    @Override
    public int openPageCount() {
        return openPages;
    }

    @Override
    public void resetState() {
        resets.incrementAndGet();
        openPages = 1;
    }

    @Override
    public PageSnapshot load(String url, int timeoutMillis) {
        loads.incrementAndGet();
        if (loadFailure != null) {
            throw loadFailure;
        }
        return page;
    }

    @Override
    public void close() {
        closed = true;
    }
}
