package com.mike.contactenricher.pool;

import com.mike.contactenricher.config.EnricherProperties;
import lombok.RequiredArgsConstructor;

import java.util.concurrent.atomic.AtomicInteger;

@RequiredArgsConstructor
public class PlaywrightBrowserInstanceFactory implements BrowserInstanceFactory {

    private final EnricherProperties.Pool props;
    private final AtomicInteger sequence = new AtomicInteger();

    @Override
    public BrowserInstance create() {
        return new PlaywrightBrowserInstance("browser-" + sequence.incrementAndGet(), props);
    }
}
