package com.mike.contactenricher.config;

import com.mike.contactenricher.fetch.PooledPageFetcher;
import com.mike.contactenricher.pool.BrowserHealthChecker;
import com.mike.contactenricher.pool.BrowserInstanceFactory;
import com.mike.contactenricher.pool.BrowserPool;
import com.mike.contactenricher.pool.HealthThresholds;
import com.mike.contactenricher.pool.PlaywrightBrowserInstanceFactory;
import com.mike.contactenricher.registry.ServerIdentity;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class EnricherConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ServerIdentity serverIdentity(EnricherProperties properties) {
        return ServerIdentity.resolve(properties.getServer());
    }

    @Bean
    @ConditionalOnMissingBean
    public BrowserInstanceFactory browserInstanceFactory(EnricherProperties properties) {
        return new PlaywrightBrowserInstanceFactory(properties.getPool());
    }

    @Bean
    public BrowserHealthChecker browserHealthChecker(EnricherProperties properties, Clock clock) {
        EnricherProperties.Pool pool = properties.getPool();
        return new BrowserHealthChecker(HealthThresholds.from(pool), pool.getHealthHistorySize(), clock);
    }

    @Bean(initMethod = "initialize", destroyMethod = "close")
    public BrowserPool browserPool(BrowserInstanceFactory factory,
                                   BrowserHealthChecker healthChecker,
                                   EnricherProperties properties,
                                   Clock clock) {
        EnricherProperties.Pool pool = properties.getPool();
        return new BrowserPool(factory, healthChecker, clock,
                pool.getMinInstances(), pool.getMaxInstances(), pool.getMaxReplacementAttempts());
    }

    /**
     * One pool of fetch workers for the whole process, one thread per browser.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService fetchExecutor(EnricherProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threads = r -> {
            Thread t = new Thread(r, "fetch-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newFixedThreadPool(Math.max(1, properties.getPool().getMaxInstances()), threads);
    }

    @Bean
    public PooledPageFetcher pooledPageFetcher(BrowserPool browserPool,
                                               ExecutorService fetchExecutor,
                                               EnricherProperties properties) {
        EnricherProperties.Pool pool = properties.getPool();
        return new PooledPageFetcher(browserPool, fetchExecutor,
                Duration.ofMillis(pool.getAcquireTimeoutMillis()), pool.getNavigationTimeoutMillis());
    }
}
