package com.mike.contactenricher.fetch;

import com.mike.contactenricher.claim.WorkItem;
import com.mike.contactenricher.pool.BrowserHandle;
import com.mike.contactenricher.pool.BrowserPool;
import com.mike.contactenricher.pool.PageSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.BooleanSupplier;

/**
 * Synchronous entry point over the {@link BrowserPool}. Every URL gets its own pooled browser for
 * the duration of one load; nothing thrown by the pool or the page escapes {@link #fetch(String)}.
 *
 * <p>Concurrency comes from one executor shared for the lifetime of the process, sized to the
 * pool's {@code maxInstances}.
 */
@Slf4j
public class PooledPageFetcher {

    private final BrowserPool pool;
    private final ExecutorService executor;
    private final Duration acquireTimeout;
    private final int navigationTimeoutMillis;

    public PooledPageFetcher(BrowserPool pool,
                             ExecutorService executor,
                             Duration acquireTimeout,
                             int navigationTimeoutMillis) {
        this.pool = pool;
        this.executor = executor;
        this.acquireTimeout = acquireTimeout;
        this.navigationTimeoutMillis = navigationTimeoutMillis;
    }

    public FetchResult fetch(String url) {
        long start = System.nanoTime();

        if (url == null || url.isBlank()) {
            return FetchResult.failed(url, "empty url", 0);
        }

        String target = normalizeUrl(url);
        BrowserHandle handle = null;
        try {
            handle = pool.acquire(acquireTimeout);
            PageSnapshot page = handle.load(target, navigationTimeoutMillis);

            boolean ok = page.getStatusCode() == 0 || page.getStatusCode() < 400;
            return FetchResult.builder()
                    .url(target)
                    .finalUrl(page.getFinalUrl())
                    .statusCode(page.getStatusCode())
                    .title(page.getTitle())
                    .html(page.getHtml())
                    .success(ok)
                    .error(ok ? null : "HTTP " + page.getStatusCode())
                    .elapsedMillis(elapsedMillis(start))
                    .build();
        } catch (RuntimeException e) {
            log.warn("FETCH: {} failed: {}", url, e.getMessage());
            return FetchResult.failed(url, describe(e), elapsedMillis(start));
        } finally {
            if (handle != null) {
                pool.release(handle);
            }
        }
    }

    /**
     * Fetches the source URL of every item, at most {@code maxInstances} at a time.
     * Items not yet started when {@code shouldContinue} turns false come back as skipped.
     *
     * @return one result per item, in the order of {@code items}
     */
    public List<FetchResult> fetchAll(List<WorkItem> items, BooleanSupplier shouldContinue) {
        List<Future<FetchResult>> futures = new ArrayList<>(items.size());
        for (WorkItem item : items) {
            String url = item.getSourceUrl();
            futures.add(CompletableFuture.supplyAsync(
                    () -> shouldContinue.getAsBoolean() ? fetch(url) : FetchResult.skipped(url),
                    executor));
        }

        List<FetchResult> results = new ArrayList<>(items.size());
        for (int i = 0; i < futures.size(); i++) {
            results.add(await(futures.get(i), items.get(i).getSourceUrl()));
        }
        return results;
    }

    private FetchResult await(Future<FetchResult> future, String url) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FetchResult.failed(url, "interrupted", 0);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.warn("FETCH: {} failed unexpectedly: {}", url, cause.getMessage());
            return FetchResult.failed(url, describe(cause), 0);
        }
    }

    static String normalizeUrl(String url) {
        String trimmed = url.trim();
        if (trimmed.startsWith("http://") || trimmed.startsWith("https://")) {
            return trimmed;
        }
        return "https://" + trimmed;
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        String text = e.getClass().getSimpleName() + (message == null ? "" : ": " + message);
        return text.length() > 500 ? text.substring(0, 500) : text;
    }

    private static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
