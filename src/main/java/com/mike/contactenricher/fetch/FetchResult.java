package com.mike.contactenricher.fetch;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

/**
 * Outcome of one page fetch. Failures are data, not exceptions.
 */
@Value
@Builder
public class FetchResult {

    String url;
    String finalUrl;
    int statusCode;
    String title;
    @ToString.Exclude
    String html;

    boolean success;
    /** Never attempted because a stop was requested. */
    boolean skipped;
    String error;

    long elapsedMillis;

    public boolean isRedirected() {
        return finalUrl != null && url != null && !stripTrailingSlash(finalUrl).equals(stripTrailingSlash(url));
    }

    public int pagesScraped() {
        return success ? 1 : 0;
    }

    static FetchResult failed(String url, String error, long elapsedMillis) {
        return FetchResult.builder()
                .url(url)
                .success(false)
                .error(error)
                .elapsedMillis(elapsedMillis)
                .build();
    }

    static FetchResult skipped(String url) {
        return FetchResult.builder()
                .url(url)
                .skipped(true)
                .error("stop requested")
                .build();
    }

    private static String stripTrailingSlash(String s) {
        return s.endsWith("/") ? s.substring(0, s.length() - 1) : s;
    }
}
