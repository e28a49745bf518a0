package com.mike.contactenricher.pool;

import lombok.ToString;
import lombok.Value;

/**
 * What a browser saw after loading one URL.
 */
@Value
public class PageSnapshot {
    int statusCode;
    String finalUrl;
    String title;
    @ToString.Exclude
    String html;
}
