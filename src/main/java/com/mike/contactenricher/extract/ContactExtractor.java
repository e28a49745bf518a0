package com.mike.contactenricher.extract;

/**
 * Turns the HTML of a fetched page into contact data.
 * Implementations must not throw for odd markup; return {@link ExtractedContacts#empty()} instead.
 */
public interface ContactExtractor {

    ExtractedContacts extract(String html, String pageUrl);
}
