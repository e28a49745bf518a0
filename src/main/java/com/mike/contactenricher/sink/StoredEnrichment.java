package com.mike.contactenricher.sink;

import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Current state of a sink row, as read back from the database.
 */
@Value
@Builder
public class StoredEnrichment {
    String businessKey;
    List<String> emails;
    List<String> phones;
    List<String> whatsapp;
    String facebook;
    String instagram;
    String linkedin;
    String tiktok;
    String youtube;
    ScrapeStatus status;
    String error;
    int emailsFound;
    int scrapeCount;
    String lastScrapeServer;
    OffsetDateTime updatedAt;
}
