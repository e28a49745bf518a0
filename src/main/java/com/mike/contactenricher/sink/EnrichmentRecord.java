package com.mike.contactenricher.sink;

import com.fasterxml.jackson.databind.JsonNode;
import com.mike.contactenricher.claim.WorkItem;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Result of enriching one business, as handed to {@link ResultSink}.
 * Identity and business columns are only written when the key is new.
 */
@Value
@Builder(toBuilder = true)
public class EnrichmentRecord {

    String businessKey;
    Long sourceId;

    String name;
    String category;
    String country;
    String address;
    String website;
    Double latitude;
    Double longitude;
    Integer reviewCount;
    Double reviewRating;

    @Singular
    List<String> emails;
    @Singular
    List<String> phones;
    @Singular("whatsappNumber")
    List<String> whatsapp;

    String facebook;
    String instagram;
    String linkedin;
    String tiktok;
    String youtube;

    JsonNode validatedEmails;
    JsonNode validatedWhatsapp;

    String finalUrl;
    boolean wasRedirected;

    ScrapeStatus status;
    String error;

    double processingTimeSeconds;
    int pagesScraped;

    public int emailsFound() {
        return emails.size();
    }

    public int phonesFound() {
        return phones.size();
    }

    public int whatsappFound() {
        return whatsapp.size();
    }

    /**
     * Builder pre-filled with the identity and business columns of a backlog row.
     */
    public static EnrichmentRecordBuilder forItem(WorkItem item) {
        return EnrichmentRecord.builder()
                .businessKey(item.getBusinessKey())
                .sourceId(item.getId())
                .name(item.getName())
                .category(item.getCategory())
                .country(item.getCountry())
                .address(item.getAddress())
                .website(item.getSourceUrl())
                .latitude(item.getLatitude())
                .longitude(item.getLongitude())
                .reviewCount(item.getReviewCount())
                .reviewRating(item.getReviewRating());
    }
}
