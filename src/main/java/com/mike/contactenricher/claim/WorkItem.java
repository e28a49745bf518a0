package com.mike.contactenricher.claim;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.ToString;
import lombok.Value;

/**
 * One backlog row as read from the upstream {@code results} table. Never written back.
 */
@Value
@Builder
public class WorkItem {

    /**
     * Backlog row id, also the second key of the advisory lock.
     */
    long id;

    String sourceUrl;

    /**
     * External business identifier (the Google Maps link); unique key of the sink.
     */
    String businessKey;

    String name;
    String category;
    String country;
    String address;
    String phone;

    Double latitude;
    Double longitude;

    Integer reviewCount;
    Double reviewRating;

    @ToString.Exclude
    JsonNode rawPayload;
}
