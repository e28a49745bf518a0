package com.mike.contactenricher.extract;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ExtractedContacts {

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

    /** Optional per-address validation results, stored as-is. */
    JsonNode validatedEmails;
    JsonNode validatedWhatsapp;

    public static ExtractedContacts empty() {
        return ExtractedContacts.builder().build();
    }

    public boolean isEmpty() {
        return emails.isEmpty() && phones.isEmpty() && whatsapp.isEmpty()
                && facebook == null && instagram == null && linkedin == null
                && tiktok == null && youtube == null;
    }
}
