package com.mike.contactenricher.sink;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SinkStats {
    long total;
    long successful;
    long failed;
    long noContacts;
    long totalEmails;
    long totalPhones;
    long totalWhatsapp;
}
