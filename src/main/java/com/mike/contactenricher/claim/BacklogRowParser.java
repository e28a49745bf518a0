package com.mike.contactenricher.claim;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

/**
 * Maps the JSON payload of a backlog row onto a {@link WorkItem}.
 */
@Component
@RequiredArgsConstructor
public class BacklogRowParser {

    static final String UNKNOWN_COUNTRY = "XX";

    private final ObjectMapper objectMapper;

    /**
     * @return empty when the payload has no fetchable URL or no business key
     * @throws JsonProcessingException when the payload is not valid JSON
     */
    public Optional<WorkItem> parse(long id, String payload) throws JsonProcessingException {
        if (payload == null || payload.isBlank()) {
            return Optional.empty();
        }

        JsonNode data = objectMapper.readTree(payload);
        if (data == null || !data.isObject()) {
            return Optional.empty();
        }

        String webSite = text(data, "web_site");
        if (webSite.isEmpty()) {
            return Optional.empty();
        }

        String link = text(data, "link");
        if (link.isEmpty()) {
            return Optional.empty();
        }

        // upstream scraper misspells the key; keep reading both
        Double longitude = number(data, "longtitude");
        if (longitude == null) {
            longitude = number(data, "longitude");
        }

        Double reviewCount = number(data, "review_count");

        return Optional.of(WorkItem.builder()
                .id(id)
                .sourceUrl(webSite)
                .businessKey(link)
                .name(text(data, "title"))
                .category(text(data, "category"))
                .country(normalizeCountry(text(data.path("complete_address"), "country")))
                .address(text(data, "address"))
                .phone(text(data, "phone"))
                .latitude(number(data, "latitude"))
                .longitude(longitude)
                .reviewCount(reviewCount == null ? null : reviewCount.intValue())
                .reviewRating(number(data, "review_rating"))
                .rawPayload(data)
                .build());
    }

    static String normalizeCountry(String country) {
        if (country == null || country.isBlank()) {
            return UNKNOWN_COUNTRY;
        }
        String upper = country.trim().toUpperCase(Locale.ROOT);
        return upper.length() > 2 ? upper.substring(0, 2) : upper;
    }

    private String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return "";
        }
        return value.asText("").trim();
    }

    private Double number(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.doubleValue();
        }
        if (value.isTextual()) {
            try {
                return Double.parseDouble(value.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
