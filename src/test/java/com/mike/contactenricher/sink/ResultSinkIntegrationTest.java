package com.mike.contactenricher.sink;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mike.contactenricher.config.EnricherProperties;
import com.mike.contactenricher.registry.ServerIdentity;
import com.mike.contactenricher.support.PostgresTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResultSinkIntegrationTest extends PostgresTestSupport {

    private ResultSink sink;
    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
        sink = new ResultSink(jdbcTemplate, transactionManager, objectMapper, new EnricherProperties(),
                new ServerIdentity("it-server", "it-server", "localhost", null));
    }

    private StoredEnrichment stored(String key) {
        return sink.findByBusinessKey(key).orElseThrow();
    }

    @Test
    @DisplayName("second scrape appends emails and bumps scrape count")
    void second_scrape_appends_emails() {
        //Arrange
        sink.upsert(EnrichmentRecord.builder().businessKey("L1").email("a@x.com").status(ScrapeStatus.SUCCESS).build());
        //Act
        boolean ok = sink.upsert(EnrichmentRecord.builder().businessKey("L1").email("b@x.com").status(ScrapeStatus.SUCCESS).build());
        //Assert
        StoredEnrichment row = stored("L1");
        assertTrue(ok);
        assertEquals(2, row.getScrapeCount());
        assertEquals(List.of("a@x.com", "b@x.com"), row.getEmails());
        assertEquals(2, row.getEmailsFound());
        assertEquals("it-server", row.getLastScrapeServer());
    }

    @Test
    @DisplayName("repeated scrapes keep duplicate emails and count every write")
    void repeated_scrapes_keep_duplicates() {
        //Arrange
        int repeats = 4;
        EnrichmentRecord record = EnrichmentRecord.builder()
                .businessKey("L1").email("info@farm.pl").email("shop@farm.pl").status(ScrapeStatus.SUCCESS).build();
        sink.upsert(record);
        //Act
        for (int i = 0; i < repeats; i++) {
            sink.upsert(record);
        }
        //Assert
        StoredEnrichment row = stored("L1");
        assertEquals(1 + repeats, row.getScrapeCount());
        assertEquals(2 * (1 + repeats), row.getEmails().size());
    }

    @Test
    @DisplayName("facebook keeps the first value, phones and tiktok take the newest")
    void merge_rules_per_column() {
        //Arrange
        sink.upsert(EnrichmentRecord.builder().businessKey("L1")
                .facebook("https://facebook.com/first").phone("+48111111111").tiktok("https://tiktok.com/@old")
                .status(ScrapeStatus.SUCCESS).build());
        //Act
        sink.upsert(EnrichmentRecord.builder().businessKey("L1")
                .facebook("https://facebook.com/second").phone("+48222222222")
                .status(ScrapeStatus.NO_CONTACTS_FOUND).build());
        //Assert
        StoredEnrichment row = stored("L1");
        assertEquals("https://facebook.com/first", row.getFacebook());
        assertEquals(List.of("+48222222222"), row.getPhones());
        assertNull(row.getTiktok());
        assertEquals(ScrapeStatus.NO_CONTACTS_FOUND, row.getStatus());
    }

    @Test
    @DisplayName("batch with a repeated key stores one row with both writes merged")
    void batch_with_repeated_key() {
        //Arrange
        List<EnrichmentRecord> batch = List.of(
                EnrichmentRecord.builder().businessKey("L1").email("a@x.com").status(ScrapeStatus.SUCCESS).build(),
                EnrichmentRecord.builder().businessKey("L2").status(ScrapeStatus.FAILED).error("HTTP 500").build(),
                EnrichmentRecord.builder().businessKey("L1").email("b@x.com").status(ScrapeStatus.SUCCESS).build());
        //Act
        int written = sink.upsertBatch(batch);
        //Assert
        assertEquals(3, written);
        assertEquals(List.of("a@x.com", "b@x.com"), stored("L1").getEmails());
        assertEquals(2, stored("L1").getScrapeCount());
        assertEquals("HTTP 500", stored("L2").getError());
    }

    @Test
    @DisplayName("validation blobs are stored as jsonb")
    void validation_blob_stored() throws Exception {
        //Arrange
        EnrichmentRecord record = EnrichmentRecord.builder()
                .businessKey("L1").email("a@x.com").status(ScrapeStatus.SUCCESS)
                .validatedEmails(objectMapper.readTree("{\"a@x.com\": {\"mx\": true}}"))
                .build();
        //Act
        sink.upsert(record);
        //Assert
        Boolean mx = jdbcTemplate.queryForObject(
                "SELECT (validated_emails->'a@x.com'->>'mx')::boolean FROM scraped_contacts WHERE business_key = 'L1'",
                Boolean.class);
        assertEquals(Boolean.TRUE, mx);
    }

    @Test
    @DisplayName("totals reflect stored rows")
    void total_stats() {
        //Arrange
        sink.upsertBatch(List.of(
                EnrichmentRecord.builder().businessKey("L1").email("a@x.com").phone("+48111111111").status(ScrapeStatus.SUCCESS).build(),
                EnrichmentRecord.builder().businessKey("L2").status(ScrapeStatus.NO_CONTACTS_FOUND).build(),
                EnrichmentRecord.builder().businessKey("L3").status(ScrapeStatus.FAILED).error("timeout").build()));
        //Act
        SinkStats stats = sink.totalStats();
        //Assert
        assertEquals(3, stats.getTotal());
        assertEquals(1, stats.getSuccessful());
        assertEquals(1, stats.getNoContacts());
        assertEquals(1, stats.getFailed());
        assertEquals(1, stats.getTotalEmails());
        assertEquals(1, stats.getTotalPhones());
    }

    @Test
    @DisplayName("unknown key -> empty")
    void unknown_key() {
        //Act + Assert
        assertFalse(sink.findByBusinessKey("nope").isPresent());
    }
}
