package com.mike.contactenricher.sink;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mike.contactenricher.config.EnricherProperties;
import com.mike.contactenricher.registry.ServerIdentity;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Array;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Idempotent write path into {@code scraped_contacts}, keyed by business key.
 *
 * <p>Merge rules on conflict: {@code emails} and {@code whatsapp} are appended to what is stored
 * (duplicates kept), {@code facebook}/{@code instagram}/{@code linkedin} keep the first non-null
 * value, every other scraped column is replaced by the newest scrape and {@code scrape_count}
 * goes up by one.
 *
 * <p>Each write runs in its own transaction so a failed statement never poisons the claim
 * transaction of the caller. Transient failures are retried with exponential backoff,
 * integrity violations are not.
 */
@Service
@Slf4j
public class ResultSink {

    /** Keeps a multi-row statement well under PostgreSQL's bind parameter limit. */
    static final int MAX_ROWS_PER_STATEMENT = 500;

    static final String INSERT_COLUMNS = """
            INSERT INTO scraped_contacts (
                business_key, source_id, business_name, business_category, country_code, address, website,
                latitude, longitude, review_count, review_rating,
                emails, phones, whatsapp,
                facebook, instagram, linkedin, tiktok, youtube,
                validated_emails, validated_whatsapp,
                final_url, was_redirected, scraping_status, scraping_error,
                processing_time_seconds, pages_scraped, emails_found, phones_found, whatsapp_found,
                last_scrape_server, scrape_count, updated_at
            ) VALUES
            """;

    static final String ROW_PLACEHOLDERS =
            "(?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, "
                    + "CAST(? AS jsonb), CAST(? AS jsonb), ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, 1, now())";

    static final String ON_CONFLICT = """
            ON CONFLICT (business_key) DO UPDATE SET
                emails = CASE
                    WHEN scraped_contacts.emails IS NULL THEN EXCLUDED.emails
                    WHEN EXCLUDED.emails IS NULL THEN scraped_contacts.emails
                    ELSE scraped_contacts.emails || EXCLUDED.emails
                END,
                whatsapp = CASE
                    WHEN scraped_contacts.whatsapp IS NULL THEN EXCLUDED.whatsapp
                    WHEN EXCLUDED.whatsapp IS NULL THEN scraped_contacts.whatsapp
                    ELSE scraped_contacts.whatsapp || EXCLUDED.whatsapp
                END,
                facebook = COALESCE(scraped_contacts.facebook, EXCLUDED.facebook),
                instagram = COALESCE(scraped_contacts.instagram, EXCLUDED.instagram),
                linkedin = COALESCE(scraped_contacts.linkedin, EXCLUDED.linkedin),
                phones = EXCLUDED.phones,
                tiktok = EXCLUDED.tiktok,
                youtube = EXCLUDED.youtube,
                validated_emails = EXCLUDED.validated_emails,
                validated_whatsapp = EXCLUDED.validated_whatsapp,
                final_url = EXCLUDED.final_url,
                was_redirected = EXCLUDED.was_redirected,
                scraping_status = EXCLUDED.scraping_status,
                scraping_error = EXCLUDED.scraping_error,
                processing_time_seconds = EXCLUDED.processing_time_seconds,
                pages_scraped = EXCLUDED.pages_scraped,
                emails_found = COALESCE(cardinality(scraped_contacts.emails), 0) + COALESCE(cardinality(EXCLUDED.emails), 0),
                phones_found = EXCLUDED.phones_found,
                whatsapp_found = COALESCE(cardinality(scraped_contacts.whatsapp), 0) + COALESCE(cardinality(EXCLUDED.whatsapp), 0),
                last_scrape_server = EXCLUDED.last_scrape_server,
                scrape_count = scraped_contacts.scrape_count + 1,
                updated_at = now()
            """;

    private static final int PARAMS_PER_ROW = 31;

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate writeTransaction;
    private final ObjectMapper objectMapper;
    private final EnricherProperties.Sink props;
    private final String serverId;
    private final Retry retry;

    public ResultSink(JdbcTemplate jdbcTemplate,
                      PlatformTransactionManager transactionManager,
                      ObjectMapper objectMapper,
                      EnricherProperties properties,
                      ServerIdentity serverIdentity) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.props = properties.getSink();
        this.serverId = serverIdentity.getId();

        this.writeTransaction = new TransactionTemplate(transactionManager);
        this.writeTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);

        int maxAttempts = Math.max(0, props.getMaxRetries()) + 1;
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        props.getBackoffBaseMillis(), props.getBackoffMultiplier()))
                .retryOnException(DbFailureClassifier::isTransient)
                .build();
        this.retry = Retry.of("result-sink", config);
        this.retry.getEventPublisher().onRetry(event -> log.warn(
                "SINK: transient DB error (attempt {}/{}), retrying in {} ms: {}",
                event.getNumberOfRetryAttempts(), maxAttempts,
                event.getWaitInterval().toMillis(),
                event.getLastThrowable() == null ? "-" : event.getLastThrowable().getMessage()));
    }

    /**
     * Writes one record.
     *
     * @return true when the row is durably stored
     */
    public boolean upsert(EnrichmentRecord record) {
        if (!hasKey(record)) {
            log.warn("SINK: record without business key, skipping");
            return false;
        }
        return write(List.of(record), "upsert " + record.getBusinessKey()).isEmpty();
    }

    /**
     * Writes records with one multi-row statement per chunk. A chunk that fails as a whole on a
     * non-transient error is written again row by row (when enabled), so one bad record only costs
     * itself. Records repeating a key already present in the batch are written afterwards with the
     * single-row path, because one statement cannot update the same row twice.
     *
     * @return number of records durably stored
     */
    public int upsertBatch(List<EnrichmentRecord> records) {
        if (records == null || records.isEmpty()) {
            return 0;
        }

        List<EnrichmentRecord> firsts = new ArrayList<>(records.size());
        List<EnrichmentRecord> repeats = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (EnrichmentRecord record : records) {
            if (!hasKey(record)) {
                log.warn("SINK: record without business key in batch, skipping");
                continue;
            }
            if (seen.add(record.getBusinessKey())) {
                firsts.add(record);
            } else {
                repeats.add(record);
            }
        }

        int written = 0;
        for (int from = 0; from < firsts.size(); from += MAX_ROWS_PER_STATEMENT) {
            List<EnrichmentRecord> chunk = firsts.subList(from, Math.min(from + MAX_ROWS_PER_STATEMENT, firsts.size()));

            Optional<FailureClass> failure = write(chunk, "batch of " + chunk.size());
            if (failure.isEmpty()) {
                written += chunk.size();
                continue;
            }

            if (failure.get() != FailureClass.TRANSIENT && props.isSingleRowFallback() && chunk.size() > 1) {
                log.info("SINK: falling back to single-row writes for {} records", chunk.size());
                for (EnrichmentRecord record : chunk) {
                    if (upsert(record)) written++;
                }
            }
        }

        for (EnrichmentRecord record : repeats) {
            if (upsert(record)) written++;
        }

        log.debug("SINK: batch upsert wrote {}/{} records", written, records.size());
        return written;
    }

    public Optional<StoredEnrichment> findByBusinessKey(String businessKey) {
        List<StoredEnrichment> rows = jdbcTemplate.query("""
                        SELECT business_key, emails, phones, whatsapp, facebook, instagram, linkedin, tiktok, youtube,
                               scraping_status, scraping_error, emails_found, scrape_count, last_scrape_server, updated_at
                        FROM scraped_contacts
                        WHERE business_key = ?
                        """,
                (rs, rowNum) -> StoredEnrichment.builder()
                        .businessKey(rs.getString("business_key"))
                        .emails(textArray(rs, "emails"))
                        .phones(textArray(rs, "phones"))
                        .whatsapp(textArray(rs, "whatsapp"))
                        .facebook(rs.getString("facebook"))
                        .instagram(rs.getString("instagram"))
                        .linkedin(rs.getString("linkedin"))
                        .tiktok(rs.getString("tiktok"))
                        .youtube(rs.getString("youtube"))
                        .status(rs.getString("scraping_status") == null ? null
                                : ScrapeStatus.fromDbValue(rs.getString("scraping_status")))
                        .error(rs.getString("scraping_error"))
                        .emailsFound(rs.getInt("emails_found"))
                        .scrapeCount(rs.getInt("scrape_count"))
                        .lastScrapeServer(rs.getString("last_scrape_server"))
                        .updatedAt(rs.getObject("updated_at", OffsetDateTime.class))
                        .build(),
                businessKey);
        return rows.stream().findFirst();
    }

    public SinkStats totalStats() {
        return jdbcTemplate.queryForObject("""
                        SELECT COUNT(*) AS total,
                               COUNT(*) FILTER (WHERE scraping_status = 'success') AS successful,
                               COUNT(*) FILTER (WHERE scraping_status = 'failed') AS failed,
                               COUNT(*) FILTER (WHERE scraping_status = 'no_contacts_found') AS no_contacts,
                               COALESCE(SUM(emails_found), 0) AS total_emails,
                               COALESCE(SUM(phones_found), 0) AS total_phones,
                               COALESCE(SUM(whatsapp_found), 0) AS total_whatsapp
                        FROM scraped_contacts
                        """,
                (rs, rowNum) -> SinkStats.builder()
                        .total(rs.getLong("total"))
                        .successful(rs.getLong("successful"))
                        .failed(rs.getLong("failed"))
                        .noContacts(rs.getLong("no_contacts"))
                        .totalEmails(rs.getLong("total_emails"))
                        .totalPhones(rs.getLong("total_phones"))
                        .totalWhatsapp(rs.getLong("total_whatsapp"))
                        .build());
    }

    private Optional<FailureClass> write(List<EnrichmentRecord> rows, String label) {
        try {
            retry.executeRunnable(() -> writeTransaction.executeWithoutResult(status -> executeUpsert(rows)));
            log.debug("SINK: {} ok", label);
            return Optional.empty();
        } catch (RuntimeException e) {
            FailureClass failure = DbFailureClassifier.classify(e);
            switch (failure) {
                case TRANSIENT -> log.error("SINK: {} failed after {} attempts: {}",
                        label, props.getMaxRetries() + 1, e.getMessage());
                case INTEGRITY -> log.error("SINK: {} violates a constraint, not retrying: {}",
                        label, e.getMessage());
                default -> log.error("SINK: {} failed: {}", label, e.getMessage(), e);
            }
            return Optional.of(failure);
        }
    }

    private void executeUpsert(List<EnrichmentRecord> rows) {
        String sql = INSERT_COLUMNS
                + String.join(",\n", Collections.nCopies(rows.size(), ROW_PLACEHOLDERS))
                + "\n" + ON_CONFLICT;

        jdbcTemplate.update(con -> {
            PreparedStatement ps = con.prepareStatement(sql);
            int offset = 0;
            for (EnrichmentRecord row : rows) {
                bind(con, ps, offset, row);
                offset += PARAMS_PER_ROW;
            }
            return ps;
        });
    }

    private void bind(Connection con, PreparedStatement ps, int offset, EnrichmentRecord r) throws SQLException {
        int i = offset;
        ps.setString(++i, r.getBusinessKey());
        setLong(ps, ++i, r.getSourceId());
        ps.setString(++i, r.getName());
        ps.setString(++i, r.getCategory());
        ps.setString(++i, r.getCountry());
        ps.setString(++i, r.getAddress());
        ps.setString(++i, r.getWebsite());
        setDouble(ps, ++i, r.getLatitude());
        setDouble(ps, ++i, r.getLongitude());
        setInt(ps, ++i, r.getReviewCount());
        setDouble(ps, ++i, r.getReviewRating());
        setTextArray(con, ps, ++i, r.getEmails());
        setTextArray(con, ps, ++i, r.getPhones());
        setTextArray(con, ps, ++i, r.getWhatsapp());
        ps.setString(++i, blankToNull(r.getFacebook()));
        ps.setString(++i, blankToNull(r.getInstagram()));
        ps.setString(++i, blankToNull(r.getLinkedin()));
        ps.setString(++i, blankToNull(r.getTiktok()));
        ps.setString(++i, blankToNull(r.getYoutube()));
        ps.setString(++i, toJson(r.getValidatedEmails()));
        ps.setString(++i, toJson(r.getValidatedWhatsapp()));
        ps.setString(++i, blankToNull(r.getFinalUrl()));
        ps.setBoolean(++i, r.isWasRedirected());
        ps.setString(++i, (r.getStatus() == null ? ScrapeStatus.FAILED : r.getStatus()).dbValue());
        ps.setString(++i, blankToNull(r.getError()));
        ps.setDouble(++i, r.getProcessingTimeSeconds());
        ps.setInt(++i, r.getPagesScraped());
        ps.setInt(++i, r.emailsFound());
        ps.setInt(++i, r.phonesFound());
        ps.setInt(++i, r.whatsappFound());
        ps.setString(++i, serverId);
    }

    private void setTextArray(Connection con, PreparedStatement ps, int index, List<String> values) throws SQLException {
        List<String> cleaned = values == null ? List.of() : values.stream()
                .filter(v -> v != null && !v.isBlank())
                .map(String::trim)
                .toList();
        if (cleaned.isEmpty()) {
            ps.setNull(index, Types.ARRAY);
        } else {
            ps.setArray(index, con.createArrayOf("text", cleaned.toArray()));
        }
    }

    private static void setLong(PreparedStatement ps, int index, Long value) throws SQLException {
        if (value == null) ps.setNull(index, Types.BIGINT);
        else ps.setLong(index, value);
    }

    private static void setInt(PreparedStatement ps, int index, Integer value) throws SQLException {
        if (value == null) ps.setNull(index, Types.INTEGER);
        else ps.setInt(index, value);
    }

    private static void setDouble(PreparedStatement ps, int index, Double value) throws SQLException {
        if (value == null) ps.setNull(index, Types.DOUBLE);
        else ps.setDouble(index, value);
    }

    private String toJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize validation payload", e);
        }
    }

    private static List<String> textArray(ResultSet rs, String column) throws SQLException {
        Array array = rs.getArray(column);
        if (array == null) {
            return List.of();
        }
        try {
            return Arrays.asList((String[]) array.getArray());
        } finally {
            array.free();
        }
    }

    private static String blankToNull(String value) {
        return (value == null || value.isBlank()) ? null : value.trim();
    }

    private static boolean hasKey(EnrichmentRecord record) {
        return record != null && record.getBusinessKey() != null && !record.getBusinessKey().isBlank();
    }
}
