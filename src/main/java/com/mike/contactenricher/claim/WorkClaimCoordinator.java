package com.mike.contactenricher.claim;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.mike.contactenricher.config.EnricherProperties;
import com.mike.contactenricher.registry.ServerIdentity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Hands out disjoint batches of backlog rows to any number of concurrently running servers.
 *
 * <p>Each pending row is guarded by a bigint advisory lock keyed on {@code (namespace << 32) # id},
 * taken only after the pending filter has been applied: a row locked by another in-flight transaction simply drops out of the result
 * instead of blocking the statement. Locks belong to the claiming transaction and disappear when it
 * commits or rolls back, so a batch is only owned for the lifetime of
 * {@link #processClaimedBatch(int, Function)}.
 */
@Service
@Slf4j
public class WorkClaimCoordinator {

    static final String PENDING_FILTER = """
            NOT EXISTS (
                SELECT 1 FROM scraped_contacts sc
                WHERE sc.business_key = r.data->>'link'
            )
            AND r.data->>'web_site' IS NOT NULL
            AND r.data->>'web_site' <> ''
            AND r.data->>'link' IS NOT NULL
            AND r.data->>'link' <> ''
            """;

    static final String COUNTRY_FILTER =
            "AND UPPER(LEFT(COALESCE(r.data->'complete_address'->>'country', ''), 2)) = ?\n";

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final BacklogRowParser rowParser;
    private final EnricherProperties.Claim props;
    private final String serverId;

    public WorkClaimCoordinator(JdbcTemplate jdbcTemplate,
                                PlatformTransactionManager transactionManager,
                                BacklogRowParser rowParser,
                                EnricherProperties properties,
                                ServerIdentity serverIdentity) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.rowParser = rowParser;
        this.props = properties.getClaim();
        this.serverId = serverIdentity.getId();
    }

    /**
     * Claims up to {@code size} pending rows for the current transaction, in ascending id order.
     * Must run inside a transaction; the returned rows stay locked until that transaction ends.
     *
     * @return the claimed rows, empty when the (filtered) backlog is exhausted
     */
    public List<WorkItem> claimBatch(int size) {
        if (size <= 0) throw new IllegalArgumentException("size must be > 0");
        if (!TransactionSynchronizationManager.isActualTransactionActive()) {
            throw new IllegalStateException(
                    "claimBatch requires an active transaction; use processClaimedBatch");
        }

        Optional<String> country = countryFilter();

        // OFFSET 0 keeps the subquery from being flattened, so only rows that survived the
        // pending filter are offered to the lock, one at a time in id order until LIMIT is met.
        StringBuilder sql = new StringBuilder("SELECT c.id, c.data\nFROM (\n")
                .append("SELECT r.id, r.data::text AS data\nFROM results r\nWHERE ")
                .append(PENDING_FILTER);
        List<Object> args = new ArrayList<>();
        if (country.isPresent()) {
            sql.append(COUNTRY_FILTER);
            args.add(country.get());
        }
        sql.append("ORDER BY r.id\n")
                .append("OFFSET 0\n")
                .append(") c\n")
                .append("WHERE pg_try_advisory_xact_lock((CAST(? AS bigint) << 32) # c.id)\n")
                .append("ORDER BY c.id\n")
                .append("LIMIT ?");
        args.add(props.getLockNamespace());
        args.add(size);

        List<RawRow> rows = jdbcTemplate.query(sql.toString(),
                (rs, rowNum) -> new RawRow(rs.getLong("id"), rs.getString("data")),
                args.toArray());

        List<WorkItem> claimed = new ArrayList<>(rows.size());
        for (RawRow row : rows) {
            try {
                Optional<WorkItem> item = rowParser.parse(row.id(), row.data());
                if (item.isPresent()) {
                    claimed.add(item.get());
                } else {
                    log.warn("CLAIM[{}]: row {} has no url or business key, skipping", serverId, row.id());
                }
            } catch (JsonProcessingException e) {
                log.warn("CLAIM[{}]: parse error for row {}: {}", serverId, row.id(), e.getOriginalMessage());
            }
        }

        if (!claimed.isEmpty()) {
            log.info("CLAIM[{}]: claimed {} rows (ids {}..{}), holding locks",
                    serverId, claimed.size(), claimed.get(0).getId(), claimed.get(claimed.size() - 1).getId());
        }
        return claimed;
    }

    /**
     * Claims a batch and runs {@code work} on it while the locks are held. The transaction commits
     * when {@code work} returns and rolls back when it throws; either way the locks are released
     * before this method returns.
     */
    public <T> ClaimedBatch<T> processClaimedBatch(int size, Function<List<WorkItem>, T> work) {
        ClaimedBatch<T> batch = transactionTemplate.execute(status -> {
            List<WorkItem> items = claimBatch(size);
            if (items.isEmpty()) {
                return new ClaimedBatch<>(items, null);
            }
            return new ClaimedBatch<>(items, work.apply(items));
        });

        if (batch != null && !batch.isEmpty()) {
            log.debug("CLAIM[{}]: released {} locks (commit)", serverId, batch.getItems().size());
        }
        return batch == null ? new ClaimedBatch<>(List.of(), null) : batch;
    }

    public long pendingCount() {
        Optional<String> country = countryFilter();
        String sql = "SELECT COUNT(*) FROM results r WHERE " + PENDING_FILTER + country.map(c -> COUNTRY_FILTER).orElse("");
        Long count = country.isPresent()
                ? jdbcTemplate.queryForObject(sql, Long.class, country.get())
                : jdbcTemplate.queryForObject(sql, Long.class);
        return count == null ? 0 : count;
    }

    public long totalCount() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM results", Long.class);
        return count == null ? 0 : count;
    }

    public long completedCount() {
        Long count = jdbcTemplate.queryForObject("""
                SELECT COUNT(*) FROM results r
                JOIN scraped_contacts sc ON sc.business_key = r.data->>'link'
                """, Long.class);
        return count == null ? 0 : count;
    }

    /**
     * Pending rows per ISO-2 country ({@code XX} when unknown), largest first.
     */
    public Map<String, Long> pendingCountsByCountry() {
        String sql = "SELECT UPPER(LEFT(COALESCE(NULLIF(r.data->'complete_address'->>'country', ''), 'XX'), 2)) AS country,\n"
                + "       COUNT(*) AS pending\n"
                + "FROM results r\n"
                + "WHERE " + PENDING_FILTER
                + "GROUP BY 1\n"
                + "ORDER BY pending DESC, country";

        Map<String, Long> counts = new LinkedHashMap<>();
        jdbcTemplate.query(sql, rs -> {
            counts.put(rs.getString("country"), rs.getLong("pending"));
        });
        return counts;
    }

    private Optional<String> countryFilter() {
        String country = props.getCountryFilter();
        if (country == null || country.isBlank()) {
            return Optional.empty();
        }
        String upper = country.trim().toUpperCase(Locale.ROOT);
        return Optional.of(upper.length() > 2 ? upper.substring(0, 2) : upper);
    }

    private record RawRow(long id, String data) {
    }
}
