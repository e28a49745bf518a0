package com.mike.contactenricher.orchestrator;

import com.mike.contactenricher.claim.ClaimedBatch;
import com.mike.contactenricher.claim.WorkClaimCoordinator;
import com.mike.contactenricher.claim.WorkItem;
import com.mike.contactenricher.config.EnricherProperties;
import com.mike.contactenricher.dto.RunSummary;
import com.mike.contactenricher.extract.ContactExtractor;
import com.mike.contactenricher.extract.ExtractedContacts;
import com.mike.contactenricher.fetch.FetchResult;
import com.mike.contactenricher.fetch.PooledPageFetcher;
import com.mike.contactenricher.registry.ServerIdentity;
import com.mike.contactenricher.registry.ServerRegistry;
import com.mike.contactenricher.registry.ServerStatus;
import com.mike.contactenricher.sink.EnrichmentRecord;
import com.mike.contactenricher.sink.ResultSink;
import com.mike.contactenricher.sink.ScrapeStatus;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntConsumer;

/**
 * Per-process loop: claim a batch, fetch every page through the browser pool, extract contacts,
 * write the batch, commit (releasing the claim locks), heartbeat, repeat.
 *
 * <p>Stops when the backlog is empty, the row limit is reached, a stop is requested or the
 * database stays unreachable for {@code claim.maxConsecutiveFailures} attempts in a row.
 * A single page or record never ends the run.
 */
@Service
@Slf4j
public class EnrichmentOrchestrator {

    /** Exit status of a forced stop, as for a process killed by SIGINT. */
    static final int FORCED_EXIT_CODE = 130;

    private final WorkClaimCoordinator claims;
    private final PooledPageFetcher fetcher;
    private final ContactExtractor extractor;
    private final ResultSink sink;
    private final ServerRegistry registry;
    private final EnricherProperties properties;
    private final String serverId;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean();
    private volatile boolean stopRequested;
    private final AtomicInteger stopRequests = new AtomicInteger();
    private IntConsumer terminator = status -> Runtime.getRuntime().halt(status);
    private volatile CountDownLatch finished = new CountDownLatch(0);

    public EnrichmentOrchestrator(WorkClaimCoordinator claims,
                                  PooledPageFetcher fetcher,
                                  ContactExtractor extractor,
                                  ResultSink sink,
                                  ServerRegistry registry,
                                  EnricherProperties properties,
                                  ServerIdentity identity,
                                  Clock clock) {
        this.claims = claims;
        this.fetcher = fetcher;
        this.extractor = extractor;
        this.sink = sink;
        this.registry = registry;
        this.properties = properties;
        this.serverId = identity.getId();
        this.clock = clock;
    }

    public RunSummary run() {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Enrichment run already in progress");
        }
        finished = new CountDownLatch(1);
        stopRequested = false;
        stopRequests.set(0);

        RunStats stats = new RunStats(clock);
        RunOutcome outcome = null;
        try {
            registry.register(stats);
            log.info("ORCH[{}]: run started, batchSize={}, maxRows={}, country={}",
                    serverId, properties.getClaim().getBatchSize(), properties.getRun().getMaxRows(),
                    properties.getClaim().getCountryFilter() == null ? "all" : properties.getClaim().getCountryFilter());

            outcome = loop(stats);
            return summarize(stats, outcome);
        } finally {
            if (outcome == RunOutcome.DATABASE_UNAVAILABLE) {
                registry.markStatus(ServerStatus.ERROR);
            } else {
                registry.deregister();
            }
            running.set(false);
            finished.countDown();
        }
    }

    /**
     * Asks the loop to stop. Items of the current batch that are already being fetched finish and
     * are written; items not started yet stay in the backlog.
     *
     * <p>A second request while the run is still going terminates the process at once, without
     * waiting for in-flight pages or shutdown hooks.
     */
    public void requestStop() {
        int requests = stopRequests.incrementAndGet();
        if (requests > 1 && running.get()) {
            log.error("ORCH[{}]: second stop request, terminating immediately", serverId);
            terminator.accept(FORCED_EXIT_CODE);
            return;
        }
        stop();
    }

    void setTerminator(IntConsumer terminator) {
        this.terminator = terminator;
    }

    private void stop() {
        if (!stopRequested) {
            log.info("ORCH[{}]: stop requested, finishing current batch", serverId);
        }
        stopRequested = true;
    }

    public boolean isRunning() {
        return running.get();
    }

    public boolean awaitTermination(long timeoutMillis) throws InterruptedException {
        return finished.await(timeoutMillis, TimeUnit.MILLISECONDS);
    }

    @PreDestroy
    void shutdown() {
        if (!running.get()) {
            return;
        }
        stop();
        long grace = properties.getRun().getShutdownGraceMillis();
        try {
            if (!awaitTermination(grace)) {
                log.warn("ORCH[{}]: run did not finish within {} ms, shutting down anyway", serverId, grace);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("ORCH[{}]: interrupted while waiting for the run to finish", serverId);
        }
    }

    private RunOutcome loop(RunStats stats) {
        int batchSize = properties.getClaim().getBatchSize();
        int maxRows = properties.getRun().getMaxRows();
        int maxFailures = Math.max(1, properties.getClaim().getMaxConsecutiveFailures());
        int consecutiveFailures = 0;

        while (!stopRequested) {
            int size = batchSize;
            if (maxRows > 0) {
                long remaining = maxRows - stats.getProcessed();
                if (remaining <= 0) {
                    log.info("ORCH[{}]: row limit {} reached", serverId, maxRows);
                    return RunOutcome.ROW_LIMIT_REACHED;
                }
                size = (int) Math.min(batchSize, remaining);
            }

            ClaimedBatch<BatchOutcome> batch;
            try {
                batch = claims.processClaimedBatch(size, items -> processBatch(items, stats));
                consecutiveFailures = 0;
            } catch (DataAccessException | TransactionException e) {
                consecutiveFailures++;
                log.error("ORCH[{}]: claim failed ({}/{}), locks released by rollback: {}",
                        serverId, consecutiveFailures, maxFailures, e.getMessage());
                if (consecutiveFailures >= maxFailures) {
                    log.error("ORCH[{}]: database unreachable, giving up", serverId);
                    return RunOutcome.DATABASE_UNAVAILABLE;
                }
                if (!pause(properties.getClaim().getRetryDelayMillis())) {
                    return RunOutcome.STOPPED;
                }
                continue;
            }

            if (batch.isEmpty()) {
                log.info("ORCH[{}]: backlog exhausted", serverId);
                return RunOutcome.BACKLOG_EXHAUSTED;
            }

            stats.recordBatch();
            BatchOutcome result = batch.getResult();
            log.info("ORCH[{}]: batch {} done: claimed={}, written={}, skipped={}, total processed={}",
                    serverId, stats.getBatches(), batch.getItems().size(),
                    result.written(), result.skipped(), stats.getProcessed());

            registry.heartbeat(stats, "batch " + stats.getBatches() + " done");
        }
        return RunOutcome.STOPPED;
    }

    /**
     * Runs while the claim locks are held. Nothing thrown here should be a per-item problem:
     * fetch and extraction failures become failed records.
     */
    BatchOutcome processBatch(List<WorkItem> items, RunStats stats) {
        registry.heartbeat(stats, "processing " + items.size() + " urls (ids "
                + items.get(0).getId() + ".." + items.get(items.size() - 1).getId() + ")");

        List<FetchResult> fetched = fetcher.fetchAll(items, () -> !stopRequested);

        List<EnrichmentRecord> records = new ArrayList<>(items.size());
        int skipped = 0;
        for (int i = 0; i < items.size(); i++) {
            FetchResult fetch = fetched.get(i);
            if (fetch.isSkipped()) {
                skipped++;
                continue;
            }
            EnrichmentRecord record = toRecord(items.get(i), fetch);
            stats.recordItem(record.getStatus(), record.emailsFound(), record.phonesFound(),
                    record.whatsappFound(), record.getProcessingTimeSeconds());
            records.add(record);
        }

        int written = sink.upsertBatch(records);
        stats.recordWrite(records.size(), written);
        if (written < records.size()) {
            log.warn("ORCH[{}]: {} of {} records not stored", serverId, records.size() - written, records.size());
        }
        return new BatchOutcome(records.size(), written, skipped);
    }

    EnrichmentRecord toRecord(WorkItem item, FetchResult fetch) {
        long start = System.nanoTime();
        EnrichmentRecord.EnrichmentRecordBuilder record = EnrichmentRecord.forItem(item)
                .finalUrl(fetch.getFinalUrl())
                .wasRedirected(fetch.isRedirected())
                .pagesScraped(fetch.pagesScraped());

        if (!fetch.isSuccess()) {
            return record.status(ScrapeStatus.FAILED)
                    .error(fetch.getError())
                    .processingTimeSeconds(fetch.getElapsedMillis() / 1000.0)
                    .build();
        }

        try {
            String pageUrl = fetch.getFinalUrl() != null ? fetch.getFinalUrl() : item.getSourceUrl();
            ExtractedContacts contacts = extractor.extract(fetch.getHtml(), pageUrl);
            record.emails(contacts.getEmails())
                    .phones(contacts.getPhones())
                    .whatsapp(contacts.getWhatsapp())
                    .facebook(contacts.getFacebook())
                    .instagram(contacts.getInstagram())
                    .linkedin(contacts.getLinkedin())
                    .tiktok(contacts.getTiktok())
                    .youtube(contacts.getYoutube())
                    .validatedEmails(contacts.getValidatedEmails())
                    .validatedWhatsapp(contacts.getValidatedWhatsapp())
                    .status(contacts.isEmpty() ? ScrapeStatus.NO_CONTACTS_FOUND : ScrapeStatus.SUCCESS);
        } catch (RuntimeException e) {
            log.warn("ORCH[{}]: extraction failed for {}: {}", serverId, item.getSourceUrl(), e.getMessage());
            record.status(ScrapeStatus.FAILED).error("extraction failed: " + e.getMessage());
        }

        double extractSeconds = (System.nanoTime() - start) / 1_000_000_000.0;
        return record.processingTimeSeconds(fetch.getElapsedMillis() / 1000.0 + extractSeconds).build();
    }

    private boolean pause(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stop();
            return false;
        }
    }

    private RunSummary summarize(RunStats stats, RunOutcome outcome) {
        RunSummary summary = RunSummary.builder()
                .serverId(serverId)
                .sessionId(stats.getSessionId())
                .outcome(outcome)
                .batches(stats.getBatches())
                .processed(stats.getProcessed())
                .successful(stats.getSuccessful())
                .noContacts(stats.getNoContacts())
                .failed(stats.getFailed())
                .written(stats.getWritten())
                .writeFailures(stats.getWriteFailures())
                .emailsFound(stats.getEmailsFound())
                .phonesFound(stats.getPhonesFound())
                .whatsappFound(stats.getWhatsappFound())
                .elapsed(stats.elapsed())
                .urlsPerMinute(stats.urlsPerMinute())
                .build();
        log.info("ORCH[{}]: run finished: {}", serverId, summary.toLogLine());
        return summary;
    }

    record BatchOutcome(int attempted, int written, int skipped) {
    }
}
