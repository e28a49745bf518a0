package com.mike.contactenricher.orchestrator;

import com.mike.contactenricher.sink.ScrapeStatus;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.DoubleAdder;

/**
 * Counters of one run of this server. Updated by fetch workers, read by the heartbeat.
 */
public class RunStats {

    private final String sessionId = UUID.randomUUID().toString();
    private final Clock clock;
    private final Instant startedAt;

    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong successful = new AtomicLong();
    private final AtomicLong noContacts = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong emailsFound = new AtomicLong();
    private final AtomicLong phonesFound = new AtomicLong();
    private final AtomicLong whatsappFound = new AtomicLong();
    private final AtomicLong written = new AtomicLong();
    private final AtomicLong writeFailures = new AtomicLong();
    private final AtomicLong batches = new AtomicLong();
    private final DoubleAdder processingSeconds = new DoubleAdder();

    public RunStats(Clock clock) {
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    public void recordItem(ScrapeStatus status, int emails, int phones, int whatsapp, double seconds) {
        processed.incrementAndGet();
        switch (status) {
            case SUCCESS -> successful.incrementAndGet();
            case NO_CONTACTS_FOUND -> noContacts.incrementAndGet();
            case FAILED -> failed.incrementAndGet();
        }
        emailsFound.addAndGet(emails);
        phonesFound.addAndGet(phones);
        whatsappFound.addAndGet(whatsapp);
        processingSeconds.add(seconds);
    }

    public void recordWrite(int attempted, int stored) {
        written.addAndGet(stored);
        writeFailures.addAndGet(Math.max(0, attempted - stored));
    }

    public void recordBatch() {
        batches.incrementAndGet();
    }

    public String getSessionId() {
        return sessionId;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public long getProcessed() {
        return processed.get();
    }

    public long getSuccessful() {
        return successful.get();
    }

    public long getNoContacts() {
        return noContacts.get();
    }

    public long getFailed() {
        return failed.get();
    }

    public long getEmailsFound() {
        return emailsFound.get();
    }

    public long getPhonesFound() {
        return phonesFound.get();
    }

    public long getWhatsappFound() {
        return whatsappFound.get();
    }

    public long getWritten() {
        return written.get();
    }

    public long getWriteFailures() {
        return writeFailures.get();
    }

    public long getBatches() {
        return batches.get();
    }

    public Duration elapsed() {
        return Duration.between(startedAt, clock.instant());
    }

    /**
     * Items that produced a result, with or without contacts, in percent.
     */
    public double successRate() {
        long total = processed.get();
        return total == 0 ? 0.0 : (successful.get() + noContacts.get()) * 100.0 / total;
    }

    public double avgSecondsPerUrl() {
        long total = processed.get();
        return total == 0 ? 0.0 : processingSeconds.sum() / total;
    }

    public double urlsPerMinute() {
        double minutes = elapsed().toMillis() / 60_000.0;
        return minutes <= 0 ? 0.0 : processed.get() / minutes;
    }
}
