package com.mike.contactenricher.dto;

import com.mike.contactenricher.orchestrator.RunOutcome;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Locale;

@Value
@Builder
public class RunSummary {
    String serverId;
    String sessionId;
    RunOutcome outcome;

    long batches;
    long processed;
    long successful;
    long noContacts;
    long failed;

    long written;
    long writeFailures;

    long emailsFound;
    long phonesFound;
    long whatsappFound;

    Duration elapsed;
    double urlsPerMinute;

    public String toLogLine() {
        return "server=" + serverId +
                " session=" + sessionId +
                " outcome=" + outcome +
                " batches=" + batches +
                " processed=" + processed +
                " successful=" + successful +
                " noContacts=" + noContacts +
                " failed=" + failed +
                " written=" + written +
                " writeFailures=" + writeFailures +
                " emails=" + emailsFound +
                " phones=" + phonesFound +
                " whatsapp=" + whatsappFound +
                " elapsedSec=" + (elapsed == null ? 0 : elapsed.toSeconds()) +
                " urlsPerMin=" + String.format(Locale.ROOT, "%.1f", urlsPerMinute);
    }
}
