package com.mike.contactenricher.registry;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;

@Entity
@Table(name = "scraper_servers")
@Getter @Setter
public class ScraperServer {

    @Id
    @Column(name = "server_id", length = 50)
    private String serverId;

    @Column(name = "server_name", length = 100)
    private String serverName;

    @Column(name = "server_hostname")
    private String hostname;

    @Column(name = "server_region", length = 50)
    private String region;

    @Column(name = "batch_size")
    private Integer batchSize;

    @Column(name = "status", length = 20)
    private String status;

    @Column(name = "current_task")
    private String currentTask;

    // lifetime totals, summed over sessions
    @Column(name = "total_processed")
    private long totalProcessed;

    @Column(name = "total_success")
    private long totalSuccess;

    @Column(name = "total_failed")
    private long totalFailed;

    @Column(name = "total_emails_found")
    private long totalEmailsFound;

    @Column(name = "avg_time_per_url")
    private Double avgSecondsPerUrl;

    @Column(name = "urls_per_minute")
    private Double urlsPerMinute;

    @Column(name = "success_rate")
    private Double successRate;

    @Column(name = "started_at")
    private OffsetDateTime startedAt;

    @Column(name = "last_heartbeat")
    private OffsetDateTime lastHeartbeat;

    @Column(name = "session_id", length = 100)
    private String sessionId;

    @Column(name = "session_started")
    private OffsetDateTime sessionStarted;

    @Column(name = "session_processed")
    private long sessionProcessed;

    @Column(name = "session_errors")
    private long sessionErrors;
}
