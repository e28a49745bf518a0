package com.mike.contactenricher.registry;

import com.mike.contactenricher.config.EnricherProperties;
import com.mike.contactenricher.orchestrator.RunStats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Keeps this server's row in {@code scraper_servers} current for the dashboard.
 * Registry writes are best effort: a failure is logged and the run goes on.
 */
@Service
@Slf4j
public class ServerRegistry {

    private static final int MAX_TASK_LENGTH = 255;

    private final ScraperServerRepository repository;
    private final TransactionTemplate tx;
    private final ServerIdentity identity;
    private final EnricherProperties properties;
    private final Clock clock;

    /** Lifetime totals as they were when this session registered. */
    private final AtomicReference<Baseline> baseline = new AtomicReference<>(Baseline.ZERO);
    private final AtomicReference<RunStats> currentRun = new AtomicReference<>();
    private final AtomicReference<String> lastTask = new AtomicReference<>("starting");

    public ServerRegistry(ScraperServerRepository repository,
                          PlatformTransactionManager transactionManager,
                          ServerIdentity identity,
                          EnricherProperties properties,
                          Clock clock) {
        this.repository = repository;
        this.tx = new TransactionTemplate(transactionManager);
        this.tx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.identity = identity;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Marks this server online and starts a new session for {@code run}.
     */
    public boolean register(RunStats run) {
        currentRun.set(run);
        return execute("register", () -> {
            OffsetDateTime now = OffsetDateTime.now(clock);
            ScraperServer server = repository.findById(identity.getId()).orElseGet(() -> {
                ScraperServer created = new ScraperServer();
                created.setServerId(identity.getId());
                created.setStartedAt(now);
                return created;
            });

            server.setServerName(identity.getName());
            server.setHostname(identity.getHostname());
            server.setRegion(identity.getRegion());
            server.setBatchSize(properties.getClaim().getBatchSize());
            server.setStatus(ServerStatus.ONLINE.dbValue());
            server.setCurrentTask("starting");
            server.setSessionId(run.getSessionId());
            server.setSessionStarted(now);
            server.setSessionProcessed(0);
            server.setSessionErrors(0);
            server.setLastHeartbeat(now);
            repository.save(server);

            baseline.set(new Baseline(server.getTotalProcessed(), server.getTotalSuccess(),
                    server.getTotalFailed(), server.getTotalEmailsFound()));
            log.info("REGISTRY: server {} online (session {})", identity.getId(), run.getSessionId());
        });
    }

    public boolean heartbeat(RunStats stats, String currentTask) {
        lastTask.set(currentTask);
        return execute("heartbeat", () -> {
            ScraperServer server = repository.findById(identity.getId()).orElse(null);
            if (server == null) {
                log.warn("REGISTRY: server {} not registered, skipping heartbeat", identity.getId());
                return;
            }

            Baseline base = baseline.get();
            server.setStatus(ServerStatus.ONLINE.dbValue());
            server.setCurrentTask(truncate(currentTask));
            server.setTotalProcessed(base.processed() + stats.getProcessed());
            server.setTotalSuccess(base.success() + stats.getSuccessful() + stats.getNoContacts());
            server.setTotalFailed(base.failed() + stats.getFailed());
            server.setTotalEmailsFound(base.emails() + stats.getEmailsFound());
            server.setAvgSecondsPerUrl(round(stats.avgSecondsPerUrl(), 3));
            server.setUrlsPerMinute(round(stats.urlsPerMinute(), 2));
            server.setSuccessRate(round(stats.successRate(), 2));
            server.setSessionProcessed(stats.getProcessed());
            server.setSessionErrors(stats.getFailed() + stats.getWriteFailures());
            server.setLastHeartbeat(OffsetDateTime.now(clock));
            repository.save(server);
            log.debug("REGISTRY: heartbeat {} processed={} task={}",
                    identity.getId(), stats.getProcessed(), currentTask);
        });
    }

    /**
     * Repeats the last heartbeat of the registered run with fresh counters. No-op without a run.
     */
    public boolean heartbeatCurrent() {
        RunStats run = currentRun.get();
        return run != null && heartbeat(run, lastTask.get());
    }

    public boolean markStatus(ServerStatus status) {
        return execute("mark " + status.dbValue(), () -> repository.findById(identity.getId()).ifPresent(server -> {
            server.setStatus(status.dbValue());
            server.setLastHeartbeat(OffsetDateTime.now(clock));
            repository.save(server);
        }));
    }

    public boolean deregister() {
        RunStats run = currentRun.getAndSet(null);
        if (run != null) {
            heartbeat(run, "stopped");
        }
        boolean ok = markStatus(ServerStatus.OFFLINE);
        if (ok) {
            log.info("REGISTRY: server {} offline", identity.getId());
        }
        return ok;
    }

    /**
     * Servers currently marked online, this one included. Read-only, for the progress endpoint.
     */
    public List<ScraperServer> onlineServers() {
        return repository.findByStatusOrderByServerId(ServerStatus.ONLINE.dbValue());
    }

    private boolean execute(String action, Runnable work) {
        try {
            tx.executeWithoutResult(status -> work.run());
            return true;
        } catch (RuntimeException e) {
            log.warn("REGISTRY: {} failed for server {}: {}", action, identity.getId(), e.getMessage());
            return false;
        }
    }

    private static String truncate(String task) {
        if (task == null) return null;
        return task.length() > MAX_TASK_LENGTH ? task.substring(0, MAX_TASK_LENGTH) : task;
    }

    private static double round(double value, int decimals) {
        double scale = Math.pow(10, decimals);
        return Math.round(value * scale) / scale;
    }

    private record Baseline(long processed, long success, long failed, long emails) {
        static final Baseline ZERO = new Baseline(0, 0, 0, 0);
    }
}
