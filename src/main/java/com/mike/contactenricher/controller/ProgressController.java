package com.mike.contactenricher.controller;

import com.mike.contactenricher.claim.WorkClaimCoordinator;
import com.mike.contactenricher.dto.ProgressResponse;
import com.mike.contactenricher.orchestrator.EnrichmentOrchestrator;
import com.mike.contactenricher.pool.BrowserPool;
import com.mike.contactenricher.registry.ScraperServer;
import com.mike.contactenricher.registry.ServerIdentity;
import com.mike.contactenricher.registry.ServerRegistry;
import com.mike.contactenricher.sink.ResultSink;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequiredArgsConstructor
public class ProgressController {

    private final WorkClaimCoordinator claims;
    private final ResultSink sink;
    private final BrowserPool pool;
    private final EnrichmentOrchestrator orchestrator;
    private final ServerRegistry registry;
    private final ServerIdentity identity;

    @GetMapping("/api/progress")
    public ProgressResponse progress() {
        long total = claims.totalCount();
        long completed = claims.completedCount();
        return ProgressResponse.builder()
                .serverId(identity.getId())
                .running(orchestrator.isRunning())
                .total(total)
                .pending(claims.pendingCount())
                .completed(completed)
                .percentComplete(total == 0 ? 0.0 : Math.round(completed * 10_000.0 / total) / 100.0)
                .sink(sink.totalStats())
                .pool(pool.stats())
                .build();
    }

    @GetMapping("/api/progress/countries")
    public Map<String, Long> pendingByCountry() {
        return claims.pendingCountsByCountry();
    }

    @GetMapping("/api/servers")
    public List<ScraperServer> onlineServers() {
        return registry.onlineServers();
    }
}
