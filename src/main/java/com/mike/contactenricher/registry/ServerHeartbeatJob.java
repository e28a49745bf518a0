package com.mike.contactenricher.registry;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Keeps {@code last_heartbeat} fresh while a long batch is in flight.
 */
@Component
@RequiredArgsConstructor
public class ServerHeartbeatJob {

    private final ServerRegistry registry;

    @Scheduled(fixedDelayString = "${enricher.server.heartbeat-interval-millis:30000}",
            initialDelayString = "${enricher.server.heartbeat-interval-millis:30000}")
    public void beat() {
        registry.heartbeatCurrent();
    }
}
