package com.mike.contactenricher.orchestrator;

import lombok.extern.slf4j.Slf4j;
import sun.misc.Signal;
import sun.misc.SignalHandler;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Routes Ctrl+C to the orchestrator while a run is in progress. The first interrupt lets the
 * current batch finish; the second one makes {@link EnrichmentOrchestrator#requestStop()} halt the
 * process. The JVM's own handler is put back on {@link #close()}.
 */
@Slf4j
class InterruptSignalHandler implements AutoCloseable {

    private static final Signal INT = new Signal("INT");

    private final SignalHandler previous;
    private final AtomicBoolean interrupted;

    private InterruptSignalHandler(SignalHandler previous, AtomicBoolean interrupted) {
        this.previous = previous;
        this.interrupted = interrupted;
    }

    static InterruptSignalHandler install(EnrichmentOrchestrator orchestrator) {
        AtomicBoolean interrupted = new AtomicBoolean();
        try {
            SignalHandler previous = Signal.handle(INT, signal -> {
                log.warn("EnrichmentRunner: SIGINT received (press Ctrl+C again to force quit)");
                interrupted.set(true);
                orchestrator.requestStop();
            });
            return new InterruptSignalHandler(previous, interrupted);
        } catch (IllegalArgumentException e) {
            log.warn("EnrichmentRunner: cannot handle SIGINT ({}), leaving it to the JVM", e.getMessage());
            return new InterruptSignalHandler(null, interrupted);
        }
    }

    boolean wasInterrupted() {
        return interrupted.get();
    }

    @Override
    public void close() {
        if (previous != null) {
            Signal.handle(INT, previous);
        }
    }
}
