package com.jay.valuator.layer4_pipeline;

import com.jay.valuator.config.ValuatorConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live event buses keyed by run id. A bus is created when a run starts. The
 * stream consumer removes it once drained; a completed bus nobody reads is
 * evicted after the retention window, swept whenever a new bus is created.
 */
@Slf4j
@Component
public class StatusBusRegistry {

    private final Map<String, StatusEventBus> buses = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration retention;

    @Autowired
    public StatusBusRegistry(ValuatorConfig config) {
        this(Clock.systemUTC(), Duration.ofSeconds(config.pipeline().getCompletedBusRetentionSeconds()));
    }

    public StatusBusRegistry(Clock clock, Duration retention) {
        this.clock = clock;
        this.retention = retention;
    }

    public StatusEventBus create(String runId) {
        evictExpired();
        StatusEventBus bus = new StatusEventBus(runId, clock);
        StatusEventBus existing = buses.putIfAbsent(runId, bus);
        if (existing != null) {
            throw new IllegalStateException("Status bus already registered for run " + runId);
        }
        log.debug("Status bus created for run {} ({} live)", runId, buses.size());
        return bus;
    }

    public Optional<StatusEventBus> get(String runId) {
        return Optional.ofNullable(buses.get(runId));
    }

    public void remove(String runId) {
        if (buses.remove(runId) != null) {
            log.debug("Status bus removed for run {} ({} live)", runId, buses.size());
        }
    }

    /** Removes the bus only if its run has finished; a live run keeps its bus for a later stream. */
    public void removeIfComplete(String runId) {
        StatusEventBus bus = buses.get(runId);
        if (bus != null && bus.isComplete() && buses.remove(runId, bus)) {
            log.debug("Status bus released for finished run {} ({} live)", runId, buses.size());
        }
    }

    /** Drops completed buses older than the retention window; returns how many went. */
    public int evictExpired() {
        Instant cutoff = clock.instant().minus(retention);
        int before = buses.size();
        buses.values().removeIf(bus -> {
            Instant done = bus.completedAt();
            return done != null && !done.isAfter(cutoff);
        });
        int evicted = before - buses.size();
        if (evicted > 0) {
            log.info("Evicted {} unread status bus(es) older than {}s", evicted, retention.toSeconds());
        }
        return evicted;
    }

    public int size() {
        return buses.size();
    }
}
