package com.tenacy.tradepulse.monitor.health;

import com.tenacy.tradepulse.domain.ComponentHealthSnapshot;
import com.tenacy.tradepulse.domain.HealthStatus;
import com.tenacy.tradepulse.store.EventStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Polls every registered {@link ComponentProbe} on a fixed interval.
 * <p>
 * Probes run concurrently; one slow or failing probe never delays or fails the others.
 * The latest aggregate is owned here and only exposed through {@link #getStatus()}.
 */
@Service
@Slf4j
public class HealthMonitor {

    private final List<ComponentProbe> probes;
    private final EventStore eventStore;
    private final Executor probeExecutor;
    private final Clock clock;

    private volatile HealthSummary latestHealth;

    @Autowired
    public HealthMonitor(ObjectProvider<ComponentProbe> probes,
                         EventStore eventStore,
                         @Qualifier("probeExecutor") Executor probeExecutor,
                         Clock clock) {
        this(probes.orderedStream().collect(Collectors.toList()), eventStore, probeExecutor, clock);
    }

    public HealthMonitor(List<ComponentProbe> probes,
                         EventStore eventStore,
                         @Qualifier("probeExecutor") Executor probeExecutor,
                         Clock clock) {
        this.probes = new ArrayList<>(probes);
        this.eventStore = eventStore;
        this.probeExecutor = probeExecutor;
        this.clock = clock;
        this.latestHealth = HealthSummary.unknown(clock.instant());

        log.info("Health monitor initialized with components: {}",
                this.probes.stream().map(ComponentProbe::getComponentId).collect(Collectors.joining(", ")));
    }

    @Scheduled(fixedRateString = "${tradepulse.monitoring.health-check-interval:30000}",
            initialDelayString = "${tradepulse.monitoring.initial-delay:0}")
    public HealthSummary check() {
        log.debug("Running health check for all components");

        List<CompletableFuture<ComponentHealthSnapshot>> checks = probes.stream()
                .map(probe -> CompletableFuture.supplyAsync(probe::check, probeExecutor)
                        .exceptionally(ex -> failedCheck(probe, ex)))
                .collect(Collectors.toList());

        Map<String, ComponentHealthSnapshot> components = new LinkedHashMap<>();
        List<HealthStatus> statuses = new ArrayList<>();

        for (CompletableFuture<ComponentHealthSnapshot> check : checks) {
            ComponentHealthSnapshot snapshot = check.join();
            record(snapshot);
            components.put(snapshot.getComponent(), snapshot);
            statuses.add(snapshot.getStatus());
        }

        HealthSummary summary = HealthSummary.builder()
                .timestamp(clock.instant())
                .overall(HealthStatus.worstOf(statuses))
                .components(Collections.unmodifiableMap(components))
                .build();

        latestHealth = summary;

        if (summary.getOverall() != HealthStatus.HEALTHY) {
            log.info("Health check completed - overall: {}", summary.getOverall().getCode());
        }
        return summary;
    }

    public HealthSummary getStatus() {
        return latestHealth;
    }

    public List<String> getComponentIds() {
        return probes.stream().map(ComponentProbe::getComponentId).collect(Collectors.toList());
    }

    private void record(ComponentHealthSnapshot snapshot) {
        eventStore.appendHealthSnapshot(snapshot);
        eventStore.updateComponentUptime(snapshot.getComponent(), snapshot.getStatus().isOnline());
    }

    private ComponentHealthSnapshot failedCheck(ComponentProbe probe, Throwable ex) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        log.error("{} health check failed: {}", probe.getComponentId(), cause.getMessage(), cause);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("error", cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName());

        return ComponentHealthSnapshot.builder()
                .component(probe.getComponentId())
                .status(HealthStatus.CRITICAL)
                .details(details)
                .timestamp(clock.instant())
                .build();
    }
}
