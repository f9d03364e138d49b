package me.golemcore.proxy.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.proxy.adapter.inbound.web.dto.HealthResponse;
import me.golemcore.proxy.domain.model.BandwidthUsage;
import me.golemcore.proxy.domain.service.BandwidthService;
import me.golemcore.proxy.infrastructure.config.ProxyProperties;
import me.golemcore.proxy.port.outbound.StatisticsPort;
import me.golemcore.proxy.port.outbound.UserStoragePort;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.lang.management.ManagementFactory;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Health and statistics endpoints. Both read the storage backend, so they run
 * on the bounded elastic scheduler.
 */
@RestController
@RequiredArgsConstructor
public class SystemController {

    private final ProxyProperties properties;
    private final BandwidthService bandwidthService;
    private final UserStoragePort storage;
    private final StatisticsPort statistics;

    @GetMapping({ "/health", "/healthz" })
    public Mono<ResponseEntity<HealthResponse>> health() {
        return Mono.fromCallable(this::buildHealth)
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/stats")
    public Mono<ResponseEntity<Map<String, Map<String, Long>>>> stats() {
        return Mono.fromCallable(this::buildStats)
                .subscribeOn(Schedulers.boundedElastic());
    }

    private ResponseEntity<HealthResponse> buildHealth() {
        BandwidthUsage usage = bandwidthService.getUsage();
        long uptimeMs = ManagementFactory.getRuntimeMXBean().getUptime();

        HealthResponse response = HealthResponse.builder()
                .admin(properties.getAdmin())
                .bandwidth(usage.mebibytes())
                .bwarning(bandwidthService.getWarningMib())
                .cooldown(bandwidthService.getCooldownPolicy().apply(usage))
                .cpolicy(bandwidthService.getCooldownPolicy().toString())
                .keyspace(storage.keyCount())
                .uptime(TimeUnit.MILLISECONDS.toSeconds(uptimeMs))
                .version(properties.getVersion())
                .build();
        return ResponseEntity.ok(response);
    }

    private ResponseEntity<Map<String, Map<String, Long>>> buildStats() {
        Map<String, Map<String, Long>> result = new LinkedHashMap<>();
        for (StatisticsPort.Bucket bucket : statistics.query()) {
            result.put(bucket.name(), bucket.counters());
        }
        return ResponseEntity.ok(result);
    }
}
