package me.golemcore.proxy.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.proxy.domain.model.BandwidthUsage;
import me.golemcore.proxy.infrastructure.config.ProxyProperties;
import me.golemcore.proxy.port.outbound.BandwidthPort;
import me.golemcore.proxy.ratelimit.CooldownPolicy;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cached view of the deployment's monthly bandwidth.
 *
 * <p>
 * Readers never wait on the metrics API: they get the last reading, and a
 * stale reading triggers at most one background refresh at a time. Until the
 * first refresh completes usage is unavailable, which means no cooldown.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class BandwidthService {

    private final BandwidthPort bandwidthPort;
    private final CooldownPolicy cooldownPolicy;
    private final Clock clock;
    private final Duration ttl;
    private final long warningMib;
    private final AtomicBoolean refreshing = new AtomicBoolean(false);
    private final ExecutorService executor;

    private volatile BandwidthUsage cached = BandwidthUsage.unavailable();
    private volatile Instant fetchedAt;

    public BandwidthService(BandwidthPort bandwidthPort, CooldownPolicy cooldownPolicy, Clock clock,
            ProxyProperties properties) {
        this.bandwidthPort = bandwidthPort;
        this.cooldownPolicy = cooldownPolicy;
        this.clock = clock;
        this.ttl = Duration.ofSeconds(properties.getBandwidth().getCacheTtlSeconds());
        this.warningMib = properties.getBandwidth().getWarningMib();
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "bandwidth-refresh");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Last known usage; schedules a refresh when the reading is stale.
     */
    public BandwidthUsage getUsage() {
        Instant last = fetchedAt;
        if (last == null || !clock.instant().isBefore(last.plus(ttl))) {
            scheduleRefresh();
        }
        return cached;
    }

    /**
     * Cooldown in seconds for the current usage.
     */
    public long currentCooldown() {
        return cooldownPolicy.apply(getUsage());
    }

    public CooldownPolicy getCooldownPolicy() {
        return cooldownPolicy;
    }

    public long getWarningMib() {
        return warningMib;
    }

    /**
     * Fetch synchronously on the calling thread. Used by the background
     * refresh and by tests.
     */
    void refresh() {
        try {
            BandwidthUsage usage = bandwidthPort.fetchMonthlyUsage();
            cached = usage;
            fetchedAt = clock.instant();
            if (usage.isAvailable() && usage.mebibytes() >= warningMib) {
                log.warn("[Bandwidth] Usage {} MiB is above the warning threshold of {} MiB",
                        usage.mebibytes(), warningMib);
            }
        } catch (RuntimeException e) {
            log.warn("[Bandwidth] Refresh failed: {}", e.getMessage());
            fetchedAt = clock.instant();
        } finally {
            refreshing.set(false);
        }
    }

    private void scheduleRefresh() {
        if (!refreshing.compareAndSet(false, true)) {
            return;
        }
        try {
            executor.execute(this::refresh);
        } catch (RejectedExecutionException e) {
            refreshing.set(false);
            log.debug("[Bandwidth] Refresh rejected: {}", e.getMessage());
        }
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
