package me.golemcore.proxy.adapter.outbound.bandwidth;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.proxy.domain.model.BandwidthUsage;
import me.golemcore.proxy.infrastructure.config.ProxyProperties;
import me.golemcore.proxy.infrastructure.http.FeignClientFactory;
import me.golemcore.proxy.port.outbound.BandwidthPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;

/**
 * Monthly outbound bandwidth of the hosting service, read from the Render
 * metrics API. Any failure reports usage as unavailable.
 */
@Component
@Slf4j
public class RenderBandwidthAdapter implements BandwidthPort {

    static final String API_KEY_PREFIX = "rnd_";

    private final RenderMetricsApi api;
    private final Clock clock;
    private final String apiKey;
    private final String serviceId;

    public RenderBandwidthAdapter(FeignClientFactory feignClientFactory, ProxyProperties properties, Clock clock) {
        ProxyProperties.RenderProperties render = properties.getBandwidth().getRender();
        this.api = feignClientFactory.create(RenderMetricsApi.class, render.getBaseUrl());
        this.clock = clock;
        this.apiKey = render.getApiKey();
        this.serviceId = render.getServiceId();
    }

    public boolean isConfigured() {
        return apiKey != null && apiKey.startsWith(API_KEY_PREFIX) && serviceId != null && !serviceId.isBlank();
    }

    @Override
    public BandwidthUsage fetchMonthlyUsage() {
        if (!isConfigured()) {
            return BandwidthUsage.unavailable();
        }

        ZonedDateTime end = ZonedDateTime.now(clock.withZone(ZoneOffset.UTC)).truncatedTo(ChronoUnit.SECONDS);
        ZonedDateTime start = end.withDayOfMonth(1).truncatedTo(ChronoUnit.DAYS);
        log.debug("[Bandwidth] Querying Render from {} to {}", start, end);

        try {
            List<RenderMetricsApi.BandwidthSeries> series = api.bandwidth(apiKey, serviceId,
                    DateTimeFormatter.ISO_INSTANT.format(start), DateTimeFormatter.ISO_INSTANT.format(end));
            if (series == null || series.size() != 1 || series.get(0).unit() == null
                    || series.get(0).values() == null) {
                log.warn("[Bandwidth] Unexpected Render response shape");
                return BandwidthUsage.unavailable();
            }

            double total = 0;
            for (RenderMetricsApi.Point point : series.get(0).values()) {
                total += point.value();
            }
            log.info("[Bandwidth] Query succeeded: {} {}", String.format(Locale.ROOT, "%.2f", total), series.get(0).unit());
            return new BandwidthUsage((long) total, series.get(0).unit());
        } catch (RuntimeException e) {
            log.warn("[Bandwidth] Query failed: {}", e.getMessage());
            return BandwidthUsage.unavailable();
        }
    }
}
