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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import feign.Headers;
import feign.Param;
import feign.RequestLine;

import java.util.List;

/**
 * Render metrics API, bandwidth series only.
 */
public interface RenderMetricsApi {

    @RequestLine("GET /v1/metrics/bandwidth?resource={resource}&startTime={startTime}&endTime={endTime}")
    @Headers({ "Accept: application/json", "Authorization: Bearer {apiKey}" })
    List<BandwidthSeries> bandwidth(@Param("apiKey") String apiKey, @Param("resource") String resource,
            @Param("startTime") String startTime, @Param("endTime") String endTime);

    @JsonIgnoreProperties(ignoreUnknown = true)
    record BandwidthSeries(String unit, List<Point> values) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Point(String timestamp, double value) {
    }
}
