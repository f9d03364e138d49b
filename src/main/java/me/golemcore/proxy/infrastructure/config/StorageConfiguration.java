package me.golemcore.proxy.infrastructure.config;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.proxy.adapter.outbound.stats.InMemoryStatisticsAdapter;
import me.golemcore.proxy.adapter.outbound.stats.RedisStatisticsAdapter;
import me.golemcore.proxy.adapter.outbound.stats.StatsBuckets;
import me.golemcore.proxy.adapter.outbound.storage.LocalUserStorageAdapter;
import me.golemcore.proxy.adapter.outbound.storage.RedisUserStorageAdapter;
import me.golemcore.proxy.port.outbound.StatisticsPort;
import me.golemcore.proxy.port.outbound.UserStoragePort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import redis.clients.jedis.JedisPooled;

import java.net.URI;
import java.time.Clock;

/**
 * Chooses the storage and statistics backends.
 *
 * <p>
 * With {@code proxy.storage.redis.url} set both live in Redis and are shared
 * by every worker. Without it, development mode falls back to in-process
 * maps; any other mode refuses to start.
 */
@Configuration
@Slf4j
public class StorageConfiguration {

    @Bean(destroyMethod = "close")
    @ConditionalOnExpression("'${proxy.storage.redis.url:}' != ''")
    public JedisPooled jedisPooled(ProxyProperties properties) {
        ProxyProperties.RedisProperties redis = properties.getStorage().getRedis();
        log.info("[Storage] Connecting to Redis");
        return new JedisPooled(URI.create(redis.getUrl()), redis.getTimeoutMs());
    }

    @Bean
    public UserStoragePort userStoragePort(ObjectProvider<JedisPooled> jedis, ObjectMapper objectMapper,
            ProxyProperties properties) {
        JedisPooled client = jedis.getIfAvailable();
        if (client != null) {
            ProxyProperties.RedisProperties redis = properties.getStorage().getRedis();
            RedisUserStorageAdapter adapter = new RedisUserStorageAdapter(client, objectMapper,
                    lockTimeoutSeconds(properties), redis.getRecordExpirySeconds());
            if (adapter.isActive()) {
                log.info("[Storage] Using Redis storage");
            } else {
                log.warn("[Storage] Redis did not answer PING, requests will fail until it does");
            }
            return adapter;
        }
        if (!properties.isDevelopment()) {
            throw new IllegalStateException("proxy.storage.redis.url is required outside development mode");
        }
        log.warn("[Storage] Using local in-process storage (development mode)");
        return new LocalUserStorageAdapter();
    }

    /**
     * The lock must outlive one upstream call plus link resolution, so it is
     * never shorter than twice the Gemini timeout.
     */
    static long lockTimeoutSeconds(ProxyProperties properties) {
        long configured = properties.getStorage().getRedis().getLockTimeoutSeconds();
        long minimum = properties.getGemini().getTimeoutSeconds() * 2;
        if (configured < minimum) {
            log.warn("[Storage] Lock timeout {}s is shorter than the upstream budget, using {}s", configured,
                    minimum);
            return minimum;
        }
        return configured;
    }

    @Bean
    public StatsBuckets statsBuckets(Clock clock, ProxyProperties properties) {
        return new StatsBuckets(clock, properties.getStats());
    }

    @Bean
    public StatisticsPort statisticsPort(ObjectProvider<JedisPooled> jedis, StatsBuckets buckets) {
        JedisPooled client = jedis.getIfAvailable();
        if (client != null) {
            return new RedisStatisticsAdapter(client, buckets);
        }
        log.info("[Stats] Using in-memory statistics");
        return new InMemoryStatisticsAdapter(buckets);
    }
}
