package me.golemcore.proxy.security;

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
import me.golemcore.proxy.infrastructure.config.ProxyProperties;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;

/**
 * Holds the process-wide salt and derives {@link Xuid}s from caller secrets.
 *
 * <p>
 * Outside development mode the salt must be configured through
 * {@code proxy.xuid.secret}, otherwise identities would change on every
 * restart. In development a random 32-byte salt is generated.
 *
 * @since 1.0
 */
@Slf4j
public class XuidFactory {

    private static final int RANDOM_SALT_BYTES = 32;

    private final byte[] salt;

    public XuidFactory(byte[] salt) {
        this.salt = salt.clone();
    }

    public static XuidFactory fromProperties(ProxyProperties properties) {
        String secret = properties.getXuid().getSecret();
        if (secret != null && !secret.isBlank()) {
            return new XuidFactory(secret.getBytes(StandardCharsets.UTF_8));
        }
        if (!properties.isDevelopment()) {
            throw new IllegalStateException("proxy.xuid.secret is required outside development mode");
        }
        log.warn("[Security] No XUID secret configured, using a random salt (development mode)");
        byte[] random = new byte[RANDOM_SALT_BYTES];
        new SecureRandom().nextBytes(random);
        return new XuidFactory(random);
    }

    public Xuid derive(String secret) {
        return Xuid.derive(secret, salt);
    }

    /**
     * Constant-time check of an administrative secret against the salt.
     */
    public boolean matchesSecret(String candidate) {
        if (candidate == null || candidate.isEmpty()) {
            return false;
        }
        return MessageDigest.isEqual(salt, candidate.getBytes(StandardCharsets.UTF_8));
    }
}
