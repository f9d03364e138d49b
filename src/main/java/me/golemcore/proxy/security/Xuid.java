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

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Arrays;
import java.util.Base64;

/**
 * Anonymous caller identity derived from a secret credential.
 *
 * <p>
 * The raw form is {@code HMAC-SHA256(key = salt, message = secret)}. String
 * forms use URL-safe base64 without padding:
 * <ul>
 * <li>{@link #full()} - complete value, used as the storage key</li>
 * <li>{@link #shortId()} - first {@value #SHORT_LENGTH} characters, for logs
 * only</li>
 * <li>{@link #lockId()} - storage key of the per-identity lock</li>
 * </ul>
 *
 * <p>
 * Comparing an identity with anything that is not an identity, {@code null}
 * included, throws {@link ClassCastException}. Mixing identities with other
 * values in one collection is a programming error and must not silently
 * compare unequal.
 *
 * @since 1.0
 */
public final class Xuid {

    public static final int SHORT_LENGTH = 8;

    private static final String ALGORITHM = "HmacSHA256";
    private static final String LOCK_SUFFIX = ":lock";

    private final byte[] raw;
    private final String full;

    private Xuid(byte[] raw) {
        this.raw = raw;
        this.full = Base64.getUrlEncoder().withoutPadding().encodeToString(raw);
    }

    public static Xuid derive(String secret, byte[] salt) {
        return derive(secret.getBytes(StandardCharsets.UTF_8), salt);
    }

    public static Xuid derive(byte[] secret, byte[] salt) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(salt, ALGORITHM));
            return new Xuid(mac.doFinal(secret));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 is not available", e);
        }
    }

    public String full() {
        return full;
    }

    public String shortId() {
        return full.substring(0, SHORT_LENGTH);
    }

    public String lockId() {
        return full + LOCK_SUFFIX;
    }

    /**
     * Log-friendly form, e.g. {@code <AbCd1234>}.
     */
    public String pretty() {
        return "<" + shortId() + ">";
    }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof Xuid)) {
            String type = other == null ? "null" : other.getClass().getSimpleName();
            throw new ClassCastException("Can't compare a Xuid with " + type);
        }
        return Arrays.equals(raw, ((Xuid) other).raw);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(raw);
    }

    @Override
    public String toString() {
        return shortId();
    }
}
