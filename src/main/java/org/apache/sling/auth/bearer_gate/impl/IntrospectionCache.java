/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.sling.auth.bearer_gate.impl;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.apache.commons.codec.digest.DigestUtils;
import org.apache.sling.auth.bearer_gate.spi.IntrospectionClient.IntrospectionResult;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.osgi.service.component.annotations.Activate;
import org.osgi.service.component.annotations.Component;
import org.osgi.service.component.annotations.Deactivate;
import org.osgi.service.metatype.annotations.AttributeDefinition;
import org.osgi.service.metatype.annotations.Designate;
import org.osgi.service.metatype.annotations.ObjectClassDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-local cache of token introspection results.
 *
 * <p>One instance is shared by all concurrent authentication attempts. Entries are keyed by the
 * SHA-256 digest of the token and expire passively: an expired entry is dropped when it is read or
 * when room has to be made for a new one. Both active and inactive results are cached.</p>
 *
 * <p>Any failure inside the cache degrades to a miss, so the caller falls back to a live
 * introspection call.</p>
 */
@Component(service = IntrospectionCache.class)
@Designate(ocd = IntrospectionCache.Config.class)
public class IntrospectionCache {

    private static final Logger logger = LoggerFactory.getLogger(IntrospectionCache.class);

    @ObjectClassDefinition(
            name = "Apache Sling Bearer Gate Introspection Cache",
            description = "In-memory cache for OAuth2 token introspection results")
    @interface Config {
        @AttributeDefinition(
                name = "Cache TTL (seconds)",
                description =
                        "Time to live for cached introspection results in seconds. Results are never kept past the "
                                + "expiry of the token itself. Default is 300 (5 minutes). Set to 0 to disable caching.")
        long ttlSeconds() default 300;

        @AttributeDefinition(
                name = "Cache Max Size",
                description = "Maximum number of introspection results to cache. Default is 1000.")
        int maxSize() default 1000;
    }

    private final Map<String, CachedResult> entries = new ConcurrentHashMap<>();
    private final long ttlSeconds;
    private final int maxSize;
    private final Clock clock;

    @Activate
    public IntrospectionCache(@NotNull Config config) {
        this(config.ttlSeconds(), config.maxSize(), Clock.systemUTC());
    }

    IntrospectionCache(long ttlSeconds, int maxSize, @NotNull Clock clock) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("Cache max size must be a positive number, got " + maxSize);
        }
        this.ttlSeconds = ttlSeconds;
        this.maxSize = maxSize;
        this.clock = clock;

        if (isEnabled()) {
            logger.info("Introspection cache activated with TTL: {}s, max size: {}", ttlSeconds, maxSize);
        } else {
            logger.info("Introspection caching is disabled - cache TTL is 0 or negative");
        }
    }

    /**
     * Looks up a cached result.
     *
     * @param token the bearer token
     * @return the cached result, or {@code null} on a miss, an expired entry or a cache failure
     */
    @Nullable
    IntrospectionResult get(@NotNull String token) {
        if (!isEnabled()) {
            return null;
        }
        try {
            String key = cacheKey(token);
            CachedResult cached = entries.get(key);
            if (cached == null) {
                return null;
            }
            if (cached.isExpired(clock.instant())) {
                entries.remove(key, cached);
                logger.debug("Cached introspection result {} expired", shortKey(key));
                return null;
            }
            return cached.result;
        } catch (RuntimeException e) {
            logger.warn("Introspection cache lookup failed, treating as a miss: {}", e.getMessage());
            return null;
        }
    }

    /**
     * Caches a result. The entry lives for the configured TTL, or until the token expires if that
     * comes first. Results for tokens that are already expired are not cached.
     *
     * @param token the bearer token
     * @param result the introspection result, active or not
     */
    void put(@NotNull String token, @NotNull IntrospectionResult result) {
        if (!isEnabled()) {
            return;
        }
        try {
            Instant now = clock.instant();
            Instant expiresAt = now.plusSeconds(ttlSeconds);

            Date tokenExpiry = result.getExpirationTime();
            if (tokenExpiry != null) {
                Instant tokenExpiresAt = tokenExpiry.toInstant();
                if (!tokenExpiresAt.isAfter(now)) {
                    logger.debug("Token already expired, not caching introspection result");
                    return;
                }
                if (tokenExpiresAt.isBefore(expiresAt)) {
                    expiresAt = tokenExpiresAt;
                }
            }

            if (entries.size() >= maxSize) {
                makeRoom(now);
            }

            String key = cacheKey(token);
            entries.put(key, new CachedResult(result, now, expiresAt));
            logger.debug(
                    "Cached {} introspection result {} until {} (cache size: {})",
                    result.isActive() ? "active" : "inactive",
                    shortKey(key),
                    expiresAt,
                    entries.size());
        } catch (RuntimeException e) {
            logger.warn("Failed to cache introspection result: {}", e.getMessage());
        }
    }

    private void makeRoom(@NotNull Instant now) {
        entries.values().removeIf(cached -> cached.isExpired(now));

        int excess = entries.size() - maxSize + 1;
        if (excess <= 0) {
            return;
        }
        List<Map.Entry<String, CachedResult>> byAge = new ArrayList<>(entries.entrySet());
        byAge.sort(Comparator.comparing((Map.Entry<String, CachedResult> entry) -> entry.getValue().cachedAt));
        for (Map.Entry<String, CachedResult> eldest : byAge.subList(0, Math.min(excess, byAge.size()))) {
            entries.remove(eldest.getKey(), eldest.getValue());
        }
        logger.debug("Introspection cache full, dropped {} oldest result(s)", excess);
    }

    @Deactivate
    void deactivate() {
        clear();
    }

    /**
     * Clears the cache.
     */
    public void clear() {
        entries.clear();
        logger.info("Introspection cache cleared");
    }

    /**
     * Gets the current cache size, expired entries not yet evicted included.
     *
     * @return the number of cached results
     */
    public int size() {
        return entries.size();
    }

    boolean isEnabled() {
        return ttlSeconds > 0;
    }

    @NotNull
    static String cacheKey(@NotNull String token) {
        return DigestUtils.sha256Hex(token);
    }

    @NotNull
    private static String shortKey(@NotNull String key) {
        return key.substring(0, 8);
    }

    private static final class CachedResult {
        final IntrospectionResult result;
        final Instant cachedAt;
        final Instant expiresAt;

        CachedResult(IntrospectionResult result, Instant cachedAt, Instant expiresAt) {
            this.result = result;
            this.cachedAt = cachedAt;
            this.expiresAt = expiresAt;
        }

        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
