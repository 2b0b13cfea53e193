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

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import org.apache.sling.auth.bearer_gate.AuthenticationOutcome;
import org.apache.sling.auth.bearer_gate.GatePrincipal;
import org.apache.sling.auth.bearer_gate.spi.IntrospectionClient;
import org.apache.sling.auth.bearer_gate.spi.IntrospectionClient.IntrospectionResult;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verifies external-format tokens by introspection, with the {@link IntrospectionCache} in front of
 * the network call.
 *
 * <p>Inactive results are cached like active ones. Transport and protocol failures are not cached and
 * never authenticate the request.</p>
 */
class IntrospectionVerifier {

    private static final Logger logger = LoggerFactory.getLogger(IntrospectionVerifier.class);

    private final IntrospectionClient introspectionClient;
    private final IntrospectionCache cache;
    private final String authenticationScheme;

    IntrospectionVerifier(
            @NotNull IntrospectionClient introspectionClient,
            @NotNull IntrospectionCache cache,
            @NotNull String authenticationScheme) {
        this.introspectionClient = introspectionClient;
        this.cache = cache;
        this.authenticationScheme = authenticationScheme;
    }

    @NotNull
    CompletableFuture<AuthenticationOutcome> verify(@NotNull String token) {
        IntrospectionResult cached = cache.get(token);
        if (cached != null) {
            logger.debug("Using cached introspection result");
            return CompletableFuture.completedFuture(toOutcome(cached));
        }

        CompletableFuture<IntrospectionResult> introspection;
        try {
            introspection = introspectionClient.introspect(token);
        } catch (RuntimeException e) {
            logger.warn("Token introspection could not be started: {}", e.getMessage());
            return CompletableFuture.completedFuture(AuthenticationOutcome.noResult());
        }

        CompletableFuture<AuthenticationOutcome> outcome = introspection.handle((result, error) -> {
            if (error != null) {
                logger.warn("Token introspection failed: {}", unwrap(error).getMessage());
                return AuthenticationOutcome.noResult();
            }
            if (result == null) {
                logger.warn("Introspection client returned no result");
                return AuthenticationOutcome.noResult();
            }
            cache.put(token, result);
            return toOutcome(result);
        });
        return BearerAuthenticationGate.cancelUpstreamOnCancel(introspection, outcome);
    }

    @NotNull
    private AuthenticationOutcome toOutcome(@NotNull IntrospectionResult result) {
        if (!result.isActive()) {
            logger.debug("Token is not active");
            return AuthenticationOutcome.noResult();
        }

        String subject = result.getSubject();
        if (subject == null || subject.isEmpty()) {
            logger.debug("Token has no subject claim");
            return AuthenticationOutcome.noResult();
        }

        logger.debug("Bearer token validated by introspection for subject: {}", subject);
        return AuthenticationOutcome.success(
                new GatePrincipal(subject, authenticationScheme, result.getClaimsSet().getClaims()));
    }

    @NotNull
    static Throwable unwrap(@NotNull Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}
