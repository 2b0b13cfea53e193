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

import javax.servlet.http.HttpServletRequest;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import org.apache.sling.auth.bearer_gate.AuthenticationOutcome;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes a request to one verification path based on the shape of its bearer token.
 *
 * <p>A request without a bearer token yields {@link AuthenticationOutcome#noResult()} without
 * calling any collaborator. Internal-format tokens only reach the {@link LegacyPrincipalResolver},
 * all other tokens only reach the {@link IntrospectionVerifier}. Each attempt ends in exactly one
 * outcome, without retries.</p>
 */
class BearerAuthenticationGate {

    static final String AUTHORIZATION_HEADER = "Authorization";

    private static final Logger logger = LoggerFactory.getLogger(BearerAuthenticationGate.class);

    private final BearerTokenClassifier classifier;
    private final LegacyPrincipalResolver legacyPrincipalResolver;
    private final IntrospectionVerifier introspectionVerifier;

    BearerAuthenticationGate(
            @NotNull BearerTokenClassifier classifier,
            @NotNull LegacyPrincipalResolver legacyPrincipalResolver,
            @NotNull IntrospectionVerifier introspectionVerifier) {
        this.classifier = classifier;
        this.legacyPrincipalResolver = legacyPrincipalResolver;
        this.introspectionVerifier = introspectionVerifier;
    }

    /**
     * Authenticates the request. Cancelling the returned future cancels the upstream call it waits on.
     *
     * @param request the request to authenticate
     * @return the outcome, never completing exceptionally for a failed lookup
     */
    @NotNull
    CompletableFuture<AuthenticationOutcome> authenticate(@NotNull HttpServletRequest request) {
        Optional<String> token = classifier.extract(request.getHeader(AUTHORIZATION_HEADER));
        if (!token.isPresent()) {
            logger.debug("No bearer token found in Authorization header");
            return CompletableFuture.completedFuture(AuthenticationOutcome.noResult());
        }

        switch (classifier.classify(token.get())) {
            case INTERNAL:
                logger.debug("Internal-format token, resolving legacy principal");
                return legacyPrincipalResolver.resolve(request);
            case EXTERNAL:
            default:
                logger.debug("External-format token, verifying by introspection");
                return introspectionVerifier.verify(token.get());
        }
    }

    /**
     * Cancels {@code upstream} when {@code downstream} gets cancelled.
     *
     * @return {@code downstream}
     */
    @NotNull
    static <T> CompletableFuture<T> cancelUpstreamOnCancel(
            @NotNull CompletableFuture<?> upstream, @NotNull CompletableFuture<T> downstream) {
        downstream.whenComplete((result, error) -> {
            if (downstream.isCancelled()) {
                upstream.cancel(true);
            }
        });
        return downstream;
    }
}
