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
import org.apache.sling.auth.bearer_gate.GatePrincipal;
import org.apache.sling.auth.bearer_gate.spi.PrincipalProvider;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves internal-format tokens through the {@link PrincipalProvider}.
 *
 * <p>The provider is asked exactly once per attempt. A provider that cannot resolve a principal,
 * or that fails, leaves the request unauthenticated.</p>
 */
class LegacyPrincipalResolver {

    private static final Logger logger = LoggerFactory.getLogger(LegacyPrincipalResolver.class);

    private final PrincipalProvider principalProvider;
    private final String authenticationScheme;

    LegacyPrincipalResolver(@NotNull PrincipalProvider principalProvider, @NotNull String authenticationScheme) {
        this.principalProvider = principalProvider;
        this.authenticationScheme = authenticationScheme;
    }

    @NotNull
    CompletableFuture<AuthenticationOutcome> resolve(@NotNull HttpServletRequest request) {
        CompletableFuture<Optional<GatePrincipal>> lookup;
        try {
            lookup = principalProvider.getCurrentPrincipal(request);
        } catch (RuntimeException e) {
            logger.warn("Principal provider failed: {}", e.getMessage());
            return CompletableFuture.completedFuture(AuthenticationOutcome.noResult());
        }
        if (lookup == null) {
            logger.warn("Principal provider {} returned no result future", principalProvider.getClass().getName());
            return CompletableFuture.completedFuture(AuthenticationOutcome.noResult());
        }

        CompletableFuture<AuthenticationOutcome> outcome = lookup.handle((principal, error) -> {
            if (error != null) {
                logger.warn("Principal lookup failed: {}", IntrospectionVerifier.unwrap(error).getMessage());
                return AuthenticationOutcome.noResult();
            }
            if (principal == null || !principal.isPresent()) {
                logger.debug("No principal found for internal-format token");
                return AuthenticationOutcome.noResult();
            }
            GatePrincipal resolved = principal.get().withAuthenticationScheme(authenticationScheme);
            logger.debug("Internal-format token resolved for client: {}", resolved.getClientId());
            return AuthenticationOutcome.success(resolved);
        });
        return BearerAuthenticationGate.cancelUpstreamOnCancel(lookup, outcome);
    }
}
