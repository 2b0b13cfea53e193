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
import javax.servlet.http.HttpServletResponse;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import org.apache.sling.auth.bearer_gate.AuthenticationOutcome;
import org.apache.sling.auth.bearer_gate.spi.IntrospectionClient;
import org.apache.sling.auth.bearer_gate.spi.PrincipalProvider;
import org.apache.sling.auth.core.spi.AuthenticationHandler;
import org.apache.sling.auth.core.spi.AuthenticationInfo;
import org.apache.sling.auth.core.spi.DefaultAuthenticationFeedbackHandler;
import org.jetbrains.annotations.NotNull;
import org.osgi.service.component.annotations.Activate;
import org.osgi.service.component.annotations.Component;
import org.osgi.service.component.annotations.Reference;
import org.osgi.service.metatype.annotations.AttributeDefinition;
import org.osgi.service.metatype.annotations.Designate;
import org.osgi.service.metatype.annotations.ObjectClassDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Authentication handler that accepts two kinds of bearer tokens from the Authorization header.
 *
 * <p>Tokens whose length equals the configured internal token length are legacy session tokens and
 * are resolved by the {@link PrincipalProvider}. All other tokens are checked by OAuth2 token
 * introspection, with results cached in the shared {@link IntrospectionCache}.</p>
 *
 * <p>The handler never rejects a request itself: when a token cannot be verified it returns
 * {@code null}, so other handlers or anonymous access may still apply.</p>
 */
@Component(service = AuthenticationHandler.class, immediate = true)
@Designate(ocd = DualModeBearerAuthenticationHandler.Config.class)
public class DualModeBearerAuthenticationHandler extends DefaultAuthenticationFeedbackHandler
        implements AuthenticationHandler {

    private static final Logger logger = LoggerFactory.getLogger(DualModeBearerAuthenticationHandler.class);

    @ObjectClassDefinition(
            name = "Apache Sling Dual-Mode Bearer Authentication Handler",
            description = "Authenticates legacy session tokens and OAuth2 access tokens from the Authorization header")
    @interface Config {
        @AttributeDefinition(
                name = "Path",
                description =
                        "Repository path for which this authentication handler should be used by Sling. If this is "
                                + "empty, the authentication handler will be disabled. By default this is set to \"/\".")
        String[] path() default {"/"};

        @AttributeDefinition(
                name = "Internal Token Length",
                description =
                        "Length of legacy session tokens. Tokens of exactly this length are resolved by the principal "
                                + "provider, all others by token introspection. Default is 64.")
        int internalTokenLength() default 64;

        @AttributeDefinition(
                name = "Authentication Scheme",
                description = "Authentication type reported for authenticated requests. Default is \"Bearer\".")
        String authenticationScheme() default BearerTokenClassifier.BEARER_SCHEME;

        @AttributeDefinition(name = "Service Ranking", description = "Service ranking for this authentication handler")
        int service_ranking() default 0;
    }

    private final BearerAuthenticationGate gate;

    @Activate
    public DualModeBearerAuthenticationHandler(
            @Reference PrincipalProvider principalProvider,
            @Reference IntrospectionClient introspectionClient,
            @Reference IntrospectionCache introspectionCache,
            Config config) {

        String scheme = config.authenticationScheme();
        if (scheme == null || scheme.trim().isEmpty()) {
            throw new IllegalArgumentException("Authentication scheme not configured");
        }

        BearerTokenClassifier classifier = new BearerTokenClassifier(config.internalTokenLength());
        this.gate = new BearerAuthenticationGate(
                classifier,
                new LegacyPrincipalResolver(principalProvider, scheme),
                new IntrospectionVerifier(introspectionClient, introspectionCache, scheme));

        logger.info(
                "DualModeBearerAuthenticationHandler activated with internal token length: {}, scheme: {}, paths: {}",
                classifier.internalTokenLength(),
                scheme,
                String.join(", ", config.path()));
    }

    @Override
    public AuthenticationInfo extractCredentials(
            @NotNull HttpServletRequest request, @NotNull HttpServletResponse response) {
        CompletableFuture<AuthenticationOutcome> pending = null;
        try {
            pending = gate.authenticate(request);
            return AuthenticationInfoAssembler.assemble(pending.get());
        } catch (InterruptedException e) {
            // the request was cancelled, abandon the upstream call
            Thread.currentThread().interrupt();
            if (pending != null) {
                pending.cancel(true);
            }
            logger.debug("Interrupted while authenticating bearer token");
            return null;
        } catch (ExecutionException | RuntimeException e) {
            logger.error("Error authenticating bearer token: {}", e.getMessage(), e);
            return null;
        }
    }

    @Override
    public boolean requestCredentials(@NotNull HttpServletRequest request, @NotNull HttpServletResponse response)
            throws IOException {
        // clients must present a bearer token, there is no login form to send them to
        logger.debug("requestCredentials: bearer authentication handler does not request credentials");
        return false;
    }

    @Override
    public void dropCredentials(HttpServletRequest request, HttpServletResponse response) {
        // bearer tokens are discarded by the client, nothing to drop on the server
        logger.debug("dropCredentials called");
    }
}
