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

import java.io.IOException;
import java.net.URI;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.oauth2.sdk.ErrorObject;
import com.nimbusds.oauth2.sdk.ParseException;
import com.nimbusds.oauth2.sdk.TokenIntrospectionRequest;
import com.nimbusds.oauth2.sdk.TokenIntrospectionResponse;
import com.nimbusds.oauth2.sdk.TokenIntrospectionSuccessResponse;
import com.nimbusds.oauth2.sdk.auth.ClientAuthentication;
import com.nimbusds.oauth2.sdk.auth.ClientSecretBasic;
import com.nimbusds.oauth2.sdk.auth.Secret;
import com.nimbusds.oauth2.sdk.http.HTTPRequest;
import com.nimbusds.oauth2.sdk.id.ClientID;
import com.nimbusds.oauth2.sdk.token.BearerAccessToken;
import org.apache.sling.auth.bearer_gate.spi.IntrospectionClient;
import org.apache.sling.auth.bearer_gate.spi.IntrospectionException;
import org.jetbrains.annotations.NotNull;
import org.osgi.service.component.annotations.Activate;
import org.osgi.service.component.annotations.Component;
import org.osgi.service.component.annotations.Deactivate;
import org.osgi.service.metatype.annotations.AttributeDefinition;
import org.osgi.service.metatype.annotations.AttributeType;
import org.osgi.service.metatype.annotations.Designate;
import org.osgi.service.metatype.annotations.ObjectClassDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Introspection client that calls an RFC 7662 introspection endpoint with the Nimbus OAuth 2.0 SDK.
 *
 * <p>The client authenticates to the endpoint with HTTP Basic client credentials. The HTTP exchange
 * is blocking, so it runs on a small thread pool owned by this component and the caller only waits
 * on the returned future. Connect and read timeouts are enforced by the Nimbus HTTP request.</p>
 *
 * @see IntrospectionClient
 */
@Component(service = IntrospectionClient.class)
@Designate(ocd = NimbusIntrospectionClient.Config.class)
public class NimbusIntrospectionClient implements IntrospectionClient {

    private static final Logger logger = LoggerFactory.getLogger(NimbusIntrospectionClient.class);

    @ObjectClassDefinition(
            name = "Apache Sling Bearer Gate Introspection Client",
            description = "Calls the OAuth2 token introspection endpoint of the authorization server")
    @interface Config {
        @AttributeDefinition(
                name = "Introspection Endpoint",
                description = "Absolute URL of the OAuth2 token introspection endpoint (RFC 7662)")
        String introspectionEndpoint();

        @AttributeDefinition(
                name = "Client ID",
                description = "Client ID used to authenticate to the introspection endpoint")
        String clientId();

        @AttributeDefinition(
                name = "Client Secret",
                description = "Client secret used to authenticate to the introspection endpoint",
                type = AttributeType.PASSWORD)
        String clientSecret();

        @AttributeDefinition(
                name = "Connect Timeout (ms)",
                description = "Connect timeout for introspection requests in milliseconds. Default is 5000.")
        int connectTimeoutMillis() default 5000;

        @AttributeDefinition(
                name = "Read Timeout (ms)",
                description = "Read timeout for introspection requests in milliseconds. Default is 5000.")
        int readTimeoutMillis() default 5000;

        @AttributeDefinition(
                name = "Thread Pool Size",
                description = "Number of threads performing introspection requests. Default is 4.")
        int threadPoolSize() default 4;
    }

    private final URI endpoint;
    private final ClientAuthentication clientAuthentication;
    private final int connectTimeoutMillis;
    private final int readTimeoutMillis;
    private final ExecutorService executor;

    /**
     * Activates the introspection client with the given configuration.
     *
     * @param config the OSGi configuration
     * @throws IllegalArgumentException if the configuration is invalid
     */
    @Activate
    public NimbusIntrospectionClient(@NotNull Config config) {
        this.endpoint = toEndpoint(config.introspectionEndpoint());

        if (isNullOrEmpty(config.clientId())) {
            throw new IllegalArgumentException("Client ID not configured");
        }
        if (isNullOrEmpty(config.clientSecret())) {
            throw new IllegalArgumentException("Client secret not configured");
        }
        if (config.connectTimeoutMillis() <= 0 || config.readTimeoutMillis() <= 0) {
            throw new IllegalArgumentException("Introspection timeouts must be positive numbers");
        }
        if (config.threadPoolSize() <= 0) {
            throw new IllegalArgumentException("Thread pool size must be a positive number");
        }

        this.clientAuthentication =
                new ClientSecretBasic(new ClientID(config.clientId()), new Secret(config.clientSecret()));
        this.connectTimeoutMillis = config.connectTimeoutMillis();
        this.readTimeoutMillis = config.readTimeoutMillis();

        AtomicInteger threadCount = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(config.threadPoolSize(), runnable -> {
            Thread thread = new Thread(runnable, "bearer-gate-introspection-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });

        logger.info(
                "NimbusIntrospectionClient activated with endpoint: {}, client ID: {}, timeouts: {}ms/{}ms",
                endpoint,
                config.clientId(),
                connectTimeoutMillis,
                readTimeoutMillis);
    }

    @Deactivate
    void deactivate() {
        executor.shutdownNow();
        logger.debug("NimbusIntrospectionClient deactivated");
    }

    @Override
    public @NotNull CompletableFuture<IntrospectionResult> introspect(@NotNull String token) {
        return CompletableFuture.supplyAsync(() -> doIntrospect(token), executor);
    }

    @NotNull
    IntrospectionResult doIntrospect(@NotNull String token) {
        TokenIntrospectionRequest introspectionRequest =
                new TokenIntrospectionRequest(endpoint, clientAuthentication, new BearerAccessToken(token));
        HTTPRequest httpRequest = introspectionRequest.toHTTPRequest();
        httpRequest.setConnectTimeout(connectTimeoutMillis);
        httpRequest.setReadTimeout(readTimeoutMillis);

        TokenIntrospectionResponse introspectionResponse;
        try {
            introspectionResponse = TokenIntrospectionResponse.parse(httpRequest.send());
        } catch (IOException e) {
            throw new IntrospectionException("Token introspection request to " + endpoint + " failed", e);
        } catch (ParseException e) {
            throw new IntrospectionException("Invalid token introspection response from " + endpoint, e);
        }

        if (!introspectionResponse.indicatesSuccess()) {
            ErrorObject error = introspectionResponse.toErrorResponse().getErrorObject();
            throw new IntrospectionException("Token introspection rejected by " + endpoint + ": "
                    + (error != null ? error.getCode() + " (HTTP " + error.getHTTPStatusCode() + ")" : "no error"));
        }

        TokenIntrospectionSuccessResponse successResponse = introspectionResponse.toSuccessResponse();
        if (!successResponse.isActive()) {
            return IntrospectionResult.inactive();
        }
        return toActiveResult(successResponse);
    }

    /**
     * Keeps every member of the introspection response as a claim, extension members included.
     * {@code exp}, {@code iat} and {@code nbf} become dates, {@code aud} a list.
     */
    @NotNull
    private IntrospectionResult toActiveResult(@NotNull TokenIntrospectionSuccessResponse successResponse) {
        try {
            return new IntrospectionResult(true, JWTClaimsSet.parse(successResponse.toJSONObject()));
        } catch (java.text.ParseException e) {
            throw new IntrospectionException("Malformed claims in token introspection response from " + endpoint, e);
        }
    }

    @NotNull
    private static URI toEndpoint(String introspectionEndpoint) {
        if (isNullOrEmpty(introspectionEndpoint)) {
            throw new IllegalArgumentException("Introspection endpoint not configured");
        }
        URI uri;
        try {
            uri = URI.create(introspectionEndpoint);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid introspection endpoint: " + introspectionEndpoint, e);
        }
        if (!uri.isAbsolute()) {
            throw new IllegalArgumentException("Introspection endpoint must be an absolute URL: " + introspectionEndpoint);
        }
        return uri;
    }

    private static boolean isNullOrEmpty(String str) {
        return str == null || str.isEmpty();
    }
}
