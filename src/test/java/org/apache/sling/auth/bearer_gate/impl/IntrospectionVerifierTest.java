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

import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.concurrent.CompletableFuture;

import com.nimbusds.jwt.JWTClaimsSet;
import org.apache.sling.auth.bearer_gate.AuthenticationOutcome;
import org.apache.sling.auth.bearer_gate.spi.IntrospectionClient;
import org.apache.sling.auth.bearer_gate.spi.IntrospectionClient.IntrospectionResult;
import org.apache.sling.auth.bearer_gate.spi.IntrospectionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class IntrospectionVerifierTest {

    private static final String TOKEN = "opaque-tkn";

    private MutableClock clock;
    private IntrospectionCache cache;
    private IntrospectionClient client;
    private IntrospectionVerifier verifier;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T10:00:00Z"));
        cache = new IntrospectionCache(300, 1000, clock);
        client = mock(IntrospectionClient.class);
        verifier = new IntrospectionVerifier(client, cache, "Bearer");
    }

    private static IntrospectionResult active(String subject) {
        return new IntrospectionResult(
                true,
                new JWTClaimsSet.Builder()
                        .subject(subject)
                        .claim("client_id", "exchange-web")
                        .claim("scope", "wallets history")
                        .build());
    }

    @Test
    void testActiveToken_ReturnsSuccessWithSubject() {
        when(client.introspect(TOKEN)).thenReturn(CompletableFuture.completedFuture(active("client-9")));

        AuthenticationOutcome outcome = verifier.verify(TOKEN).join();

        assertTrue(outcome.isSuccess());
        assertEquals("client-9", outcome.getPrincipal().getClientId());
        assertEquals("client-9", outcome.getPrincipal().getClaim("sub"));
        assertEquals("exchange-web", outcome.getPrincipal().getClaim("client_id"));
        assertEquals("Bearer", outcome.getPrincipal().getAuthenticationScheme());
    }

    @Test
    void testInactiveToken_ReturnsNoResult() {
        when(client.introspect(TOKEN)).thenReturn(CompletableFuture.completedFuture(IntrospectionResult.inactive()));

        AuthenticationOutcome outcome = verifier.verify(TOKEN).join();

        assertEquals(AuthenticationOutcome.Status.NO_RESULT, outcome.getStatus());
    }

    @Test
    void testActiveTokenWithoutSubject_ReturnsNoResult() {
        IntrospectionResult noSubject =
                new IntrospectionResult(true, new JWTClaimsSet.Builder().claim("client_id", "x").build());
        when(client.introspect(TOKEN)).thenReturn(CompletableFuture.completedFuture(noSubject));

        assertEquals(AuthenticationOutcome.Status.NO_RESULT, verifier.verify(TOKEN).join().getStatus());
    }

    @Test
    void testRepeatedCallWithinTtl_IntrospectsOnce() {
        when(client.introspect(TOKEN)).thenReturn(CompletableFuture.completedFuture(active("client-9")));

        AuthenticationOutcome first = verifier.verify(TOKEN).join();
        clock.advance(Duration.ofSeconds(120));
        AuthenticationOutcome second = verifier.verify(TOKEN).join();

        assertEquals(first.getStatus(), second.getStatus());
        assertEquals(first.getPrincipal(), second.getPrincipal());
        verify(client, times(1)).introspect(TOKEN);
    }

    @Test
    void testPrincipalClaims_DoNotShareStateWithCachedResult() {
        Date expiry = Date.from(Instant.parse("2026-01-01T11:00:00Z"));
        IntrospectionResult result = new IntrospectionResult(
                true, new JWTClaimsSet.Builder().subject("client-9").expirationTime(expiry).build());
        when(client.introspect(TOKEN)).thenReturn(CompletableFuture.completedFuture(result));

        AuthenticationOutcome first = verifier.verify(TOKEN).join();
        ((Date) first.getPrincipal().getClaim("exp")).setTime(0L);
        ((Date) first.getPrincipal().getClaims().get("exp")).setTime(0L);
        AuthenticationOutcome second = verifier.verify(TOKEN).join();

        verify(client, times(1)).introspect(TOKEN);
        assertEquals(expiry, second.getPrincipal().getClaim("exp"));
        assertEquals(expiry, first.getPrincipal().getClaim("exp"));
        assertEquals(expiry, cache.get(TOKEN).getExpirationTime());
    }

    @Test
    void testRepeatedCallAfterTtl_IntrospectsAgainOnce() {
        when(client.introspect(TOKEN)).thenReturn(CompletableFuture.completedFuture(active("client-9")));

        verifier.verify(TOKEN).join();
        clock.advance(Duration.ofSeconds(301));
        verifier.verify(TOKEN).join();
        verifier.verify(TOKEN).join();

        verify(client, times(2)).introspect(TOKEN);
    }

    @Test
    void testInactiveResult_IsCached() {
        when(client.introspect(TOKEN)).thenReturn(CompletableFuture.completedFuture(IntrospectionResult.inactive()));

        verifier.verify(TOKEN).join();
        AuthenticationOutcome second = verifier.verify(TOKEN).join();

        assertEquals(AuthenticationOutcome.Status.NO_RESULT, second.getStatus());
        verify(client, times(1)).introspect(TOKEN);
    }

    @Test
    void testTransportFailure_ReturnsNoResultAndIsNotCached() {
        CompletableFuture<IntrospectionResult> failed = new CompletableFuture<>();
        failed.completeExceptionally(new IntrospectionException("connection refused"));
        when(client.introspect(TOKEN))
                .thenReturn(failed)
                .thenReturn(CompletableFuture.completedFuture(active("client-9")));

        AuthenticationOutcome first = verifier.verify(TOKEN).join();
        AuthenticationOutcome second = verifier.verify(TOKEN).join();

        assertEquals(AuthenticationOutcome.Status.NO_RESULT, first.getStatus());
        assertTrue(second.isSuccess());
        verify(client, times(2)).introspect(TOKEN);
    }

    @Test
    void testClientThrowing_ReturnsNoResult() {
        when(client.introspect(TOKEN)).thenThrow(new IllegalStateException("executor shut down"));

        AuthenticationOutcome outcome = verifier.verify(TOKEN).join();

        assertEquals(AuthenticationOutcome.Status.NO_RESULT, outcome.getStatus());
        assertEquals(0, cache.size());
    }

    @Test
    void testClientReturningNullResult_ReturnsNoResult() {
        when(client.introspect(TOKEN)).thenReturn(CompletableFuture.completedFuture(null));

        assertEquals(AuthenticationOutcome.Status.NO_RESULT, verifier.verify(TOKEN).join().getStatus());
    }

    @Test
    void testDisabledCache_IntrospectsEveryTime() {
        IntrospectionVerifier uncached = new IntrospectionVerifier(client, new IntrospectionCache(0, 10, clock), "Bearer");
        when(client.introspect(TOKEN)).thenReturn(CompletableFuture.completedFuture(active("client-9")));

        uncached.verify(TOKEN).join();
        uncached.verify(TOKEN).join();

        verify(client, times(2)).introspect(TOKEN);
    }

    @Test
    void testCancellingOutcome_CancelsIntrospection() {
        CompletableFuture<IntrospectionResult> pending = new CompletableFuture<>();
        when(client.introspect(TOKEN)).thenReturn(pending);

        CompletableFuture<AuthenticationOutcome> outcome = verifier.verify(TOKEN);
        assertFalse(outcome.isDone());

        outcome.cancel(true);

        assertTrue(pending.isCancelled());
        assertEquals(0, cache.size());
    }
}
