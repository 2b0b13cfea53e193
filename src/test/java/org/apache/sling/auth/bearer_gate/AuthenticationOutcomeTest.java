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
package org.apache.sling.auth.bearer_gate;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AuthenticationOutcomeTest {

    @Test
    void testSuccess() {
        GatePrincipal principal = new GatePrincipal("abc-123", "Bearer");
        AuthenticationOutcome outcome = AuthenticationOutcome.success(principal);

        assertTrue(outcome.isSuccess());
        assertEquals(AuthenticationOutcome.Status.SUCCESS, outcome.getStatus());
        assertSame(principal, outcome.getPrincipal());
        assertNull(outcome.getReason());
    }

    @Test
    void testSuccessWithoutPrincipal_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> AuthenticationOutcome.success(null));
    }

    @Test
    void testNoResult() {
        AuthenticationOutcome outcome = AuthenticationOutcome.noResult();

        assertFalse(outcome.isSuccess());
        assertEquals(AuthenticationOutcome.Status.NO_RESULT, outcome.getStatus());
        assertNull(outcome.getPrincipal());
    }

    @Test
    void testFailure() {
        AuthenticationOutcome outcome = AuthenticationOutcome.failure("token revoked");

        assertFalse(outcome.isSuccess());
        assertEquals(AuthenticationOutcome.Status.FAILURE, outcome.getStatus());
        assertEquals("token revoked", outcome.getReason());
    }
}
