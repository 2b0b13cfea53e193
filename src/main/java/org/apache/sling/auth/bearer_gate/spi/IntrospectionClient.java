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
package org.apache.sling.auth.bearer_gate.spi;

import java.util.Date;
import java.util.concurrent.CompletableFuture;

import com.nimbusds.jwt.JWTClaimsSet;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Service Provider Interface for OAuth 2.0 token introspection (RFC 7662).
 */
public interface IntrospectionClient {

    /**
     * Asks the authorization server whether the token is active.
     *
     * @param token the bearer token
     * @return a future completing with the introspection result; it completes exceptionally, usually
     *      with an {@link IntrospectionException}, when the server cannot be reached or answers with an
     *      error
     */
    @NotNull
    CompletableFuture<IntrospectionResult> introspect(@NotNull String token);

    /**
     * Answer of the authorization server for one token.
     */
    class IntrospectionResult {

        private static final IntrospectionResult INACTIVE =
                new IntrospectionResult(false, new JWTClaimsSet.Builder().build());

        private final boolean active;
        private final JWTClaimsSet claimsSet;

        public IntrospectionResult(boolean active, @NotNull JWTClaimsSet claimsSet) {
            this.active = active;
            this.claimsSet = claimsSet;
        }

        public static @NotNull IntrospectionResult inactive() {
            return INACTIVE;
        }

        public boolean isActive() {
            return active;
        }

        @NotNull
        public JWTClaimsSet getClaimsSet() {
            return claimsSet;
        }

        @Nullable
        public String getSubject() {
            return claimsSet.getSubject();
        }

        @Nullable
        public Date getExpirationTime() {
            return claimsSet.getExpirationTime();
        }
    }
}
